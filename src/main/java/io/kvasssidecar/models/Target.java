package io.kvasssidecar.models;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kvasssidecar.enums.TargetState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scrape endpoint assigned to this shard.
 * <p>
 * The hash is an unsigned 64-bit identity computed by the coordinator. It is held in a {@code long}
 * with the same bits and written back to JSON as an unsigned number.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Target {

    public static final String SCHEME_LABEL = "__scheme__";
    public static final String ADDRESS_LABEL = "__address__";
    public static final String METRICS_PATH_LABEL = "__metrics_path__";

    @JsonIgnore
    private long hash;

    @JsonProperty("Labels")
    private Map<String, String> labels = new LinkedHashMap<>();

    @JsonProperty("Series")
    private long series;

    @JsonProperty("TotalSeries")
    private long totalSeries;

    @JsonProperty("TargetState")
    @JsonAlias("State")
    private TargetState targetState = TargetState.NORMAL;

    public Target(long hash, long series, TargetState targetState) {
        this.hash = hash;
        this.series = series;
        this.targetState = targetState;
    }

    @JsonProperty("Hash")
    BigInteger getHashAsUnsigned() {
        return new BigInteger(Long.toUnsignedString(hash));
    }

    @JsonProperty("Hash")
    void setHashAsUnsigned(BigInteger value) {
        this.hash = value == null ? 0L : value.longValue();
    }

    public void setTargetState(TargetState targetState) {
        this.targetState = targetState != null ? targetState : TargetState.NORMAL;
    }

    /**
     * Hash rendered the way the coordinator prints it.
     */
    @JsonIgnore
    public String getHashString() {
        return Long.toUnsignedString(hash);
    }

    /**
     * Scrape URL of this target without query parameters, built from its address labels.
     */
    public String noParamUrl() {
        String scheme = label(SCHEME_LABEL);
        String address = label(ADDRESS_LABEL);
        String path = label(METRICS_PATH_LABEL);

        StringBuilder url = new StringBuilder();
        if (!scheme.isEmpty()) {
            url.append(scheme).append(':');
        }
        if (!scheme.isEmpty() || !address.isEmpty()) {
            url.append("//").append(address);
        }
        if (!path.isEmpty() && !path.startsWith("/") && !address.isEmpty()) {
            url.append('/');
        }
        url.append(path);
        return url.toString();
    }

    private String label(String name) {
        if (labels == null) {
            return "";
        }
        String value = labels.get(name);
        return value != null ? value : "";
    }
}
