package io.kvasssidecar.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All targets this shard currently owns, the time it became idle, and the runtime status of every target.
 * <p>
 * Only {@code Targets} and {@code IdleAt} are written to disk. {@code idleAt} is null while at least one
 * target is assigned.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TargetsSnapshot {

    /**
     * job name -> targets of that job, in coordinator order
     */
    @JsonProperty("Targets")
    private Map<String, List<Target>> targets;

    @JsonProperty("IdleAt")
    private Instant idleAt;

    /**
     * target hash -> runtime status
     */
    @JsonIgnore
    private Map<Long, ScrapeStatus> status;

    public TargetsSnapshot() {
        this.targets = new LinkedHashMap<>();
        this.status = new HashMap<>();
    }

    public TargetsSnapshot(Map<String, List<Target>> targets, Instant idleAt, Map<Long, ScrapeStatus> status) {
        this.targets = targets;
        this.idleAt = idleAt;
        this.status = status;
    }

    public void setTargets(Map<String, List<Target>> targets) {
        this.targets = targets != null ? targets : new LinkedHashMap<>();
    }

    public void setStatus(Map<Long, ScrapeStatus> status) {
        this.status = status != null ? status : new HashMap<>();
    }

    @JsonIgnore
    public boolean isIdle() {
        return idleAt != null;
    }
}
