package io.kvasssidecar.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kvasssidecar.models.Target;
import io.kvasssidecar.models.TargetsSnapshot;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Format written by older sidecars: a bare {@code {job: [target...]}} map with no idle time.
 * Read only; the store always writes the current format.
 */
public class LegacySnapshotFormat extends JsonSnapshotFormat {

    private static final TypeReference<LinkedHashMap<String, List<Target>>> TARGETS_TYPE = new TypeReference<>() {};

    public LegacySnapshotFormat(ObjectMapper objectMapper, String fileName) {
        super(objectMapper, fileName);
    }

    @Override
    protected TargetsSnapshot parse(byte[] data) throws IOException {
        Map<String, List<Target>> targets = objectMapper.readValue(data, TARGETS_TYPE);
        TargetsSnapshot snapshot = new TargetsSnapshot();
        snapshot.setTargets(targets);
        return snapshot;
    }
}
