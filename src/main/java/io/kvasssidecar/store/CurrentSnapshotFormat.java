package io.kvasssidecar.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kvasssidecar.models.TargetsSnapshot;

import java.io.IOException;

/**
 * {@code {"Targets": {job: [target...]}, "IdleAt": timestamp|null}}
 */
public class CurrentSnapshotFormat extends JsonSnapshotFormat {

    public CurrentSnapshotFormat(ObjectMapper objectMapper, String fileName) {
        super(objectMapper, fileName);
    }

    @Override
    protected TargetsSnapshot parse(byte[] data) throws IOException {
        TargetsSnapshot snapshot = objectMapper.readValue(data, TargetsSnapshot.class);
        return snapshot != null ? snapshot : new TargetsSnapshot();
    }

    public byte[] write(TargetsSnapshot snapshot) throws IOException {
        return objectMapper.writeValueAsBytes(snapshot);
    }
}
