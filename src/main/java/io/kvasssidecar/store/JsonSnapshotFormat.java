package io.kvasssidecar.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kvasssidecar.models.TargetsSnapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Base for JSON snapshot formats: a missing file means "not this format", any other failure is fatal.
 */
abstract class JsonSnapshotFormat implements SnapshotFormat {

    protected final ObjectMapper objectMapper;
    private final String fileName;

    protected JsonSnapshotFormat(ObjectMapper objectMapper, String fileName) {
        this.objectMapper = objectMapper;
        this.fileName = fileName;
    }

    @Override
    public String getFileName() {
        return fileName;
    }

    @Override
    public Optional<TargetsSnapshot> read(Path storeDir) throws TargetsStoreException {
        Path file = storeDir.resolve(fileName);
        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TargetsStoreException("load " + fileName + " failed", file, e);
        }

        try {
            return Optional.of(parse(data));
        } catch (IOException e) {
            throw new TargetsStoreException("unmarshal " + fileName + " failed", file, e);
        }
    }

    protected abstract TargetsSnapshot parse(byte[] data) throws IOException;
}
