package io.kvasssidecar.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kvasssidecar.models.TargetsSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * File-backed storage for the shard's targets snapshot.
 * <p>
 * Reads try the current format first and then the legacy one. Writes always use the current format and
 * replace the file through a temporary sibling, so readers never observe a partially written snapshot.
 */
@Slf4j
public class TargetsStore {

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path storeDir;
    private final CurrentSnapshotFormat currentFormat;
    private final List<SnapshotFormat> readFormats;

    public TargetsStore(Path storeDir, String storeFileName, String legacyStoreFileName) {
        this.storeDir = storeDir;

        // keys written by other sidecar builds may differ in case, e.g. "hash" for "Hash"
        ObjectMapper objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();

        this.currentFormat = new CurrentSnapshotFormat(objectMapper, storeFileName);
        this.readFormats = List.of(currentFormat, new LegacySnapshotFormat(objectMapper, legacyStoreFileName));
    }

    /**
     * Visible for tests: a store with a custom read order.
     */
    TargetsStore(Path storeDir, CurrentSnapshotFormat currentFormat, List<SnapshotFormat> readFormats) {
        this.storeDir = storeDir;
        this.currentFormat = currentFormat;
        this.readFormats = List.copyOf(readFormats);
    }

    /**
     * Load the last saved snapshot.
     *
     * @return the snapshot from the first format whose file exists, or an empty snapshot if none does
     * @throws TargetsStoreException if a file exists but cannot be read or parsed
     */
    public TargetsSnapshot load() throws TargetsStoreException {
        createStoreDir();

        for (SnapshotFormat format : readFormats) {
            Optional<TargetsSnapshot> snapshot = format.read(storeDir);
            if (snapshot.isPresent()) {
                log.info("Loaded {} jobs from {}", snapshot.get().getTargets().size(), storeDir.resolve(format.getFileName()));
                if (format != currentFormat) {
                    log.info("Migrating {} to {}", format.getFileName(), currentFormat.getFileName());
                }
                return snapshot.get();
            }
        }

        log.info("No stored targets found in {}, starting empty", storeDir);
        return new TargetsSnapshot();
    }

    /**
     * Write targets and idle time in the current format. Runtime status is not written.
     *
     * @throws TargetsStoreException if the file cannot be written
     */
    public void save(TargetsSnapshot snapshot) throws TargetsStoreException {
        Path file = getStorePath();
        Path temp = storeDir.resolve(currentFormat.getFileName() + TEMP_SUFFIX);

        createStoreDir();
        try {
            Files.write(temp, currentFormat.write(snapshot));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing {} directly", storeDir, file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TargetsStoreException("save " + currentFormat.getFileName() + " failed", file, e);
        }
        log.debug("Saved {} jobs to {}", snapshot.getTargets().size(), file);
    }

    public Path getStoreDir() {
        return storeDir;
    }

    public Path getStorePath() {
        return storeDir.resolve(currentFormat.getFileName());
    }

    private void createStoreDir() throws TargetsStoreException {
        try {
            Files.createDirectories(storeDir);
        } catch (IOException e) {
            throw new TargetsStoreException("create store directory failed", storeDir, e);
        }
    }
}
