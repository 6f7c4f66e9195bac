package io.kvasssidecar.store;

import io.kvasssidecar.models.TargetsSnapshot;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One on-disk representation of the shard's targets.
 * <p>
 * {@link TargetsStore} tries its formats in priority order and uses the first one whose file exists.
 */
public interface SnapshotFormat {

    /**
     * Name of the file this format lives in, relative to the store directory.
     */
    String getFileName();

    /**
     * Read the snapshot from {@code storeDir}.
     *
     * @return the snapshot, or empty if this format's file does not exist
     * @throws TargetsStoreException if the file exists but cannot be read or parsed
     */
    Optional<TargetsSnapshot> read(Path storeDir) throws TargetsStoreException;
}
