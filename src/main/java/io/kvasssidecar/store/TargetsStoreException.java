package io.kvasssidecar.store;

import java.nio.file.Path;

/**
 * Exception thrown when the snapshot file cannot be read, parsed or written.
 */
public class TargetsStoreException extends Exception {

    private final Path file;

    public TargetsStoreException(String message, Path file, Throwable cause) {
        super(message + " (" + file + ")", cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
