package io.kvasssidecar.targets;

/**
 * Exception thrown when a targets update fails after the in-memory state was already replaced.
 */
public class TargetsUpdateException extends Exception {

    /**
     * Pipeline stage that failed.
     */
    public enum Stage {
        CALLBACK,
        PERSIST
    }

    private final Stage stage;

    public TargetsUpdateException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
