package io.kvasssidecar.targets;

import io.kvasssidecar.models.Target;

import java.util.List;
import java.util.Map;

/**
 * Observer notified with the full target set after every reconciliation.
 * <p>
 * Runs synchronously on the updating thread. The map is shared with the manager and must not be modified.
 */
@FunctionalInterface
public interface TargetsUpdateCallback {

    void onTargetsUpdated(Map<String, List<Target>> targets) throws Exception;
}
