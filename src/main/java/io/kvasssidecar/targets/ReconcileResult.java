package io.kvasssidecar.targets;

import java.util.List;

/**
 * Summary of one reconciliation: status entries created, kept and dropped, and transfer transitions.
 */
public record ReconcileResult(int added, int kept, int removed, List<TargetTransition> transitions) {

    public int tracked() {
        return added + kept;
    }
}
