package io.kvasssidecar.targets;

import io.kvasssidecar.enums.TargetState;
import io.kvasssidecar.models.ScrapeStatus;
import io.kvasssidecar.models.Target;
import io.kvasssidecar.models.TargetsSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces the tracked target set and rebuilds the status table against the previous one.
 * <p>
 * Rules:
 * 1. The desired set replaces the old one wholesale; jobs missing from it are dropped.
 * 2. A hash already tracked keeps its {@link ScrapeStatus} instance and counters.
 * 3. A new hash gets a fresh status seeded from the target's series count.
 * 4. A hash going from NORMAL to IN_TRANSFER has its scrape attempts reset to zero.
 * 5. Hashes no longer present are dropped.
 */
@Slf4j
public class TargetsReconciler {

    public ReconcileResult reconcile(TargetsSnapshot snapshot, Map<String, List<Target>> desired) {
        Map<String, List<Target>> targets = copyOf(desired);
        Map<Long, ScrapeStatus> previous = snapshot.getStatus();
        Map<Long, ScrapeStatus> status = new HashMap<>();
        List<TargetTransition> transitions = new ArrayList<>();
        int added = 0;

        for (Map.Entry<String, List<Target>> jobEntry : targets.entrySet()) {
            String job = jobEntry.getKey();
            List<Target> jobTargets = jobEntry.getValue();
            if (jobTargets == null) {
                continue;
            }

            for (Target target : jobTargets) {
                if (target == null) {
                    continue;
                }

                ScrapeStatus current = status.get(target.getHash());
                if (current == null) {
                    current = previous.get(target.getHash());
                }
                if (current == null) {
                    current = new ScrapeStatus(target.getSeries());
                    added++;
                }

                TargetState newState = target.getTargetState() != null ? target.getTargetState() : TargetState.NORMAL;
                if (beginsTransfer(current.getTargetState(), newState)) {
                    TargetTransition transition = new TargetTransition(job, target);
                    log.info("{} begin transfer", transition);
                    current.setScrapeAttempts(0);
                    transitions.add(transition);
                }

                current.setTargetState(newState);
                status.put(target.getHash(), current);
            }
        }

        int removed = 0;
        for (Long hash : previous.keySet()) {
            if (!status.containsKey(hash)) {
                removed++;
            }
        }

        snapshot.setTargets(targets);
        snapshot.setStatus(status);

        return new ReconcileResult(added, status.size() - added, removed, transitions);
    }

    private static Map<String, List<Target>> copyOf(Map<String, List<Target>> desired) {
        Map<String, List<Target>> copy = new LinkedHashMap<>();
        if (desired == null) {
            return copy;
        }
        for (Map.Entry<String, List<Target>> jobEntry : desired.entrySet()) {
            List<Target> jobTargets = jobEntry.getValue();
            copy.put(jobEntry.getKey(), jobTargets != null ? new ArrayList<>(jobTargets) : null);
        }
        return copy;
    }

    private boolean beginsTransfer(TargetState previousState, TargetState newState) {
        return switch (previousState) {
            case NORMAL -> newState == TargetState.IN_TRANSFER;
            case IN_TRANSFER -> false;
        };
    }
}
