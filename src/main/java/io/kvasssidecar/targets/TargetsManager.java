package io.kvasssidecar.targets;

import io.kvasssidecar.config.SidecarConfig;
import io.kvasssidecar.metrics.TargetsMetricsRecorder;
import io.kvasssidecar.models.Target;
import io.kvasssidecar.models.TargetsSnapshot;
import io.kvasssidecar.store.TargetsStore;
import io.kvasssidecar.store.TargetsStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Manages the targets assigned to this shard.
 * <p>
 * Every update replaces the whole target set, then:
 * 1. rebuilds the runtime status table ({@link TargetsReconciler})
 * 2. stamps or clears the idle time ({@link IdleTracker})
 * 3. runs the update callbacks ({@link UpdateCallbackDispatcher})
 * 4. writes the snapshot to disk ({@link TargetsStore})
 * 5. records the outcome ({@link TargetsMetricsRecorder})
 * <p>
 * Persistence is write-behind: when step 3 or 4 fails the in-memory state keeps the new targets and the
 * error is returned to the caller. All public methods hold the manager's lock.
 */
@Slf4j
public class TargetsManager {

    private final TargetsStore store;
    private final TargetsReconciler reconciler;
    private final IdleTracker idleTracker;
    private final UpdateCallbackDispatcher callbackDispatcher;
    private final TargetsMetricsRecorder metricsRecorder;
    private final TargetsSnapshot targets = new TargetsSnapshot();

    public TargetsManager(SidecarConfig config, TargetsMetricsRecorder metricsRecorder, Clock clock) {
        this(new TargetsStore(config.getStoreDir(), config.getStoreFileName(), config.getLegacyStoreFileName()),
                new TargetsReconciler(),
                new IdleTracker(clock),
                new UpdateCallbackDispatcher(),
                metricsRecorder);
    }

    TargetsManager(TargetsStore store,
                   TargetsReconciler reconciler,
                   IdleTracker idleTracker,
                   UpdateCallbackDispatcher callbackDispatcher,
                   TargetsMetricsRecorder metricsRecorder) {
        this.store = store;
        this.reconciler = reconciler;
        this.idleTracker = idleTracker;
        this.callbackDispatcher = callbackDispatcher;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * Load local targets from the store directory and run one update with them, which rebuilds status,
     * idle time and the file in the current format.
     *
     * @throws TargetsStoreException if a stored file cannot be read or parsed
     * @throws TargetsUpdateException if the update that follows the read fails
     */
    public synchronized void load() throws TargetsStoreException, TargetsUpdateException {
        TargetsSnapshot stored;
        try {
            stored = store.load();
        } catch (TargetsStoreException e) {
            log.error("Failed to load targets from {}: {}", store.getStoreDir(), e.getMessage(), e);
            throw e;
        }

        targets.setIdleAt(stored.getIdleAt());
        updateTargets(stored.getTargets());
    }

    /**
     * Add callbacks for the targets updated event. Callbacks run in the order they were added.
     */
    public synchronized void addUpdateCallbacks(TargetsUpdateCallback... callbacks) {
        callbackDispatcher.register(callbacks);
    }

    /**
     * Replace the local targets with {@code desired}.
     *
     * @param desired job name -> targets, the complete set this shard should own
     * @throws TargetsUpdateException if a callback or the snapshot write fails
     */
    public synchronized void updateTargets(Map<String, List<Target>> desired) throws TargetsUpdateException {
        boolean success = false;
        try {
            ReconcileResult result = reconciler.reconcile(targets, desired);
            idleTracker.update(targets);

            callbackDispatcher.dispatch(targets.getTargets());

            try {
                store.save(targets);
            } catch (TargetsStoreException e) {
                log.error("Failed to save targets: {}", e.getMessage(), e);
                throw new TargetsUpdateException(TargetsUpdateException.Stage.PERSIST, "save targets to file", e);
            }

            success = true;
            log.debug("Targets updated - jobs: {}, targets: {}, added: {}, removed: {}, transfers: {}",
                    targets.getTargets().size(), result.tracked(), result.added(), result.removed(),
                    result.transitions().size());
        } finally {
            metricsRecorder.recordUpdate(success, targets.getStatus().size());
        }
    }

    /**
     * Current targets of this shard.
     * <p>
     * The returned maps are read-only views over the manager's live state, not copies.
     */
    public synchronized TargetsSnapshot currentSnapshot() {
        return new TargetsSnapshot(
                Collections.unmodifiableMap(targets.getTargets()),
                targets.getIdleAt(),
                Collections.unmodifiableMap(targets.getStatus()));
    }
}
