package io.kvasssidecar.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import static io.kvasssidecar.metrics.MetricsConstants.HOST_NAME_TAG;
import static io.kvasssidecar.metrics.MetricsConstants.SUCCESS_TAG;
import static io.kvasssidecar.metrics.MetricsConstants.TARGETS_TOTAL_METRIC_NAME;
import static io.kvasssidecar.metrics.MetricsConstants.TARGETS_UPDATED_METRIC_NAME;

/**
 * Records the outcome of every targets update.
 * <p>
 * Registers one counter per outcome and a gauge of tracked targets, all tagged with the sidecar id.
 */
@Slf4j
public class TargetsMetricsRecorder {

    private final Counter successfulUpdates;
    private final Counter failedUpdates;
    private final AtomicDouble trackedTargets = new AtomicDouble();

    public TargetsMetricsRecorder(MeterRegistry registry, String sidecarId) {
        this.successfulUpdates = updateCounter(registry, sidecarId, true);
        this.failedUpdates = updateCounter(registry, sidecarId, false);
        Gauge.builder(TARGETS_TOTAL_METRIC_NAME, trackedTargets::get)
                .description("Targets tracked by the sidecar after the last update")
                .tag(HOST_NAME_TAG, sidecarId)
                .register(registry);
        log.info("Targets metrics registered for sidecar: {}", sidecarId);
    }

    /**
     * @param success whether the whole update returned without error
     * @param tracked number of entries in the status table after the update
     */
    public void recordUpdate(boolean success, int tracked) {
        (success ? successfulUpdates : failedUpdates).increment();
        trackedTargets.set(tracked);
    }

    private static Counter updateCounter(MeterRegistry registry, String sidecarId, boolean success) {
        return Counter.builder(TARGETS_UPDATED_METRIC_NAME)
                .description("Targets updates handled by the sidecar")
                .tag(SUCCESS_TAG, String.valueOf(success))
                .tag(HOST_NAME_TAG, sidecarId)
                .register(registry);
    }
}
