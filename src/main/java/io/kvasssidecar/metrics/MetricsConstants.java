package io.kvasssidecar.metrics;

/**
 * Constants for metrics names and tags used by the sidecar.
 */
public class MetricsConstants {
    public final static String TARGETS_UPDATED_METRIC_NAME = "kvass_sidecar_targets_updated";
    public final static String TARGETS_TOTAL_METRIC_NAME = "kvass_sidecar_targets_total";
    public final static String SUCCESS_TAG = "success";
    public final static String HOST_NAME_TAG = "hostname";

    private MetricsConstants() {}
}
