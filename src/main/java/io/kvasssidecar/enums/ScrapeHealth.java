package io.kvasssidecar.enums;

/**
 * Health of a target as observed by its most recent scrape.
 */
public enum ScrapeHealth {
    UNKNOWN,
    UP,
    DOWN
}
