package io.kvasssidecar.models;

import io.kvasssidecar.enums.ScrapeHealth;
import io.kvasssidecar.enums.TargetState;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Runtime bookkeeping for one target hash.
 * <p>
 * Never persisted. The same instance is carried across reconciliations for as long as its hash keeps
 * appearing in the desired target set.
 */
@Data
public class ScrapeStatus {

    private ScrapeHealth health;
    private String lastError;
    private Instant lastScrape;
    private double lastScrapeDuration;
    private long series;
    private TargetState targetState;
    private long scrapeAttempts;

    public ScrapeStatus(long series) {
        this.health = ScrapeHealth.UNKNOWN;
        this.lastError = "";
        this.series = series;
        this.targetState = TargetState.NORMAL;
        this.scrapeAttempts = 0;
    }

    /**
     * Record the outcome of one scrape attempt.
     *
     * @param start when the scrape started
     * @param end when the scrape finished
     * @param error the failure, or null if the scrape succeeded
     */
    public void recordScrape(Instant start, Instant end, Throwable error) {
        this.scrapeAttempts++;
        this.lastScrape = start;
        this.lastScrapeDuration = Duration.between(start, end).toNanos() / 1_000_000_000.0;
        if (error == null) {
            this.lastError = "";
            this.health = ScrapeHealth.UP;
        } else {
            this.lastError = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
            this.health = ScrapeHealth.DOWN;
        }
    }

    public void updateSeries(long series) {
        this.series = series;
    }
}
