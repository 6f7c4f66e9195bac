package io.kvasssidecar.targets;

import io.kvasssidecar.models.TargetsSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Keeps the snapshot's idle time in step with its status table.
 * <p>
 * The idle time is stamped once when the shard runs out of targets and cleared as soon as it owns one again.
 */
@Slf4j
public class IdleTracker {

    private final Clock clock;

    public IdleTracker(Clock clock) {
        this.clock = clock;
    }

    public void update(TargetsSnapshot snapshot) {
        if (snapshot.getStatus().isEmpty()) {
            if (snapshot.getIdleAt() == null) {
                snapshot.setIdleAt(clock.instant());
                log.info("Shard owns no targets, idle since {}", snapshot.getIdleAt());
            }
            return;
        }

        if (snapshot.getIdleAt() != null) {
            log.info("Shard owns {} targets, no longer idle (idle since {})", snapshot.getStatus().size(), snapshot.getIdleAt());
            snapshot.setIdleAt(null);
        }
    }
}
