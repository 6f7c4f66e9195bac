package io.kvasssidecar.targets;

import io.kvasssidecar.models.Target;

/**
 * A target that moved from normal scraping into transfer during a reconciliation.
 */
public record TargetTransition(String job, Target target) {

    @Override
    public String toString() {
        return job + "/" + target.noParamUrl();
    }
}
