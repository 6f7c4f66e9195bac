package io.kvasssidecar.targets;

import io.kvasssidecar.models.Target;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Runs the registered update callbacks in registration order, stopping at the first failure.
 */
@Slf4j
public class UpdateCallbackDispatcher {

    private final List<TargetsUpdateCallback> callbacks = new ArrayList<>();

    public void register(TargetsUpdateCallback... newCallbacks) {
        callbacks.addAll(Arrays.asList(newCallbacks));
    }

    /**
     * @throws TargetsUpdateException wrapping the first callback failure, later callbacks are not run
     */
    public void dispatch(Map<String, List<Target>> targets) throws TargetsUpdateException {
        for (int i = 0; i < callbacks.size(); i++) {
            try {
                callbacks.get(i).onTargetsUpdated(targets);
            } catch (Exception e) {
                log.error("Update callback {} of {} failed: {}", i + 1, callbacks.size(), e.getMessage(), e);
                throw new TargetsUpdateException(TargetsUpdateException.Stage.CALLBACK, "do callbacks", e);
            }
        }
    }
}
