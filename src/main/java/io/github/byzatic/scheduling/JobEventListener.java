package io.github.byzatic.scheduling;

import io.github.byzatic.scheduling.jobs.JobResult;
import io.github.byzatic.scheduling.triggers.Trigger;
import io.github.byzatic.scheduling.triggers.TriggerState;

/**
 * Job and trigger event listener. Called from scheduler threads; keep it short.
 */
public interface JobEventListener {
    default void onStart(JobResult result) {
    }

    default void onComplete(JobResult result) {
    }

    default void onError(JobResult result, Throwable error) {
    }

    default void onCancelled(JobResult result) {
    }

    /**
     * The firing loop of {@code trigger} ended; {@code exitState} tells why.
     */
    default void onTriggerStopped(Trigger trigger, TriggerState exitState) {
    }
}
