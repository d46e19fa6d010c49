package io.github.byzatic.scheduling.jobs;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Synchronous job body, run on a job thread. Check the token!
 */
@FunctionalInterface
public interface SyncJobFunction {
    @Nullable
    Object apply(@NotNull CancellationToken token) throws Exception;
}
