package io.github.byzatic.scheduling.jobs;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous job body. The returned future carries the job value.
 */
@FunctionalInterface
public interface AsyncJobFunction {
    @NotNull
    CompletableFuture<?> apply(@NotNull CancellationToken token);
}
