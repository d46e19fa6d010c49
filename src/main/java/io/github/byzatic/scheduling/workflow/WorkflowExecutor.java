package io.github.byzatic.scheduling.workflow;

import io.github.byzatic.scheduling.jobs.CancellationToken;
import io.github.byzatic.scheduling.jobs.JobInfo;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the logic of a data-described job. Supplied by the host application.
 * <p>
 * Implementations should observe the token and complete the future with a
 * {@link java.util.concurrent.CancellationException} when they stop because of it.
 */
public interface WorkflowExecutor {
    @NotNull
    CompletableFuture<Object> executeAsync(@NotNull JobInfo job,
                                           @Nullable Object target,
                                           @NotNull Map<String, Object> arguments,
                                           @NotNull ActivityContext context,
                                           @NotNull CancellationToken cancellationToken);
}
