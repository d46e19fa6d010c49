package io.github.byzatic.scheduling.jobs;

import io.github.byzatic.scheduling.triggers.Trigger;
import io.github.byzatic.scheduling.workflow.ActivityContext;
import io.github.byzatic.scheduling.workflow.WorkflowExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One in-flight execution created by a single fire.
 * <p>
 * Owns the execution's cancellation source and its {@link JobResult}. {@link #start} runs the
 * job body on the given executor and finalizes the result from its outcome: normal return is
 * {@link JobState#COMPLETED}, a {@link CancellationException} or an interrupt is
 * {@link JobState#CANCELED}, anything else {@link JobState#FAILED}.
 */
public final class RunningJob {
    private final static Logger logger = LoggerFactory.getLogger(RunningJob.class);

    private final UUID id;
    private final JobInfo scheduledJob;
    private final Trigger trigger;
    private final CancellationTokenSource cancellationTokenSource;
    private final ActivityContext context;
    private final JobResult result;
    private final CompletableFuture<JobResult> completion = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile @Nullable CompletableFuture<Object> execution;

    public RunningJob(@NotNull UUID id,
                      @NotNull JobInfo scheduledJob,
                      @NotNull Trigger trigger,
                      @NotNull CancellationTokenSource cancellationTokenSource,
                      @NotNull ActivityContext context) {
        this.id = Objects.requireNonNull(id, "id");
        this.scheduledJob = Objects.requireNonNull(scheduledJob, "scheduledJob");
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.cancellationTokenSource = Objects.requireNonNull(cancellationTokenSource, "cancellationTokenSource");
        this.context = Objects.requireNonNull(context, "context");
        this.result = new JobResult(this, Instant.now());
    }

    public @NotNull UUID getId() {
        return id;
    }

    public @NotNull JobInfo getScheduledJob() {
        return scheduledJob;
    }

    public @NotNull Trigger getTrigger() {
        return trigger;
    }

    public @NotNull CancellationTokenSource getCancellationTokenSource() {
        return cancellationTokenSource;
    }

    public @NotNull ActivityContext getContext() {
        return context;
    }

    public @NotNull JobResult getResult() {
        return result;
    }

    /**
     * Handle of the job body's execution, null until started.
     */
    public @Nullable CompletableFuture<Object> getExecution() {
        return execution;
    }

    /**
     * Completes with the finalized result.
     */
    public @NotNull CompletableFuture<JobResult> getCompletion() {
        return completion;
    }

    /**
     * Runs the job body on {@code executor}. Can be called once.
     *
     * @return {@link #getCompletion()}
     */
    public @NotNull CompletableFuture<JobResult> start(@Nullable WorkflowExecutor workflowExecutor, @NotNull Executor executor) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Running job " + id + " was already started");
        }
        CompletableFuture<Object> exec;
        try {
            exec = CompletableFuture
                    .supplyAsync(() -> scheduledJob.invoke(workflowExecutor, context), executor)
                    .thenCompose(f -> f);
        } catch (RejectedExecutionException rej) {
            exec = CompletableFuture.failedFuture(rej);
        }
        execution = exec;
        exec.whenComplete(this::finish);
        return completion;
    }

    /**
     * Requests cooperative cancellation. The job keeps running until it observes the token.
     */
    public void cancel(@NotNull String reason) {
        cancellationTokenSource.cancel(reason);
    }

    /**
     * Gives up waiting on the execution: the result is recorded as {@link JobState#CANCELED}
     * and the later outcome of the job body is discarded.
     *
     * @return false if the result was already final
     */
    public boolean abandon(@NotNull String reason) {
        cancellationTokenSource.cancel(reason);
        if (!result.cancel(new JobCanceledException("Abandoned: " + reason))) return false;
        completion.complete(result);
        return true;
    }

    private void finish(@Nullable Object value, @Nullable Throwable error) {
        boolean finalized;
        if (error == null) {
            finalized = result.complete(value);
        } else {
            Throwable cause = unwrap(error);
            if (isCancellation(cause)) {
                finalized = result.cancel(cause);
            } else {
                finalized = result.fail(cause);
                if (finalized) logger.error("Errors occurred while running job '{}' ({})", scheduledJob.getName(), id, cause);
            }
        }
        if (finalized) {
            completion.complete(result);
        } else {
            logger.debug("Discarding late outcome of abandoned job '{}' ({})", scheduledJob.getName(), id);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static boolean isCancellation(Throwable t) {
        return t instanceof CancellationException || t instanceof InterruptedException;
    }

    @Override
    public String toString() {
        return "RunningJob{id=" + id + ", job='" + scheduledJob.getName() + "', trigger=" + trigger.getId() + '}';
    }
}
