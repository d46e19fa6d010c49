package io.github.byzatic.scheduling.jobs;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Outcome record of one execution.
 * <p>
 * Created in {@link JobState#RUNNING} when the fire starts and finalized exactly once by the
 * owning {@link RunningJob}; after that it is an immutable snapshot.
 */
@ThreadSafe
public final class JobResult {
    private final RunningJob runningJob;
    private final Instant startedAt;

    @GuardedBy("this")
    private @Nullable Instant endedAt;

    @GuardedBy("this")
    private JobState state = JobState.RUNNING;

    @GuardedBy("this")
    private @Nullable Object value;

    @GuardedBy("this")
    private @Nullable Throwable exception;

    JobResult(RunningJob runningJob, Instant startedAt) {
        this.runningJob = runningJob;
        this.startedAt = startedAt;
    }

    public @NotNull UUID getScheduledJobId() {
        return runningJob.getScheduledJob().getId();
    }

    public @NotNull JobInfo getScheduledJob() {
        return runningJob.getScheduledJob();
    }

    public @NotNull UUID getRunningJobId() {
        return runningJob.getId();
    }

    public @NotNull RunningJob getRunningJob() {
        return runningJob;
    }

    public @NotNull UUID getTriggerId() {
        return runningJob.getTrigger().getId();
    }

    public @NotNull Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Optional<Instant> getEndedAt() {
        return Optional.ofNullable(endedAt);
    }

    public synchronized @NotNull JobState getState() {
        return state;
    }

    public synchronized @Nullable Object getValue() {
        return value;
    }

    public synchronized Optional<Throwable> getException() {
        return Optional.ofNullable(exception);
    }

    public boolean isCancellationRequested() {
        return runningJob.getCancellationTokenSource().isCancellationRequested();
    }

    public @NotNull String getCancellationReason() {
        return runningJob.getCancellationTokenSource().getToken().reason();
    }

    /**
     * {@code endedAt - startedAt} once ended, time since start while running.
     */
    public synchronized @NotNull Duration getElapsed() {
        return Duration.between(startedAt, endedAt != null ? endedAt : Instant.now());
    }

    /* ============ Finalization, package-private ============ */

    synchronized boolean complete(@Nullable Object value) {
        if (!end(JobState.COMPLETED)) return false;
        this.value = value;
        return true;
    }

    synchronized boolean fail(@NotNull Throwable exception) {
        if (!end(JobState.FAILED)) return false;
        this.exception = exception;
        return true;
    }

    synchronized boolean cancel(@Nullable Throwable cause) {
        if (!end(JobState.CANCELED)) return false;
        this.exception = cause;
        return true;
    }

    @GuardedBy("this")
    private boolean end(JobState terminal) {
        if (state.isTerminal()) return false;
        Instant now = Instant.now();
        endedAt = now.isBefore(startedAt) ? startedAt : now;
        state = terminal;
        return true;
    }

    @Override
    public synchronized String toString() {
        return "JobResult{job='" + runningJob.getScheduledJob().getName() + "', runningJobId=" + runningJob.getId() +
                ", triggerId=" + getTriggerId() + ", state=" + state + ", startedAt=" + startedAt +
                ", endedAt=" + endedAt + (exception != null ? ", exception='" + exception + '\'' : "") + '}';
    }
}
