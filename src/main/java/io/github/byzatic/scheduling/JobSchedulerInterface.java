package io.github.byzatic.scheduling;

import io.github.byzatic.scheduling.base_exceptions.SchedulingException;
import io.github.byzatic.scheduling.jobs.JobInfo;
import io.github.byzatic.scheduling.jobs.JobResult;
import io.github.byzatic.scheduling.jobs.RunningJob;
import io.github.byzatic.scheduling.triggers.Trigger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * In-process job scheduler.
 * <p>
 * Operations never throw for lookup misses or rejected requests; they complete with a failed
 * {@link OperationResult} instead. Parameters accepting either an object or its id take an
 * {@link EntityRef}; the {@code JobInfo}/{@code UUID} overloads delegate to that form.
 */
public interface JobSchedulerInterface extends AutoCloseable {

    /**
     * Validates the collaborators, initializes the job store and resumes the pending triggers
     * found in it. Completes exceptionally with a {@link SchedulingException} when a
     * collaborator is missing.
     */
    @NotNull
    CompletableFuture<Void> initializeAsync();

    /**
     * Cancels every trigger and running job, waits for them up to the grace period and shuts
     * the thread pools down. Idempotent; enqueue is rejected from the moment it is called.
     */
    @NotNull
    CompletableFuture<Void> finalizeAsync();

    void addListener(@NotNull JobEventListener l);

    void removeListener(@NotNull JobEventListener l);

    /* ============ Enqueue ============ */

    /**
     * Binds {@code trigger} to the job and starts firing it. Without a trigger the one of
     * {@code options} is used, and without that {@link Trigger#once()}.
     *
     * @return the scheduled job
     */
    @NotNull
    CompletableFuture<OperationResult<JobInfo>> enqueueAsync(@NotNull EntityRef<JobInfo> job,
                                                             @Nullable Trigger trigger,
                                                             @Nullable SchedulingOptions options);

    default @NotNull CompletableFuture<OperationResult<JobInfo>> enqueueAsync(@NotNull JobInfo job) {
        return enqueueAsync(EntityRef.of(job), null, null);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> enqueueAsync(@NotNull JobInfo job, @Nullable Trigger trigger) {
        return enqueueAsync(EntityRef.of(job), trigger, null);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> enqueueAsync(@NotNull JobInfo job, @Nullable Trigger trigger, @Nullable SchedulingOptions options) {
        return enqueueAsync(EntityRef.of(job), trigger, options);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> enqueueAsync(@NotNull UUID jobId, @Nullable Trigger trigger, @Nullable SchedulingOptions options) {
        return enqueueAsync(EntityRef.ofId(jobId), trigger, options);
    }

    /**
     * Enqueues the job named by {@code options.scheduledJob} or {@code options.scheduledJobId}.
     */
    default @NotNull CompletableFuture<OperationResult<JobInfo>> enqueueAsync(@NotNull SchedulingOptions options) {
        if (options.getScheduledJob() != null) {
            return enqueueAsync(EntityRef.of(options.getScheduledJob()), null, options);
        }
        if (options.getScheduledJobId() != null) {
            return enqueueAsync(EntityRef.ofId(options.getScheduledJobId()), null, options);
        }
        return CompletableFuture.completedFuture(
                OperationResult.failure(new SchedulingException("No scheduled job set in the options")));
    }

    /* ============ Scheduled jobs ============ */

    /**
     * Disables every trigger of the job. The job and its triggers stay scheduled.
     */
    @NotNull
    CompletableFuture<OperationResult<JobInfo>> disableScheduledJobAsync(@NotNull EntityRef<JobInfo> job, @Nullable SchedulingOptions options);

    default @NotNull CompletableFuture<OperationResult<JobInfo>> disableScheduledJobAsync(@NotNull JobInfo job) {
        return disableScheduledJobAsync(EntityRef.of(job), null);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> disableScheduledJobAsync(@NotNull UUID jobId) {
        return disableScheduledJobAsync(EntityRef.ofId(jobId), null);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> disableScheduledJobAsync(@NotNull JobInfo job, @Nullable SchedulingOptions options) {
        return disableScheduledJobAsync(EntityRef.of(job), options);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> disableScheduledJobAsync(@NotNull UUID jobId, @Nullable SchedulingOptions options) {
        return disableScheduledJobAsync(EntityRef.ofId(jobId), options);
    }

    /**
     * Resumes every disabled trigger of the job with its remaining count.
     */
    @NotNull
    CompletableFuture<OperationResult<JobInfo>> enableScheduledJobAsync(@NotNull EntityRef<JobInfo> job, @Nullable SchedulingOptions options);

    default @NotNull CompletableFuture<OperationResult<JobInfo>> enableScheduledJobAsync(@NotNull JobInfo job) {
        return enableScheduledJobAsync(EntityRef.of(job), null);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> enableScheduledJobAsync(@NotNull UUID jobId) {
        return enableScheduledJobAsync(EntityRef.ofId(jobId), null);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> enableScheduledJobAsync(@NotNull JobInfo job, @Nullable SchedulingOptions options) {
        return enableScheduledJobAsync(EntityRef.of(job), options);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> enableScheduledJobAsync(@NotNull UUID jobId, @Nullable SchedulingOptions options) {
        return enableScheduledJobAsync(EntityRef.ofId(jobId), options);
    }

    /**
     * Cancels every trigger and running execution of the job and unschedules it.
     */
    @NotNull
    CompletableFuture<OperationResult<JobInfo>> cancelScheduledJobAsync(@NotNull EntityRef<JobInfo> job, @Nullable SchedulingOptions options);

    default @NotNull CompletableFuture<OperationResult<JobInfo>> cancelScheduledJobAsync(@NotNull JobInfo job) {
        return cancelScheduledJobAsync(EntityRef.of(job), null);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> cancelScheduledJobAsync(@NotNull UUID jobId) {
        return cancelScheduledJobAsync(EntityRef.ofId(jobId), null);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> cancelScheduledJobAsync(@NotNull JobInfo job, @Nullable SchedulingOptions options) {
        return cancelScheduledJobAsync(EntityRef.of(job), options);
    }

    default @NotNull CompletableFuture<OperationResult<JobInfo>> cancelScheduledJobAsync(@NotNull UUID jobId, @Nullable SchedulingOptions options) {
        return cancelScheduledJobAsync(EntityRef.ofId(jobId), options);
    }

    /* ============ Running jobs and triggers ============ */

    /**
     * Signals the cancellation token of one execution. Its result is finalized by the job itself.
     *
     * @return the execution's result, possibly still running
     */
    @NotNull
    CompletableFuture<OperationResult<JobResult>> cancelRunningJobAsync(@NotNull EntityRef<RunningJob> runningJob, @Nullable SchedulingOptions options);

    default @NotNull CompletableFuture<OperationResult<JobResult>> cancelRunningJobAsync(@NotNull RunningJob runningJob) {
        return cancelRunningJobAsync(EntityRef.of(runningJob), null);
    }

    default @NotNull CompletableFuture<OperationResult<JobResult>> cancelRunningJobAsync(@NotNull UUID runningJobId) {
        return cancelRunningJobAsync(EntityRef.ofId(runningJobId), null);
    }

    default @NotNull CompletableFuture<OperationResult<JobResult>> cancelRunningJobAsync(@NotNull RunningJob runningJob, @Nullable SchedulingOptions options) {
        return cancelRunningJobAsync(EntityRef.of(runningJob), options);
    }

    default @NotNull CompletableFuture<OperationResult<JobResult>> cancelRunningJobAsync(@NotNull UUID runningJobId, @Nullable SchedulingOptions options) {
        return cancelRunningJobAsync(EntityRef.ofId(runningJobId), options);
    }

    /**
     * Stops one trigger and detaches it from its job. Executions already started keep running.
     */
    @NotNull
    CompletableFuture<OperationResult<Trigger>> cancelTriggerAsync(@NotNull EntityRef<Trigger> trigger, @Nullable SchedulingOptions options);

    default @NotNull CompletableFuture<OperationResult<Trigger>> cancelTriggerAsync(@NotNull Trigger trigger) {
        return cancelTriggerAsync(EntityRef.of(trigger), null);
    }

    default @NotNull CompletableFuture<OperationResult<Trigger>> cancelTriggerAsync(@NotNull UUID triggerId) {
        return cancelTriggerAsync(EntityRef.ofId(triggerId), null);
    }

    default @NotNull CompletableFuture<OperationResult<Trigger>> cancelTriggerAsync(@NotNull Trigger trigger, @Nullable SchedulingOptions options) {
        return cancelTriggerAsync(EntityRef.of(trigger), options);
    }

    default @NotNull CompletableFuture<OperationResult<Trigger>> cancelTriggerAsync(@NotNull UUID triggerId, @Nullable SchedulingOptions options) {
        return cancelTriggerAsync(EntityRef.ofId(triggerId), options);
    }

    /* ============ Queries ============ */

    @NotNull
    List<JobInfo> getScheduledJobs(@Nullable SchedulingOptions options);

    default @NotNull List<JobInfo> getScheduledJobs() {
        return getScheduledJobs(null);
    }

    @NotNull
    List<JobResult> getRunningJobs(@Nullable SchedulingOptions options);

    default @NotNull List<JobResult> getRunningJobs() {
        return getRunningJobs(null);
    }

    @NotNull
    List<JobResult> getCompletedJobs(@Nullable SchedulingOptions options);

    default @NotNull List<JobResult> getCompletedJobs() {
        return getCompletedJobs(null);
    }
}
