package io.github.byzatic.scheduling.jobstore;

import com.google.common.annotations.Beta;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.scheduling.base_exceptions.SchedulingException;
import io.github.byzatic.scheduling.jobs.JobInfo;
import io.github.byzatic.scheduling.jobs.JobResult;
import io.github.byzatic.scheduling.triggers.Trigger;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of scheduled jobs, their triggers and the results of their executions.
 * <p>
 * Called concurrently by firing loops and by query/cancel operations; every method must be
 * thread-safe. Returned collections are snapshots.
 */
@Beta
@ThreadSafe
public interface JobStore {

    /**
     * Called once by the scheduler before it resumes the stored triggers.
     */
    default void initialize() throws SchedulingException {
    }

    /* ============ Scheduled jobs ============ */

    /**
     * @return false if a job with the same id is stored already
     */
    boolean addScheduledJob(@NotNull JobInfo job);

    Optional<JobInfo> getScheduledJob(@NotNull UUID jobId);

    /**
     * Removes the job after cancelling and detaching all of its triggers.
     *
     * @return false if the job was not stored
     */
    boolean removeScheduledJob(@NotNull UUID jobId);

    @NotNull
    List<JobInfo> getScheduledJobs();

    /* ============ Triggers ============ */

    /**
     * Binds the trigger to the job and attaches it to the job's trigger set.
     *
     * @throws SchedulingException if the trigger is bound to another job
     */
    void addTrigger(@NotNull Trigger trigger, @NotNull JobInfo job) throws SchedulingException;

    Optional<Trigger> getTrigger(@NotNull UUID triggerId);

    /**
     * Job the trigger is bound to.
     */
    Optional<JobInfo> getTriggerOwner(@NotNull UUID triggerId);

    /**
     * Unbinds the trigger and detaches it from its job. The trigger itself is not cancelled.
     *
     * @return false if the trigger was not bound
     */
    boolean removeTrigger(@NotNull UUID triggerId);

    @NotNull
    List<Trigger> getTriggers();

    /* ============ Job results ============ */

    void addRunningJob(@NotNull JobResult runningJob) throws SchedulingException;

    Optional<JobResult> getRunningJob(@NotNull UUID runningJobId);

    /**
     * Moves a finalized result from the running bucket to the completed one.
     *
     * @return false if the result was not in the running bucket
     */
    boolean completeRunningJob(@NotNull JobResult result);

    @NotNull
    List<JobResult> getRunningJobs();

    /**
     * Completed results, oldest first.
     */
    @NotNull
    List<JobResult> getCompletedJobs();
}
