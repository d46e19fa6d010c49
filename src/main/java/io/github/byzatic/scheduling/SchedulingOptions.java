package io.github.byzatic.scheduling;

import io.github.byzatic.scheduling.jobs.JobInfo;
import io.github.byzatic.scheduling.jobs.JobResult;
import io.github.byzatic.scheduling.triggers.Trigger;
import io.github.byzatic.scheduling.workflow.ActivityContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Per-call options of scheduler operations. Every entry is optional.
 * <ul>
 *   <li>{@code scheduledJob} / {@code scheduledJobId}: job to enqueue when none is passed,
 *       and filter of the query operations;</li>
 *   <li>{@code activityTarget}, {@code activityArguments}, {@code activityOptions}: seed the
 *       {@link ActivityContext} of every fire of an enqueued trigger;</li>
 *   <li>{@code trigger}: trigger to enqueue with when none is passed, and filter of the
 *       running/completed queries;</li>
 *   <li>{@code reason}: cancellation reason recorded by the cancel operations.</li>
 * </ul>
 */
public final class SchedulingOptions {
    private UUID scheduledJobId;
    private JobInfo scheduledJob;
    private Object activityTarget;
    private Map<String, Object> activityArguments;
    private Consumer<ActivityContext> activityOptions;
    private Trigger trigger;
    private String reason;

    public static SchedulingOptions create() {
        return new SchedulingOptions();
    }

    public SchedulingOptions scheduledJobId(@Nullable UUID scheduledJobId) {
        this.scheduledJobId = scheduledJobId;
        return this;
    }

    public SchedulingOptions scheduledJob(@Nullable JobInfo scheduledJob) {
        this.scheduledJob = scheduledJob;
        return this;
    }

    public SchedulingOptions activityTarget(@Nullable Object activityTarget) {
        this.activityTarget = activityTarget;
        return this;
    }

    public SchedulingOptions activityArguments(@Nullable Map<String, Object> activityArguments) {
        this.activityArguments = activityArguments;
        return this;
    }

    public SchedulingOptions activityOptions(@Nullable Consumer<ActivityContext> activityOptions) {
        this.activityOptions = activityOptions;
        return this;
    }

    public SchedulingOptions activity(@Nullable Object target, @Nullable Map<String, Object> arguments, @Nullable Consumer<ActivityContext> options) {
        this.activityTarget = target;
        this.activityArguments = arguments;
        this.activityOptions = options;
        return this;
    }

    public SchedulingOptions trigger(@Nullable Trigger trigger) {
        this.trigger = trigger;
        return this;
    }

    public SchedulingOptions reason(@Nullable String reason) {
        this.reason = reason;
        return this;
    }

    public @Nullable UUID getScheduledJobId() {
        return scheduledJobId;
    }

    public @Nullable JobInfo getScheduledJob() {
        return scheduledJob;
    }

    public @Nullable Object getActivityTarget() {
        return activityTarget;
    }

    public @Nullable Map<String, Object> getActivityArguments() {
        return activityArguments;
    }

    public @Nullable Consumer<ActivityContext> getActivityOptions() {
        return activityOptions;
    }

    public @Nullable Trigger getTrigger() {
        return trigger;
    }

    public @Nullable String getReason() {
        return reason;
    }

    /**
     * Id of the job these options point at, from {@code scheduledJob} or {@code scheduledJobId}.
     */
    @Nullable
    UUID targetJobId() {
        return scheduledJob != null ? scheduledJob.getId() : scheduledJobId;
    }

    boolean matchesJob(@NotNull JobInfo job) {
        UUID jobId = targetJobId();
        return jobId == null || jobId.equals(job.getId());
    }

    boolean matches(@NotNull JobResult result) {
        UUID jobId = targetJobId();
        if (jobId != null && !jobId.equals(result.getScheduledJobId())) return false;
        return trigger == null || trigger.getId().equals(result.getTriggerId());
    }

    String reasonOr(@NotNull String fallback) {
        return reason != null ? reason : fallback;
    }
}
