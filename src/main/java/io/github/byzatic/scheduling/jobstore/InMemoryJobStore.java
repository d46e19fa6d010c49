package io.github.byzatic.scheduling.jobstore;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.scheduling.base_exceptions.SchedulingException;
import io.github.byzatic.scheduling.jobs.JobInfo;
import io.github.byzatic.scheduling.jobs.JobResult;
import io.github.byzatic.scheduling.triggers.Trigger;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * {@link JobStore} keeping everything in concurrent maps.
 * <p>
 * Completed results are retained up to a fixed capacity, oldest evicted first.
 */
@ThreadSafe
public final class InMemoryJobStore implements JobStore {
    private final static Logger logger = LoggerFactory.getLogger(InMemoryJobStore.class);

    public static final int DEFAULT_COMPLETED_JOBS_CAPACITY = 1000;

    private final Map<UUID, JobInfo> scheduledJobs = new ConcurrentHashMap<>();
    private final Map<UUID, TriggerBinding> triggers = new ConcurrentHashMap<>();
    private final Map<UUID, JobResult> runningJobs = new ConcurrentHashMap<>();

    private final Object completedLock = new Object();
    @GuardedBy("completedLock")
    private final EvictingQueue<JobResult> completedJobs;

    public InMemoryJobStore() {
        this(new Builder());
    }

    private InMemoryJobStore(Builder b) {
        this.completedJobs = EvictingQueue.create(b.completedJobsCapacity);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void initialize() {
        logger.debug("In-memory job store initialized with {} scheduled job(s)", scheduledJobs.size());
    }

    /* ============ Scheduled jobs ============ */

    @Override
    public boolean addScheduledJob(@NotNull JobInfo job) {
        Objects.requireNonNull(job, "job");
        return scheduledJobs.putIfAbsent(job.getId(), job) == null;
    }

    @Override
    public Optional<JobInfo> getScheduledJob(@NotNull UUID jobId) {
        return Optional.ofNullable(scheduledJobs.get(Objects.requireNonNull(jobId, "jobId")));
    }

    @Override
    public boolean removeScheduledJob(@NotNull UUID jobId) {
        Objects.requireNonNull(jobId, "jobId");
        JobInfo job = scheduledJobs.get(jobId);
        if (job == null) return false;
        for (Trigger trigger : job.getTriggers()) {
            trigger.requestCancellation();
            if (!removeTrigger(trigger.getId())) {
                job.removeTrigger(trigger);
            }
        }
        return scheduledJobs.remove(jobId, job);
    }

    @Override
    public @NotNull List<JobInfo> getScheduledJobs() {
        return ImmutableList.copyOf(scheduledJobs.values());
    }

    /* ============ Triggers ============ */

    @Override
    public void addTrigger(@NotNull Trigger trigger, @NotNull JobInfo job) throws SchedulingException {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(job, "job");
        TriggerBinding existing = triggers.putIfAbsent(trigger.getId(), new TriggerBinding(trigger, job));
        if (existing != null && existing.job != job) {
            throw new SchedulingException("Trigger " + trigger.getId() + " is already bound to job '" + existing.job.getName() + "'");
        }
        if (!job.addTrigger(trigger)) {
            logger.warn("Trigger {} was already attached to job '{}'", trigger.getId(), job.getName());
        }
    }

    @Override
    public Optional<Trigger> getTrigger(@NotNull UUID triggerId) {
        TriggerBinding binding = triggers.get(Objects.requireNonNull(triggerId, "triggerId"));
        return binding == null ? Optional.empty() : Optional.of(binding.trigger);
    }

    @Override
    public Optional<JobInfo> getTriggerOwner(@NotNull UUID triggerId) {
        TriggerBinding binding = triggers.get(Objects.requireNonNull(triggerId, "triggerId"));
        return binding == null ? Optional.empty() : Optional.of(binding.job);
    }

    @Override
    public boolean removeTrigger(@NotNull UUID triggerId) {
        TriggerBinding binding = triggers.remove(Objects.requireNonNull(triggerId, "triggerId"));
        if (binding == null) return false;
        if (!binding.job.removeTrigger(binding.trigger)) {
            logger.warn("Trigger {} was not attached to job '{}'", triggerId, binding.job.getName());
        }
        return true;
    }

    @Override
    public @NotNull List<Trigger> getTriggers() {
        ImmutableList.Builder<Trigger> out = ImmutableList.builder();
        for (TriggerBinding binding : triggers.values()) out.add(binding.trigger);
        return out.build();
    }

    /* ============ Job results ============ */

    @Override
    public void addRunningJob(@NotNull JobResult runningJob) throws SchedulingException {
        Objects.requireNonNull(runningJob, "runningJob");
        if (runningJobs.putIfAbsent(runningJob.getRunningJobId(), runningJob) != null) {
            throw new SchedulingException("Could not add the running job " + runningJob.getRunningJobId());
        }
    }

    @Override
    public Optional<JobResult> getRunningJob(@NotNull UUID runningJobId) {
        return Optional.ofNullable(runningJobs.get(Objects.requireNonNull(runningJobId, "runningJobId")));
    }

    @Override
    public boolean completeRunningJob(@NotNull JobResult result) {
        Objects.requireNonNull(result, "result");
        checkState(result.getState().isTerminal(), "Result %s is not finalized", result.getRunningJobId());
        synchronized (completedLock) {
            if (!runningJobs.remove(result.getRunningJobId(), result)) return false;
            completedJobs.add(result);
            return true;
        }
    }

    @Override
    public @NotNull List<JobResult> getRunningJobs() {
        return ImmutableList.copyOf(runningJobs.values());
    }

    @Override
    public @NotNull List<JobResult> getCompletedJobs() {
        synchronized (completedLock) {
            return ImmutableList.copyOf(completedJobs);
        }
    }

    private static final class TriggerBinding {
        final Trigger trigger;
        final JobInfo job;

        TriggerBinding(Trigger trigger, JobInfo job) {
            this.trigger = trigger;
            this.job = job;
        }
    }

    public static final class Builder {
        private int completedJobsCapacity = DEFAULT_COMPLETED_JOBS_CAPACITY;

        private Builder() {
        }

        /**
         * Maximum number of completed results kept.
         */
        public Builder completedJobsCapacity(int capacity) {
            checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
            this.completedJobsCapacity = capacity;
            return this;
        }

        public InMemoryJobStore build() {
            return new InMemoryJobStore(this);
        }
    }
}
