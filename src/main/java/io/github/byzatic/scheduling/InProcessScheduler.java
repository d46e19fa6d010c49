package io.github.byzatic.scheduling;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.scheduling.base_exceptions.OperationNotSupportedException;
import io.github.byzatic.scheduling.base_exceptions.ScheduledEntityNotFoundException;
import io.github.byzatic.scheduling.base_exceptions.SchedulingException;
import io.github.byzatic.scheduling.jobs.CancellationTokenSource;
import io.github.byzatic.scheduling.jobs.JobInfo;
import io.github.byzatic.scheduling.jobs.JobResult;
import io.github.byzatic.scheduling.jobs.RunningJob;
import io.github.byzatic.scheduling.jobstore.InMemoryJobStore;
import io.github.byzatic.scheduling.jobstore.JobStore;
import io.github.byzatic.scheduling.triggers.FiringLoopHandler;
import io.github.byzatic.scheduling.triggers.Trigger;
import io.github.byzatic.scheduling.triggers.TriggerLoop;
import io.github.byzatic.scheduling.triggers.TriggerState;
import io.github.byzatic.scheduling.workflow.ActivityContext;
import io.github.byzatic.scheduling.workflow.WorkflowExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * InProcessScheduler
 * - Interval/count triggers, each fired by its own loop on a cached daemon pool
 * - Job bodies run on a configurable ThreadPoolExecutor
 * - Cooperative cancellation of triggers, scheduled jobs and single executions
 * - Running and completed results tracked in a {@link JobStore}
 * - Event subscription (start/complete/error/cancelled/trigger stopped)
 */
@ThreadSafe
public final class InProcessScheduler implements JobSchedulerInterface {
    private final static Logger logger = LoggerFactory.getLogger(InProcessScheduler.class);

    private static final String SHUTDOWN_REASON = "Scheduler is shutting down";
    private static final String JOB_CANCELLED_REASON = "Job cancelled";

    private final @Nullable JobStore jobStore;
    private final @Nullable WorkflowExecutor workflowExecutor;
    private final ThreadPoolExecutor executor;
    private final ExecutorService loopExecutor;
    private final ThreadFactory finalizerThreadFactory;
    private final long defaultGraceMillis;
    private final List<JobEventListener> listeners;
    private final Map<UUID, Activation> activations = new ConcurrentHashMap<>();
    private final Map<UUID, CompletableFuture<JobResult>> inFlight = new ConcurrentHashMap<>();

    @GuardedBy("this")
    private Lifecycle lifecycle = Lifecycle.NEW;

    @GuardedBy("this")
    private @Nullable CompletableFuture<Void> finalization;

    private InProcessScheduler(Builder b) {
        this.jobStore = b.jobStore;
        this.workflowExecutor = b.workflowExecutor;
        this.executor = b.executor;
        this.defaultGraceMillis = b.defaultGraceMillis;
        this.listeners = new CopyOnWriteArrayList<>(b.listeners);
        this.loopExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("trigger-loop-%d")
                .setDaemon(true)
                .build());
        this.finalizerThreadFactory = new ThreadFactoryBuilder()
                .setNameFormat("scheduler-finalizer-%d")
                .setDaemon(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nullable JobStore jobStore = new InMemoryJobStore();
        private @Nullable WorkflowExecutor workflowExecutor;
        private ThreadPoolExecutor executor;
        private long defaultGraceMillis = 10_000; // 10s
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        private Builder() {
        }

        /**
         * Store of jobs, triggers and results. Defaults to an {@link InMemoryJobStore}.
         */
        public Builder jobStore(@Nullable JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        /**
         * Runs the workflow jobs. Required by {@link #initializeAsync()}.
         */
        public Builder workflowExecutor(@Nullable WorkflowExecutor workflowExecutor) {
            this.workflowExecutor = workflowExecutor;
            return this;
        }

        /**
         * Provide your own custom thread pool for the job bodies.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /**
         * Time {@link #finalizeAsync()} waits for cancelled executions before abandoning them.
         */
        public Builder defaultGrace(Duration grace) {
            this.defaultGraceMillis = Objects.requireNonNull(grace).toMillis();
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public InProcessScheduler build() {
            if (executor == null) {
                int threads = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);
                executor = new ThreadPoolExecutor(
                        threads, threads,
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        new ThreadFactoryBuilder()
                                .setNameFormat("job-exec-%d")
                                .setDaemon(false)
                                .setUncaughtExceptionHandler((th, ex) ->
                                        logger.error("Uncaught in {}", th.getName(), ex))
                                .build()
                );
                executor.allowCoreThreadTimeOut(true);
            }
            return new InProcessScheduler(this);
        }
    }

    // ======== Lifecycle ========

    @Override
    public @NotNull CompletableFuture<Void> initializeAsync() {
        synchronized (this) {
            if (lifecycle == Lifecycle.RUNNING) return CompletableFuture.completedFuture(null);
            if (lifecycle != Lifecycle.NEW) {
                return CompletableFuture.failedFuture(new OperationNotSupportedException("The scheduler was finalized"));
            }
            if (workflowExecutor == null) {
                return CompletableFuture.failedFuture(new SchedulingException("No workflow executor configured"));
            }
            if (jobStore == null) {
                return CompletableFuture.failedFuture(new SchedulingException("No job store configured"));
            }
            try {
                jobStore.initialize();
            } catch (SchedulingException e) {
                logger.error("Job store initialization failed", e);
                return CompletableFuture.failedFuture(e);
            }
            lifecycle = Lifecycle.RUNNING;
            int resumed = 0;
            for (Trigger trigger : jobStore.getTriggers()) {
                if (trigger.getState() != TriggerState.PENDING) {
                    logger.warn("Stored trigger {} is {}, not resumed", trigger.getId(), trigger.getState());
                    continue;
                }
                Optional<JobInfo> owner = jobStore.getTriggerOwner(trigger.getId());
                if (owner.isEmpty()) continue;
                if (startLoop(activations.computeIfAbsent(trigger.getId(), id -> new Activation(trigger, owner.get(), null)))) {
                    resumed++;
                }
            }
            logger.info("Scheduler initialized, {} stored trigger(s) resumed", resumed);
            return CompletableFuture.completedFuture(null);
        }
    }

    @Override
    public synchronized @NotNull CompletableFuture<Void> finalizeAsync() {
        if (finalization != null) return finalization;
        logger.info("Scheduler finalization started");
        lifecycle = Lifecycle.FINALIZING;
        finalization = CompletableFuture.runAsync(this::shutdown, r -> finalizerThreadFactory.newThread(r).start());
        return finalization;
    }

    /**
     * Runs {@link #finalizeAsync()} and waits for it.
     */
    @Override
    public void close() {
        finalizeAsync().join();
    }

    private void shutdown() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(defaultGraceMillis);
        JobStore store = jobStore;
        try {
            if (store != null) {
                List<Trigger> triggers = store.getTriggers();
                for (Trigger trigger : triggers) trigger.requestCancellation();
                loopExecutor.shutdown();
                if (!loopExecutor.awaitTermination(remainingNanos(deadline), TimeUnit.NANOSECONDS)) {
                    logger.warn("Some firing loops did not stop in time");
                }
                for (Trigger trigger : triggers) store.removeTrigger(trigger.getId());
                activations.clear();

                List<CompletableFuture<JobResult>> pending = ImmutableList.copyOf(inFlight.values());
                for (JobResult result : store.getRunningJobs()) {
                    result.getRunningJob().cancel(SHUTDOWN_REASON);
                }
                awaitRunningJobs(pending, deadline);
                for (JobResult result : store.getRunningJobs()) {
                    if (result.getRunningJob().abandon("grace period of " + defaultGraceMillis + " ms elapsed")) {
                        logger.warn("Abandoned job '{}' ({}) still running after the grace period",
                                result.getScheduledJob().getName(), result.getRunningJobId());
                    }
                }
                for (JobInfo job : store.getScheduledJobs()) store.removeScheduledJob(job.getId());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            logger.warn("Scheduler finalization interrupted");
        } finally {
            loopExecutor.shutdown();
            executor.shutdown();
            synchronized (this) {
                lifecycle = Lifecycle.FINALIZED;
            }
            logger.info("Scheduler finalized");
        }
    }

    private void awaitRunningJobs(List<CompletableFuture<JobResult>> pending, long deadline) throws InterruptedException {
        if (pending.isEmpty()) return;
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException te) {
            logger.warn("{} job(s) still running after the grace period", inFlight.size());
        } catch (ExecutionException ee) {
            logger.error("Errors occurred while waiting for running jobs", ee.getCause());
        }
    }

    private static long remainingNanos(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    // ======== Listeners ========

    @Override
    public void addListener(@NotNull JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    @Override
    public void removeListener(@NotNull JobEventListener l) {
        listeners.remove(l);
    }

    private void notifyListeners(String event, Consumer<JobEventListener> call) {
        for (JobEventListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException ex) {
                logger.warn("Listener {} failed on {}", l, event, ex);
            }
        }
    }

    // ======== Public API ========

    @Override
    public @NotNull CompletableFuture<OperationResult<JobInfo>> enqueueAsync(@NotNull EntityRef<JobInfo> job,
                                                                             @Nullable Trigger trigger,
                                                                             @Nullable SchedulingOptions options) {
        Objects.requireNonNull(job, "job");
        return call("enqueue job " + job, () -> enqueue(job, trigger, options));
    }

    private synchronized JobInfo enqueue(EntityRef<JobInfo> jobRef, @Nullable Trigger trigger, @Nullable SchedulingOptions options) throws SchedulingException {
        JobStore store = requireRunning();
        JobInfo job;
        if (jobRef.isId()) {
            job = jobRef.resolve(store::getScheduledJob)
                    .orElseThrow(() -> new ScheduledEntityNotFoundException("Scheduled job " + jobRef + " not found"));
        } else {
            job = jobRef.resolve(id -> Optional.empty()).orElseThrow();
        }
        Trigger t = trigger != null ? trigger
                : options != null && options.getTrigger() != null ? options.getTrigger()
                : Trigger.once();
        if (t.getState() != TriggerState.PENDING) {
            throw new OperationNotSupportedException("Trigger " + t.getId() + " cannot be enqueued, it is " + t.getState());
        }
        Optional<JobInfo> owner = store.getTriggerOwner(t.getId());
        if (owner.isPresent()) {
            throw new OperationNotSupportedException("Trigger " + t.getId() + " is already bound to job '" + owner.get().getName() + "'");
        }

        boolean added = store.addScheduledJob(job);
        try {
            store.addTrigger(t, job);
        } catch (SchedulingException e) {
            if (added && !job.hasTriggers()) store.removeScheduledJob(job.getId());
            throw e;
        }
        Activation activation = new Activation(t, job, options);
        activations.put(t.getId(), activation);
        startLoop(activation);
        logger.info("Enqueued job '{}' ({}) with trigger {}", job.getName(), job.getId(), t);
        return job;
    }

    @Override
    public @NotNull CompletableFuture<OperationResult<JobInfo>> disableScheduledJobAsync(@NotNull EntityRef<JobInfo> job, @Nullable SchedulingOptions options) {
        Objects.requireNonNull(job, "job");
        return call("disable job " + job, () -> disable(job));
    }

    private synchronized JobInfo disable(EntityRef<JobInfo> jobRef) throws SchedulingException {
        JobInfo job = resolveScheduledJob(requireStore(), jobRef);
        int disabled = 0;
        for (Trigger trigger : job.getTriggers()) {
            if (trigger.disable()) disabled++;
        }
        logger.info("Disabled {} trigger(s) of job '{}'", disabled, job.getName());
        return job;
    }

    @Override
    public @NotNull CompletableFuture<OperationResult<JobInfo>> enableScheduledJobAsync(@NotNull EntityRef<JobInfo> job, @Nullable SchedulingOptions options) {
        Objects.requireNonNull(job, "job");
        return call("enable job " + job, () -> enable(job));
    }

    private synchronized JobInfo enable(EntityRef<JobInfo> jobRef) throws SchedulingException {
        JobStore store = requireRunning();
        JobInfo job = resolveScheduledJob(store, jobRef);
        List<Trigger> triggers = job.getTriggers();
        if (triggers.isEmpty()) {
            throw new OperationNotSupportedException("Job '" + job.getName() + "' has no trigger to resume");
        }
        int resumed = 0;
        boolean firing = false;
        for (Trigger trigger : triggers) {
            TriggerState state = trigger.getState();
            if (state == TriggerState.PENDING || state == TriggerState.ACTIVE) {
                firing = true;
            } else if (state == TriggerState.DISABLED) {
                Activation activation = activations.computeIfAbsent(trigger.getId(), id -> new Activation(trigger, job, null));
                if (startLoop(activation)) {
                    resumed++;
                } else {
                    // disabled after its last fire
                    detachTrigger(store, trigger, job);
                }
            }
        }
        if (resumed == 0 && !firing) {
            throw new OperationNotSupportedException("Job '" + job.getName() + "' has no trigger left to resume");
        }
        logger.info("Resumed {} trigger(s) of job '{}'", resumed, job.getName());
        return job;
    }

    @Override
    public @NotNull CompletableFuture<OperationResult<JobInfo>> cancelScheduledJobAsync(@NotNull EntityRef<JobInfo> job, @Nullable SchedulingOptions options) {
        Objects.requireNonNull(job, "job");
        return call("cancel job " + job, () -> cancelScheduledJob(job, options));
    }

    private synchronized JobInfo cancelScheduledJob(EntityRef<JobInfo> jobRef, @Nullable SchedulingOptions options) throws SchedulingException {
        JobStore store = requireStore();
        JobInfo job = resolveScheduledJob(store, jobRef);
        String reason = options != null ? options.reasonOr(JOB_CANCELLED_REASON) : JOB_CANCELLED_REASON;
        List<Trigger> triggers = job.getTriggers();
        // triggers first: a fire registered after the scan below sees its trigger cancelled
        for (Trigger trigger : triggers) trigger.requestCancellation();
        for (JobResult result : store.getRunningJobs()) {
            if (result.getScheduledJobId().equals(job.getId())) result.getRunningJob().cancel(reason);
        }
        store.removeScheduledJob(job.getId());
        for (Trigger trigger : triggers) activations.remove(trigger.getId());
        logger.info("Cancelled job '{}' ({}): {}", job.getName(), job.getId(), reason);
        return job;
    }

    @Override
    public @NotNull CompletableFuture<OperationResult<JobResult>> cancelRunningJobAsync(@NotNull EntityRef<RunningJob> runningJob, @Nullable SchedulingOptions options) {
        Objects.requireNonNull(runningJob, "runningJob");
        return call("cancel running job " + runningJob, () -> {
            JobStore store = requireStore();
            RunningJob job = runningJob.resolve(id -> store.getRunningJob(id).map(JobResult::getRunningJob))
                    .filter(rj -> store.getRunningJob(rj.getId()).isPresent())
                    .orElseThrow(() -> new ScheduledEntityNotFoundException("Running job " + runningJob + " not found"));
            String reason = options != null ? options.reasonOr("Running job cancelled") : "Running job cancelled";
            job.cancel(reason);
            logger.info("Cancellation requested for running job '{}' ({}): {}", job.getScheduledJob().getName(), job.getId(), reason);
            return job.getResult();
        });
    }

    @Override
    public @NotNull CompletableFuture<OperationResult<Trigger>> cancelTriggerAsync(@NotNull EntityRef<Trigger> trigger, @Nullable SchedulingOptions options) {
        Objects.requireNonNull(trigger, "trigger");
        return call("cancel trigger " + trigger, () -> cancelTrigger(trigger));
    }

    private synchronized Trigger cancelTrigger(EntityRef<Trigger> triggerRef) throws SchedulingException {
        JobStore store = requireStore();
        Trigger trigger = triggerRef.resolve(store::getTrigger)
                .filter(t -> store.getTrigger(t.getId()).isPresent())
                .orElseThrow(() -> new ScheduledEntityNotFoundException("Trigger " + triggerRef + " not found"));
        if (!trigger.requestCancellation()) {
            throw new OperationNotSupportedException("Trigger " + trigger.getId() + " has already ended (" + trigger.getState() + ")");
        }
        Optional<JobInfo> owner = store.getTriggerOwner(trigger.getId());
        activations.remove(trigger.getId());
        store.removeTrigger(trigger.getId());
        owner.ifPresent(job -> unscheduleIfIdle(store, job));
        logger.info("Cancelled trigger {}", trigger.getId());
        return trigger;
    }

    // ======== Queries ========

    @Override
    public @NotNull List<JobInfo> getScheduledJobs(@Nullable SchedulingOptions options) {
        JobStore store = jobStore;
        if (store == null) return ImmutableList.of();
        ImmutableList.Builder<JobInfo> out = ImmutableList.builder();
        for (JobInfo job : store.getScheduledJobs()) {
            if (options == null || options.matchesJob(job)) out.add(job);
        }
        return out.build();
    }

    @Override
    public @NotNull List<JobResult> getRunningJobs(@Nullable SchedulingOptions options) {
        JobStore store = jobStore;
        return store == null ? ImmutableList.of() : filter(store.getRunningJobs(), options);
    }

    @Override
    public @NotNull List<JobResult> getCompletedJobs(@Nullable SchedulingOptions options) {
        JobStore store = jobStore;
        return store == null ? ImmutableList.of() : filter(store.getCompletedJobs(), options);
    }

    private static List<JobResult> filter(List<JobResult> results, @Nullable SchedulingOptions options) {
        if (options == null) return ImmutableList.copyOf(results);
        ImmutableList.Builder<JobResult> out = ImmutableList.builder();
        for (JobResult result : results) {
            if (options.matches(result)) out.add(result);
        }
        return out.build();
    }

    // ======== Firing ========

    /**
     * @return false if the trigger could not be activated
     */
    private boolean startLoop(Activation activation) {
        Optional<TriggerLoop> loop = TriggerLoop.activate(activation.trigger, activation);
        if (loop.isEmpty()) return false;
        activation.loop = loop.get();
        loopExecutor.execute(loop.get());
        return true;
    }

    private CompletableFuture<JobResult> fire(Activation activation) {
        // set before the fire starts, a resumed end-to-start loop waits on it
        CompletableFuture<JobResult> completion = new CompletableFuture<>();
        activation.lastFire = completion;
        try {
            startFire(activation).whenComplete((r, e) -> {
                if (e != null) completion.completeExceptionally(e);
                else completion.complete(r);
            });
        } catch (RuntimeException ex) {
            completion.completeExceptionally(ex);
            throw ex;
        }
        return completion;
    }

    private CompletableFuture<JobResult> startFire(Activation activation) {
        JobStore store = Objects.requireNonNull(jobStore);
        JobInfo job = activation.job;
        SchedulingOptions options = activation.options;

        UUID runningJobId = UUID.randomUUID();
        CancellationTokenSource cts = new CancellationTokenSource();
        ActivityContext context = new ActivityContext(job, activation.trigger, runningJobId,
                options != null ? options.getActivityTarget() : null,
                options != null ? options.getActivityArguments() : null,
                cts.getToken());
        if (options != null && options.getActivityOptions() != null) {
            options.getActivityOptions().accept(context);
        }
        RunningJob runningJob = new RunningJob(runningJobId, job, activation.trigger, cts, context);
        JobResult result = runningJob.getResult();
        try {
            store.addRunningJob(result);
        } catch (SchedulingException e) {
            logger.error("Could not register the execution of job '{}'", job.getName(), e);
            return CompletableFuture.failedFuture(e);
        }
        // the fire was taken before a concurrent cancel whose running-job scan missed it
        if (activation.trigger.getState() == TriggerState.CANCELLED || store.getScheduledJob(job.getId()).isEmpty()) {
            logger.debug("Job '{}' was cancelled while fire {} was starting", job.getName(), runningJobId);
            cts.cancel(JOB_CANCELLED_REASON);
        }
        notifyListeners("start", l -> l.onStart(result));

        CompletableFuture<JobResult> done = runningJob.start(workflowExecutor, executor).thenApply(r -> {
            onFinalized(store, r);
            return r;
        });
        inFlight.put(runningJobId, done);
        done.whenComplete((r, e) -> inFlight.remove(runningJobId, done));
        return done;
    }

    private void onFinalized(JobStore store, JobResult result) {
        try {
            if (!store.completeRunningJob(result)) {
                logger.warn("Result {} was not registered as running", result.getRunningJobId());
            }
        } catch (RuntimeException ex) {
            logger.error("Could not move result {} to the completed jobs", result.getRunningJobId(), ex);
        }
        switch (result.getState()) {
            case COMPLETED:
                logger.debug("Job '{}' ({}) completed in {}", result.getScheduledJob().getName(), result.getRunningJobId(), result.getElapsed());
                notifyListeners("complete", l -> l.onComplete(result));
                break;
            case CANCELED:
                logger.info("Job '{}' ({}) cancelled: {}", result.getScheduledJob().getName(), result.getRunningJobId(), result.getCancellationReason());
                notifyListeners("cancelled", l -> l.onCancelled(result));
                break;
            case FAILED:
                Throwable error = result.getException().orElse(null);
                notifyListeners("error", l -> l.onError(result, error));
                break;
            default:
                logger.warn("Result {} finalized in state {}", result.getRunningJobId(), result.getState());
        }
    }

    private void loopExited(Activation activation, TriggerLoop loop, TriggerState exitState) {
        Trigger trigger = activation.trigger;
        if (activation.loop != loop) {
            logger.debug("Stale firing loop of trigger {} exited", trigger.getId());
            return;
        }
        if (exitState != TriggerState.DISABLED) {
            synchronized (this) {
                activations.remove(trigger.getId(), activation);
                JobStore store = jobStore;
                if (store != null) detachTrigger(store, trigger, activation.job);
            }
        }
        notifyListeners("trigger stopped", l -> l.onTriggerStopped(trigger, exitState));
    }

    @GuardedBy("this")
    private void detachTrigger(JobStore store, Trigger trigger, JobInfo job) {
        store.removeTrigger(trigger.getId());
        unscheduleIfIdle(store, job);
    }

    @GuardedBy("this")
    private void unscheduleIfIdle(JobStore store, JobInfo job) {
        if (!job.hasTriggers() && store.removeScheduledJob(job.getId())) {
            logger.info("Job '{}' ({}) has no trigger left and was unscheduled", job.getName(), job.getId());
        }
    }

    // ======== Helpers ========

    private interface Operation<T> {
        T run() throws SchedulingException;
    }

    private static <T> CompletableFuture<OperationResult<T>> call(String description, Operation<T> operation) {
        try {
            return CompletableFuture.completedFuture(OperationResult.success(operation.run()));
        } catch (SchedulingException e) {
            logger.warn("Could not {}: {}", description, e.getMessage());
            return CompletableFuture.completedFuture(OperationResult.failure(e));
        }
    }

    private JobStore requireStore() throws SchedulingException {
        if (jobStore == null) throw new SchedulingException("No job store configured");
        return jobStore;
    }

    @GuardedBy("this")
    private JobStore requireRunning() throws SchedulingException {
        switch (lifecycle) {
            case NEW:
                throw new OperationNotSupportedException("The scheduler is not initialized");
            case RUNNING:
                return requireStore();
            default:
                throw new OperationNotSupportedException("The scheduler is finalizing");
        }
    }

    private static JobInfo resolveScheduledJob(JobStore store, EntityRef<JobInfo> jobRef) throws ScheduledEntityNotFoundException {
        return jobRef.resolve(store::getScheduledJob)
                .filter(job -> store.getScheduledJob(job.getId()).isPresent())
                .orElseThrow(() -> new ScheduledEntityNotFoundException("Scheduled job " + jobRef + " not found"));
    }

    private enum Lifecycle {
        NEW, RUNNING, FINALIZING, FINALIZED
    }

    /**
     * One enqueued trigger with the job and options it fires with.
     */
    private final class Activation implements FiringLoopHandler {
        final Trigger trigger;
        final JobInfo job;
        final @Nullable SchedulingOptions options;
        volatile @Nullable TriggerLoop loop;
        volatile @Nullable CompletableFuture<JobResult> lastFire;

        Activation(Trigger trigger, JobInfo job, @Nullable SchedulingOptions options) {
            this.trigger = trigger;
            this.job = job;
            this.options = options;
        }

        @Override
        public @NotNull CompletableFuture<?> onFire(@NotNull Trigger trigger) {
            return fire(this);
        }

        @Override
        public @Nullable CompletableFuture<?> lastFire(@NotNull Trigger trigger) {
            return lastFire;
        }

        @Override
        public void onLoopExit(@NotNull TriggerLoop loop, @NotNull TriggerState exitState) {
            loopExited(this, loop, exitState);
        }
    }
}
