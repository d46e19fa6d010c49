package io.github.byzatic.scheduling.jobs;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.scheduling.triggers.Trigger;
import io.github.byzatic.scheduling.workflow.ActivityContext;
import io.github.byzatic.scheduling.workflow.WorkflowExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scheduled job: static metadata, the body that runs on every fire and the triggers
 * currently attached to it.
 * <p>
 * The body is one of two closed variants behind {@link #invoke}: a workflow job is dispatched
 * to the {@link WorkflowExecutor}, a function job runs its function directly.
 */
@ThreadSafe
public final class JobInfo {
    private final UUID id;
    private final String name;
    private final ImmutableList<JobParameter> parameters;
    private final Class<?> returnType;
    private final JobBody body;
    private final List<Trigger> triggers = new CopyOnWriteArrayList<>();

    private JobInfo(UUID id, String name, List<JobParameter> parameters, Class<?> returnType, JobBody body) {
        this.id = id;
        this.name = name;
        this.parameters = ImmutableList.copyOf(parameters);
        this.returnType = returnType;
        this.body = body;
    }

    /* ============ Factories ============ */

    public static WorkflowBuilder workflow(@NotNull String name) {
        return new WorkflowBuilder(name);
    }

    /**
     * Job running a synchronous function on a job thread.
     */
    public static @NotNull JobInfo fromFunction(@Nullable String name, @NotNull SyncJobFunction function) {
        Objects.requireNonNull(function, "function");
        return new JobInfo(UUID.randomUUID(), nameOrDefault(name, function), List.of(), Object.class, new FunctionBody(function, null));
    }

    /**
     * Job running an asynchronous function; the job ends when the returned future does.
     */
    public static @NotNull JobInfo fromAsyncFunction(@Nullable String name, @NotNull AsyncJobFunction function) {
        Objects.requireNonNull(function, "function");
        return new JobInfo(UUID.randomUUID(), nameOrDefault(name, function), List.of(), Object.class, new FunctionBody(null, function));
    }

    public static @NotNull JobInfo fromCallable(@Nullable String name, @NotNull Callable<?> callable) {
        Objects.requireNonNull(callable, "callable");
        return new JobInfo(UUID.randomUUID(), nameOrDefault(name, callable), List.of(), Object.class,
                new FunctionBody(token -> callable.call(), null));
    }

    public static @NotNull JobInfo fromRunnable(@Nullable String name, @NotNull Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        return new JobInfo(UUID.randomUUID(), nameOrDefault(name, runnable), List.of(), Void.class,
                new FunctionBody(token -> {
                    runnable.run();
                    return null;
                }, null));
    }

    private static String nameOrDefault(@Nullable String name, Object function) {
        return name != null ? name : "function-job@" + Integer.toHexString(System.identityHashCode(function));
    }

    /* ============ Metadata ============ */

    public @NotNull UUID getId() {
        return id;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull List<JobParameter> getParameters() {
        return parameters;
    }

    public @NotNull Class<?> getReturnType() {
        return returnType;
    }

    public @NotNull JobKind getKind() {
        return body.kind();
    }

    /* ============ Triggers ============ */

    /**
     * Snapshot of the attached triggers.
     */
    public @NotNull List<Trigger> getTriggers() {
        return ImmutableList.copyOf(triggers);
    }

    public boolean hasTriggers() {
        return !triggers.isEmpty();
    }

    /**
     * Attaches a trigger. Used by the job store.
     *
     * @return false if it was already attached
     */
    public boolean addTrigger(@NotNull Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger");
        synchronized (triggers) {
            if (triggers.contains(trigger)) return false;
            return triggers.add(trigger);
        }
    }

    public boolean removeTrigger(@NotNull Trigger trigger) {
        return triggers.remove(trigger);
    }

    /* ============ Execution ============ */

    /**
     * Runs the job body once.
     *
     * @param workflowExecutor executor for workflow jobs, ignored by function jobs
     * @return the execution; failures are reported through the future, never thrown
     */
    public @NotNull CompletableFuture<Object> invoke(@Nullable WorkflowExecutor workflowExecutor, @NotNull ActivityContext context) {
        Objects.requireNonNull(context, "context");
        try {
            return body.invoke(this, workflowExecutor, context);
        } catch (Exception ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    @Override
    public String toString() {
        return "JobInfo{id=" + id + ", name='" + name + "', kind=" + body.kind() + ", triggers=" + triggers.size() + '}';
    }

    /* ============ Variants ============ */

    private interface JobBody {
        JobKind kind();

        CompletableFuture<Object> invoke(JobInfo job, @Nullable WorkflowExecutor executor, ActivityContext context) throws Exception;
    }

    private static final class WorkflowBody implements JobBody {
        @Override
        public JobKind kind() {
            return JobKind.WORKFLOW;
        }

        @Override
        public CompletableFuture<Object> invoke(JobInfo job, @Nullable WorkflowExecutor executor, ActivityContext context) {
            if (executor == null) {
                throw new IllegalStateException("No workflow executor available for job '" + job.getName() + "'");
            }
            CompletableFuture<Object> execution = executor.executeAsync(
                    job, context.getTarget(), context.getArguments(), context, context.getCancellationToken());
            return Objects.requireNonNull(execution, "workflow executor returned no future");
        }
    }

    private static final class FunctionBody implements JobBody {
        private final @Nullable SyncJobFunction syncFunction;
        private final @Nullable AsyncJobFunction asyncFunction;

        FunctionBody(@Nullable SyncJobFunction syncFunction, @Nullable AsyncJobFunction asyncFunction) {
            this.syncFunction = syncFunction;
            this.asyncFunction = asyncFunction;
        }

        @Override
        public JobKind kind() {
            return JobKind.FUNCTION;
        }

        @Override
        public CompletableFuture<Object> invoke(JobInfo job, @Nullable WorkflowExecutor executor, ActivityContext context) throws Exception {
            CancellationToken token = context.getCancellationToken();
            if (syncFunction != null) {
                return CompletableFuture.completedFuture(syncFunction.apply(token));
            }
            CompletableFuture<?> future = asyncFunction.apply(token);
            return future == null ? CompletableFuture.completedFuture(null) : future.thenApply(v -> (Object) v);
        }
    }

    /**
     * Builder of workflow (data-described) jobs.
     */
    public static final class WorkflowBuilder {
        private final String name;
        private UUID id;
        private final List<JobParameter> parameters = new ArrayList<>();
        private Class<?> returnType = Object.class;

        private WorkflowBuilder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public WorkflowBuilder id(@NotNull UUID id) {
            this.id = Objects.requireNonNull(id);
            return this;
        }

        public WorkflowBuilder parameter(@NotNull String name, @NotNull Class<?> type) {
            parameters.add(new JobParameter(name, type));
            return this;
        }

        public WorkflowBuilder returnType(@NotNull Class<?> returnType) {
            this.returnType = Objects.requireNonNull(returnType);
            return this;
        }

        public JobInfo build() {
            return new JobInfo(id != null ? id : UUID.randomUUID(), name, parameters, returnType, new WorkflowBody());
        }
    }
}
