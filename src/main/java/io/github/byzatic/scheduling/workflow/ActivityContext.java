package io.github.byzatic.scheduling.workflow;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.scheduling.jobs.CancellationToken;
import io.github.byzatic.scheduling.jobs.JobInfo;
import io.github.byzatic.scheduling.triggers.Trigger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution context of one fire: what runs, why, with which inputs, plus free-form
 * attributes seeded by the activity options before dispatch.
 */
@ThreadSafe
public final class ActivityContext {
    private final JobInfo scheduledJob;
    private final Trigger trigger;
    private final UUID runningJobId;
    private final @Nullable Object target;
    private final ImmutableMap<String, Object> arguments;
    private final CancellationToken cancellationToken;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public ActivityContext(@NotNull JobInfo scheduledJob,
                           @NotNull Trigger trigger,
                           @NotNull UUID runningJobId,
                           @Nullable Object target,
                           @Nullable Map<String, Object> arguments,
                           @NotNull CancellationToken cancellationToken) {
        this.scheduledJob = Objects.requireNonNull(scheduledJob, "scheduledJob");
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.runningJobId = Objects.requireNonNull(runningJobId, "runningJobId");
        this.target = target;
        this.arguments = arguments == null ? ImmutableMap.of() : ImmutableMap.copyOf(arguments);
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken");
    }

    public @NotNull JobInfo getScheduledJob() {
        return scheduledJob;
    }

    public @NotNull Trigger getTrigger() {
        return trigger;
    }

    public @NotNull UUID getRunningJobId() {
        return runningJobId;
    }

    public @Nullable Object getTarget() {
        return target;
    }

    public @NotNull Map<String, Object> getArguments() {
        return arguments;
    }

    public @NotNull CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public ActivityContext set(@NotNull String key, @NotNull Object value) {
        attributes.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
        return this;
    }

    public Optional<Object> get(@NotNull String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public @NotNull Map<String, Object> getAttributes() {
        return ImmutableMap.copyOf(attributes);
    }
}
