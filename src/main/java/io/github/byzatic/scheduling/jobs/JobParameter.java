package io.github.byzatic.scheduling.jobs;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Declared parameter of a job.
 */
public final class JobParameter {
    private final String name;
    private final Class<?> type;

    public JobParameter(@NotNull String name, @NotNull Class<?> type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull Class<?> getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobParameter)) return false;
        JobParameter that = (JobParameter) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
