package io.github.byzatic.scheduling;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Either a live object or the id of one, resolved once at the scheduler API boundary.
 */
public final class EntityRef<T> {
    private final @Nullable UUID id;
    private final @Nullable T value;

    private EntityRef(@Nullable UUID id, @Nullable T value) {
        this.id = id;
        this.value = value;
    }

    public static <T> @NotNull EntityRef<T> ofId(@NotNull UUID id) {
        return new EntityRef<>(Objects.requireNonNull(id, "id"), null);
    }

    public static <T> @NotNull EntityRef<T> of(@NotNull T value) {
        return new EntityRef<>(null, Objects.requireNonNull(value, "value"));
    }

    public boolean isId() {
        return id != null;
    }

    /**
     * The referenced object: the live one, or the lookup result for an id.
     */
    public Optional<T> resolve(@NotNull Function<UUID, Optional<T>> lookup) {
        if (value != null) return Optional.of(value);
        return lookup.apply(id);
    }

    @Override
    public String toString() {
        return id != null ? id.toString() : String.valueOf(value);
    }
}
