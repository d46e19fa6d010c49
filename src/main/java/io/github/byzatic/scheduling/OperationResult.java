package io.github.byzatic.scheduling;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a scheduler operation: success or failure, an optional payload and
 * human-readable messages. Failures carry the exception describing them.
 */
public final class OperationResult<T> {
    private final boolean success;
    private final @Nullable T value;
    private final @Nullable Throwable exception;
    private final ImmutableList<String> messages;

    private OperationResult(boolean success, @Nullable T value, @Nullable Throwable exception, List<String> messages) {
        this.success = success;
        this.value = value;
        this.exception = exception;
        this.messages = ImmutableList.copyOf(messages);
    }

    public static <T> @NotNull OperationResult<T> success(@Nullable T value) {
        return new OperationResult<>(true, value, null, List.of());
    }

    public static <T> @NotNull OperationResult<T> success(@Nullable T value, @NotNull String message) {
        return new OperationResult<>(true, value, null, List.of(message));
    }

    public static <T> @NotNull OperationResult<T> failure(@NotNull Throwable exception) {
        return failure(null, exception);
    }

    public static <T> @NotNull OperationResult<T> failure(@Nullable T value, @NotNull Throwable exception) {
        Objects.requireNonNull(exception, "exception");
        return new OperationResult<>(false, value, exception, List.of(String.valueOf(exception.getMessage())));
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public @Nullable T getValue() {
        return value;
    }

    public Optional<Throwable> getException() {
        return Optional.ofNullable(exception);
    }

    public @NotNull List<String> getMessages() {
        return messages;
    }

    /**
     * Copy with one more message.
     */
    public @NotNull OperationResult<T> withMessage(@NotNull String message) {
        return new OperationResult<>(success, value, exception,
                ImmutableList.<String>builder().addAll(messages).add(message).build());
    }

    @Override
    public String toString() {
        return "OperationResult{" + (success ? "success" : "failure") +
                (value != null ? ", value=" + value : "") +
                (messages.isEmpty() ? "" : ", messages=" + messages) + '}';
    }
}
