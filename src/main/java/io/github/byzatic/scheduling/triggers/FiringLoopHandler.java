package io.github.byzatic.scheduling.triggers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;

/**
 * Receives the fires of a {@link TriggerLoop} and its termination.
 */
public interface FiringLoopHandler {
    /**
     * Starts one execution for the trigger. Must not block on the execution itself.
     *
     * @return a future completing once the execution's result is finalized
     */
    @NotNull
    CompletableFuture<?> onFire(@NotNull Trigger trigger);

    /**
     * Completion of the latest fire of {@code trigger}, from any activation, or null if it
     * never fired. An end-to-start loop does not fire while it is unfinished.
     */
    default @Nullable CompletableFuture<?> lastFire(@NotNull Trigger trigger) {
        return null;
    }

    /**
     * Called once, from the loop thread, when the loop ends.
     *
     * @param exitState {@link TriggerState#EXHAUSTED}, {@link TriggerState#CANCELLED} or {@link TriggerState#DISABLED}
     */
    default void onLoopExit(@NotNull TriggerLoop loop, @NotNull TriggerState exitState) {
    }
}
