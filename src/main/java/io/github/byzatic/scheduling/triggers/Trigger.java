package io.github.byzatic.scheduling.triggers;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Interval/count recurrence rule of a scheduled job.
 * <p>
 * Only the remaining count and the lifecycle state are mutable. The count is consumed by
 * the {@link TriggerLoop}; callers can only request cancellation or disable the trigger.
 * <p>
 * Every activation of the trigger gets its own stop signal, completed with the state that
 * stopped it. A loop keeps the signal it was started with, so a loop left over from a
 * previous activation never fires for a later one.
 */
@ThreadSafe
public class Trigger {
    private final UUID id;
    private final Duration interval;
    private final IntervalKind intervalKind;
    private final Duration startDelay;

    @GuardedBy("this")
    private @Nullable Integer count;

    @GuardedBy("this")
    private TriggerState state = TriggerState.PENDING;

    @GuardedBy("this")
    private CompletableFuture<TriggerState> stopSignal = new CompletableFuture<>();

    protected Trigger(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID();
        this.interval = b.interval;
        this.intervalKind = b.intervalKind;
        this.startDelay = b.startDelay;
        this.count = b.count;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default trigger: fires once, immediately.
     */
    public static @NotNull Trigger once() {
        return builder().count(1).build();
    }

    public @NotNull UUID getId() {
        return id;
    }

    public @NotNull Duration getInterval() {
        return interval;
    }

    public @NotNull IntervalKind getIntervalKind() {
        return intervalKind;
    }

    public @NotNull Duration getStartDelay() {
        return startDelay;
    }

    /**
     * Remaining fires; {@code null} means unbounded.
     */
    public synchronized @Nullable Integer getCount() {
        return count;
    }

    public synchronized @NotNull TriggerState getState() {
        return state;
    }

    /**
     * True once the trigger was cancelled or disabled.
     */
    public synchronized boolean isCancellationRequested() {
        return state == TriggerState.CANCELLED || state == TriggerState.DISABLED;
    }

    /**
     * Stops future fires for good. A fire already started is not affected.
     *
     * @return false if the trigger had already ended
     */
    public synchronized boolean requestCancellation() {
        if (state.isTerminal()) return false;
        state = TriggerState.CANCELLED;
        stopSignal.complete(TriggerState.CANCELLED);
        return true;
    }

    /**
     * Stops future fires, keeping the remaining count so the trigger can be resumed.
     *
     * @return false if the trigger was not pending or active
     */
    public synchronized boolean disable() {
        if (state != TriggerState.PENDING && state != TriggerState.ACTIVE) return false;
        state = TriggerState.DISABLED;
        stopSignal.complete(TriggerState.DISABLED);
        return true;
    }

    /**
     * Next fire time given the previous fire, or empty when the trigger will not fire again.
     *
     * @param lastFireStart start of the previous fire, {@code null} before the first one
     * @param lastFireEnd   end of the previous fire, {@code null} while it runs
     * @throws IllegalStateException for an end-to-start trigger whose previous fire did not end
     */
    public Optional<Instant> nextFireTime(@Nullable Instant lastFireStart, @Nullable Instant lastFireEnd) {
        synchronized (this) {
            if (isCancellationRequested() || state == TriggerState.EXHAUSTED) return Optional.empty();
            if (count != null && count <= 0) return Optional.empty();
        }
        if (lastFireStart == null) {
            return Optional.of(Instant.now().plus(startDelay));
        }
        if (intervalKind == IntervalKind.START_TO_START) {
            return Optional.of(lastFireStart.plus(interval));
        }
        if (lastFireEnd == null) {
            throw new IllegalStateException("Trigger " + id + " is end-to-start but the previous fire has not ended");
        }
        return Optional.of(lastFireEnd.plus(interval));
    }

    /* ============ Firing loop support ============ */

    /**
     * Moves a pending or disabled trigger to {@link TriggerState#ACTIVE}.
     *
     * @return the stop signal of the new activation, or null if the trigger cannot fire
     */
    synchronized @Nullable CompletableFuture<TriggerState> activate() {
        if (state == TriggerState.DISABLED) {
            if (count != null && count <= 0) return null;
            stopSignal = new CompletableFuture<>();
        } else if (state != TriggerState.PENDING) {
            return null;
        }
        state = TriggerState.ACTIVE;
        return stopSignal;
    }

    /**
     * Takes one fire from the count, refusing it once the activation was stopped.
     */
    synchronized boolean tryConsumeFire(CompletableFuture<TriggerState> activation) {
        if (activation != stopSignal || state != TriggerState.ACTIVE) return false;
        if (count != null) {
            if (count <= 0) return false;
            count--;
        }
        return true;
    }

    synchronized TriggerState markExhausted(CompletableFuture<TriggerState> activation) {
        if (activation == stopSignal && state == TriggerState.ACTIVE) {
            state = TriggerState.EXHAUSTED;
            stopSignal.complete(TriggerState.EXHAUSTED);
        }
        return activation.getNow(TriggerState.EXHAUSTED);
    }

    @Override
    public String toString() {
        return "Trigger{id=" + id + ", interval=" + interval + ", kind=" + intervalKind +
                ", count=" + getCount() + ", state=" + getState() + '}';
    }

    public static class Builder {
        private UUID id;
        private Duration interval = Duration.ZERO;
        private IntervalKind intervalKind = IntervalKind.START_TO_START;
        private Duration startDelay = Duration.ZERO;
        private Integer count;

        protected Builder() {
        }

        public Builder id(UUID id) {
            this.id = Objects.requireNonNull(id);
            return this;
        }

        public Builder interval(Duration interval) {
            Objects.requireNonNull(interval);
            checkArgument(!interval.isNegative(), "interval must not be negative: %s", interval);
            this.interval = interval;
            return this;
        }

        public Builder intervalKind(IntervalKind intervalKind) {
            this.intervalKind = Objects.requireNonNull(intervalKind);
            return this;
        }

        /**
         * Delay of the first fire after the trigger is started.
         */
        public Builder startDelay(Duration startDelay) {
            Objects.requireNonNull(startDelay);
            checkArgument(!startDelay.isNegative(), "startDelay must not be negative: %s", startDelay);
            this.startDelay = startDelay;
            return this;
        }

        /**
         * Number of fires; {@code null} fires until cancelled.
         */
        public Builder count(@Nullable Integer count) {
            checkArgument(count == null || count > 0, "count must be positive: %s", count);
            this.count = count;
            return this;
        }

        public Trigger build() {
            checkArgument(count != null || !interval.isZero(), "an unbounded trigger needs a positive interval");
            return new Trigger(this);
        }
    }
}
