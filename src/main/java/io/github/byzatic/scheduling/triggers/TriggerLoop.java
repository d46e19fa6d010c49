package io.github.byzatic.scheduling.triggers;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Firing loop of one trigger activation.
 * <p>
 * Sleeps until the next fire time on a wait that the trigger's stop signal ends at once,
 * hands every fire to the {@link FiringLoopHandler} without waiting for it (start-to-start),
 * or waits for its result first (end-to-start). Runs until the count is used up, the trigger
 * is cancelled or disabled, or the next fire time cannot be computed.
 */
public final class TriggerLoop implements Runnable {
    private final static Logger logger = LoggerFactory.getLogger(TriggerLoop.class);

    private final Trigger trigger;
    private final FiringLoopHandler handler;
    private final CompletableFuture<TriggerState> stopSignal;
    private final AtomicInteger fires = new AtomicInteger();

    private TriggerLoop(Trigger trigger, FiringLoopHandler handler, CompletableFuture<TriggerState> stopSignal) {
        this.trigger = trigger;
        this.handler = handler;
        this.stopSignal = stopSignal;
    }

    /**
     * Activates the trigger (pending, or disabled with fires left) and creates its loop.
     * The caller submits the returned loop to an executor.
     *
     * @return empty if the trigger is active already or has ended
     */
    public static Optional<TriggerLoop> activate(@NotNull Trigger trigger, @NotNull FiringLoopHandler handler) {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(handler, "handler");
        CompletableFuture<TriggerState> signal = trigger.activate();
        if (signal == null) return Optional.empty();
        return Optional.of(new TriggerLoop(trigger, handler, signal));
    }

    public @NotNull Trigger getTrigger() {
        return trigger;
    }

    /**
     * Fires started by this loop.
     */
    public int getFireCount() {
        return fires.get();
    }

    public boolean isStopped() {
        return stopSignal.isDone();
    }

    @Override
    public void run() {
        TriggerState exitState = TriggerState.EXHAUSTED;
        try {
            exitState = loop();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            trigger.requestCancellation();
            exitState = stopSignal.getNow(TriggerState.CANCELLED);
        } catch (RuntimeException ex) {
            logger.error("Firing loop of trigger {} failed, the trigger is terminated", trigger.getId(), ex);
            exitState = trigger.markExhausted(stopSignal);
        } finally {
            logger.debug("Firing loop of trigger {} ended as {} after {} fire(s)", trigger.getId(), exitState, fires.get());
            try {
                handler.onLoopExit(this, exitState);
            } catch (RuntimeException ex) {
                logger.error("Loop exit handler failed for trigger {}", trigger.getId(), ex);
            }
        }
    }

    private TriggerState loop() throws InterruptedException {
        Instant lastStart = null;
        Instant lastEnd = null;
        while (true) {
            if (stopSignal.isDone()) return stopSignal.join();

            Optional<Instant> next;
            try {
                next = trigger.nextFireTime(lastStart, lastEnd);
            } catch (RuntimeException ex) {
                logger.error("Cannot compute the next fire time of trigger {}, the trigger is terminated", trigger.getId(), ex);
                return trigger.markExhausted(stopSignal);
            }
            if (next.isEmpty()) return trigger.markExhausted(stopSignal);

            long delayMillis = Duration.between(Instant.now(), next.get()).toMillis();
            if (delayMillis > 0 && awaitStop(delayMillis)) return stopSignal.join();

            if (trigger.getIntervalKind() == IntervalKind.END_TO_START && awaitUnfinishedFire()) {
                if (stopSignal.isDone()) return stopSignal.join();
                lastStart = lastEnd = Instant.now();
                continue;
            }

            if (!trigger.tryConsumeFire(stopSignal)) {
                return stopSignal.isDone() ? stopSignal.join() : trigger.markExhausted(stopSignal);
            }

            lastStart = Instant.now();
            int fire = fires.incrementAndGet();
            logger.debug("Trigger {} fire #{}", trigger.getId(), fire);
            CompletableFuture<?> completion = fire();

            if (trigger.getIntervalKind() == IntervalKind.END_TO_START) {
                awaitCompletion(completion);
                lastEnd = Instant.now();
            }
        }
    }

    /**
     * Waits for a fire of this trigger still running from an earlier activation.
     *
     * @return false if there was none
     */
    private boolean awaitUnfinishedFire() throws InterruptedException {
        CompletableFuture<?> previous = handler.lastFire(trigger);
        if (previous == null || previous.isDone()) return false;
        logger.debug("Trigger {} waits for the fire of its previous activation", trigger.getId());
        awaitCompletion(previous);
        return true;
    }

    private CompletableFuture<?> fire() {
        try {
            return handler.onFire(trigger);
        } catch (RuntimeException ex) {
            logger.error("Fire of trigger {} could not be started", trigger.getId(), ex);
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * @return true if the stop signal arrived before the timeout
     */
    private boolean awaitStop(long millis) throws InterruptedException {
        try {
            stopSignal.get(millis, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException te) {
            return false;
        } catch (ExecutionException ee) {
            return true;
        }
    }

    private void awaitCompletion(CompletableFuture<?> completion) throws InterruptedException {
        try {
            CompletableFuture.anyOf(completion, stopSignal).get();
        } catch (ExecutionException ee) {
            logger.debug("Fire of trigger {} completed exceptionally", trigger.getId(), ee.getCause());
        }
    }

    @Override
    public String toString() {
        return "TriggerLoop{trigger=" + trigger.getId() + ", fires=" + fires.get() + ", stopped=" + isStopped() + '}';
    }
}
