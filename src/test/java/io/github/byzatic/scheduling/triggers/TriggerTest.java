package io.github.byzatic.scheduling.triggers;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class TriggerTest {

    @Test
    void builder_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> Trigger.builder().count(0));
        assertThrows(IllegalArgumentException.class, () -> Trigger.builder().interval(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> Trigger.builder().startDelay(Duration.ofMillis(-1)));
        // unbounded with zero interval would spin
        assertThrows(IllegalArgumentException.class, () -> Trigger.builder().build());
    }

    @Test
    void once_firesOnceImmediately() {
        Trigger t = Trigger.once();
        assertEquals(1, t.getCount());
        assertEquals(TriggerState.PENDING, t.getState());
        assertEquals(Duration.ZERO, t.getStartDelay());
        assertFalse(t.isCancellationRequested());
    }

    @Test
    void nextFireTime_firstFireHonoursStartDelay() {
        Trigger t = Trigger.builder().count(1).startDelay(Duration.ofSeconds(5)).build();
        Instant before = Instant.now();
        Instant next = t.nextFireTime(null, null).orElseThrow();
        assertFalse(next.isBefore(before.plusSeconds(5)));
    }

    @Test
    void nextFireTime_startToStart_usesLastStart() {
        Trigger t = Trigger.builder().interval(Duration.ofMillis(30)).build();
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        assertEquals(Optional.of(start.plusMillis(30)), t.nextFireTime(start, null));
    }

    @Test
    void nextFireTime_endToStart_usesLastEnd_andRequiresIt() {
        Trigger t = Trigger.builder().interval(Duration.ofMillis(30)).intervalKind(IntervalKind.END_TO_START).build();
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = start.plusSeconds(2);
        assertEquals(Optional.of(end.plusMillis(30)), t.nextFireTime(start, end));
        assertThrows(IllegalStateException.class, () -> t.nextFireTime(start, null));
    }

    @Test
    void nextFireTime_emptyOnceCancelledOrDisabled() {
        Trigger cancelled = Trigger.builder().interval(Duration.ofMillis(10)).build();
        assertTrue(cancelled.requestCancellation());
        assertTrue(cancelled.nextFireTime(null, null).isEmpty());

        Trigger disabled = Trigger.builder().interval(Duration.ofMillis(10)).build();
        assertTrue(disabled.disable());
        assertTrue(disabled.isCancellationRequested());
        assertTrue(disabled.nextFireTime(null, null).isEmpty());
    }

    @Test
    void consumeFire_decrementsCount_andRefusesAfterCancellation() {
        Trigger t = Trigger.builder().count(2).build();
        CompletableFuture<TriggerState> activation = t.activate();
        assertNotNull(activation);
        assertEquals(TriggerState.ACTIVE, t.getState());

        assertTrue(t.tryConsumeFire(activation));
        assertEquals(1, t.getCount());

        t.requestCancellation();
        assertFalse(t.tryConsumeFire(activation), "No fire may start after cancellation");
        assertEquals(1, t.getCount());
        assertEquals(TriggerState.CANCELLED, activation.join());
    }

    @Test
    void requestCancellation_isRefusedOnceEnded() {
        Trigger t = Trigger.once();
        assertTrue(t.requestCancellation());
        assertFalse(t.requestCancellation());
        assertFalse(t.disable());
        assertNull(t.activate(), "A cancelled trigger cannot be activated again");
    }

    @Test
    void disabledTrigger_reactivatesWithNewSignal_andKeepsCount() {
        Trigger t = Trigger.builder().count(3).build();
        CompletableFuture<TriggerState> first = t.activate();
        assertTrue(t.tryConsumeFire(first));
        assertTrue(t.disable());
        assertEquals(TriggerState.DISABLED, first.join());

        CompletableFuture<TriggerState> second = t.activate();
        assertNotNull(second);
        assertNotSame(first, second);
        assertEquals(TriggerState.ACTIVE, t.getState());
        assertEquals(2, t.getCount());
        assertFalse(t.tryConsumeFire(first), "The old activation must not fire again");
        assertTrue(t.tryConsumeFire(second));
    }

    @Test
    void markExhausted_onlyAffectsCurrentActivation() {
        Trigger t = Trigger.builder().count(1).build();
        CompletableFuture<TriggerState> activation = t.activate();
        assertEquals(TriggerState.EXHAUSTED, t.markExhausted(activation));
        assertEquals(TriggerState.EXHAUSTED, t.getState());
        assertTrue(t.getState().isTerminal());
    }
}
