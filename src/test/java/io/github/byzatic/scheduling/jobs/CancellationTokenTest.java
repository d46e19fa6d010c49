package io.github.byzatic.scheduling.jobs;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void defaultNotCancelled_thenCancel_setsFlagAndReason() {
        CancellationTokenSource source = new CancellationTokenSource();
        CancellationToken t = source.getToken();
        assertFalse(t.isCancellationRequested());
        assertEquals("", t.reason());

        source.cancel("because");
        assertTrue(t.isCancellationRequested());
        assertTrue(source.isCancellationRequested());
        assertEquals("because", t.reason());
    }

    @Test
    void firstReasonWins() {
        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel("first");
        source.cancel("second");
        assertEquals("first", source.getToken().reason());
    }

    @Test
    void throwIfCancellationRequested_throwsJobCanceledException() {
        CancellationTokenSource source = new CancellationTokenSource();
        source.getToken().throwIfCancellationRequested();

        source.cancel("halt");
        JobCanceledException ex = assertThrows(JobCanceledException.class, source.getToken()::throwIfCancellationRequested);
        assertTrue(ex.getMessage().contains("halt"));
    }

    @Test
    void awaitCancellation_returnsEarlyOnceSignalled() throws Exception {
        CancellationTokenSource source = new CancellationTokenSource();
        assertFalse(source.getToken().awaitCancellation(Duration.ofMillis(20)));

        new Thread(() -> source.cancel("stop")).start();
        assertTrue(source.getToken().awaitCancellation(Duration.ofSeconds(2)));
    }
}
