package io.github.byzatic.scheduling.jobs;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation token of one execution. Signalled through its {@link CancellationTokenSource}.
 */
public final class CancellationToken {
    private final CountDownLatch signalled = new CountDownLatch(1);
    private volatile String reason = "";

    CancellationToken() {
    }

    public boolean isCancellationRequested() {
        return signalled.getCount() == 0;
    }

    public @NotNull String reason() {
        return reason;
    }

    synchronized void signal(String reason) {
        if (isCancellationRequested()) return;
        this.reason = reason;
        signalled.countDown();
    }

    /**
     * Helper: throws {@link JobCanceledException} if cancellation was requested.
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) throw new JobCanceledException("Cancellation requested: " + reason);
    }

    /**
     * Sleeps up to {@code timeout}, waking early on cancellation.
     *
     * @return true if cancellation was requested
     */
    public boolean awaitCancellation(@NotNull Duration timeout) throws InterruptedException {
        return signalled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
