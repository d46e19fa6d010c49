package io.github.byzatic.scheduling.jobs;

import org.jetbrains.annotations.NotNull;

/**
 * Owner side of a {@link CancellationToken}. One is created per running job.
 */
public final class CancellationTokenSource {
    private final CancellationToken token = new CancellationToken();

    public @NotNull CancellationToken getToken() {
        return token;
    }

    /**
     * Signals the token. Only the first reason is kept.
     */
    public void cancel(@NotNull String reason) {
        token.signal(reason);
    }

    public boolean isCancellationRequested() {
        return token.isCancellationRequested();
    }
}
