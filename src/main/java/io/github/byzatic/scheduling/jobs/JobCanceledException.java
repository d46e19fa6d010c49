package io.github.byzatic.scheduling.jobs;

import java.util.concurrent.CancellationException;

/**
 * Thrown by a job that honours its {@link CancellationToken}; recorded as {@link JobState#CANCELED}.
 */
public class JobCanceledException extends CancellationException {
    public JobCanceledException(String message) {
        super(message);
    }
}
