package io.github.byzatic.scheduling.jobs;

/**
 * Execution states of a job result.
 */
public enum JobState {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
