package io.github.byzatic.scheduling.jobs;

public enum JobKind {
    /**
     * Data-described job run by the workflow executor.
     */
    WORKFLOW,
    /**
     * Job wrapping a function.
     */
    FUNCTION
}
