package io.github.byzatic.scheduling.base_exceptions;

/**
 * Base of the scheduler's checked exceptions. Scheduler operations report it
 * inside a failed {@code OperationResult}; only lifecycle calls surface it directly.
 */
public class SchedulingException extends Exception {
    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(Throwable cause) {
        super(cause);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }

    public SchedulingException(Throwable cause, String message) {
        super(message, cause);
    }
}
