package io.github.byzatic.scheduling.base_exceptions;

/**
 * A scheduled job, running job or trigger id did not resolve.
 */
public class ScheduledEntityNotFoundException extends SchedulingException {
    public ScheduledEntityNotFoundException(String message) {
        super(message);
    }

    public ScheduledEntityNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
