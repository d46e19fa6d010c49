package io.github.byzatic.scheduling.base_exceptions;

public class OperationNotSupportedException extends SchedulingException {
    public OperationNotSupportedException(String message) {
        super(message);
    }

    public OperationNotSupportedException(String message, Throwable cause) {
        super(message, cause);
    }
}
