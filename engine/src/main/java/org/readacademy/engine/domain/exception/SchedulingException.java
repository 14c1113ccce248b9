package org.readacademy.engine.domain.exception;

/**
 * Base type for failures raised by the scheduling engine.
 */
public class SchedulingException extends RuntimeException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
