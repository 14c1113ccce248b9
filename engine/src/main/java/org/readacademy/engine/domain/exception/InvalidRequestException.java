package org.readacademy.engine.domain.exception;

/**
 * An inbound record could not be turned into a fully populated consultation request.
 */
public class InvalidRequestException extends SchedulingException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
