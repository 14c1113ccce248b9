package org.readacademy.engine.domain.exception;

/**
 * An allocation cycle was started with nothing to allocate.
 */
public class EmptyRequestPoolException extends SchedulingException {

    public EmptyRequestPoolException() {
        super("Request pool is empty, nothing to allocate");
    }
}
