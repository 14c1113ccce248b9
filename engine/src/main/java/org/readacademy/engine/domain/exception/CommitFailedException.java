package org.readacademy.engine.domain.exception;

import org.readacademy.engine.domain.model.AllocationResult;

/**
 * The schedule store refused or failed a commit. In-memory state has been
 * rolled back by the time callers see this; {@link #getProvisionalResult()}
 * describes what would have been committed, if known.
 */
public class CommitFailedException extends SchedulingException {

    private final transient AllocationResult provisionalResult;

    public CommitFailedException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public CommitFailedException(String message, Throwable cause, AllocationResult provisionalResult) {
        super(message, cause);
        this.provisionalResult = provisionalResult;
    }

    public AllocationResult getProvisionalResult() {
        return provisionalResult;
    }

    public CommitFailedException withProvisionalResult(AllocationResult result) {
        CommitFailedException copy = new CommitFailedException(getMessage(), getCause(), result.asProvisional());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
