package org.readacademy.engine.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a consultation request.
 * Transitions only move forward; cancellation is the one way back into the
 * capacity pool and is itself terminal.
 */
public enum RequestStatus {
    PENDING,
    ASSIGNED,
    WAITLISTED,
    EXPIRED,
    CANCELLED;

    /**
     * Whether a request in this status may move to {@code next}.
     */
    public boolean canTransitionTo(RequestStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    public String code() {
        return name().toLowerCase();
    }

    private Set<RequestStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ASSIGNED, WAITLISTED, EXPIRED);
            case WAITLISTED:
                return EnumSet.of(ASSIGNED, EXPIRED, CANCELLED);
            case ASSIGNED:
                return EnumSet.of(CANCELLED);
            default:
                return EnumSet.noneOf(RequestStatus.class);
        }
    }
}
