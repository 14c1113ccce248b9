package org.readacademy.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of cancelling an assignment: the cancelled record plus any
 * wait-listed requests promoted into the freed capacity.
 */
public final class CancellationResult {

    private final Assignment cancelled;
    private final List<Assignment> promoted;

    public CancellationResult(Assignment cancelled, List<Assignment> promoted) {
        this.cancelled = Objects.requireNonNull(cancelled, "cancelled must not be null");
        this.promoted = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(promoted, "promoted must not be null")));
    }

    public Assignment getCancelled() {
        return cancelled;
    }

    public List<Assignment> getPromoted() {
        return promoted;
    }

    public boolean hasPromotion() {
        return !promoted.isEmpty();
    }

    @Override
    public String toString() {
        return "CancellationResult{cancelled=" + cancelled.getAssignmentId() + ", promoted=" + promoted.size() + '}';
    }
}
