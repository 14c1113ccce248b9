package org.readacademy.engine.store;

import org.readacademy.engine.domain.model.AllocationDecision;
import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.WaitlistEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one allocator operation wants persisted, committed as a unit.
 */
public final class ScheduleBatch {

    private final List<AllocationDecision> decisions;
    private final List<Assignment> assignments;
    private final List<Assignment> cancellations;
    private final List<WaitlistEntry> waitlisted;

    private ScheduleBatch(Builder builder) {
        this.decisions = Collections.unmodifiableList(new ArrayList<>(builder.decisions));
        this.assignments = Collections.unmodifiableList(new ArrayList<>(builder.assignments));
        this.cancellations = Collections.unmodifiableList(new ArrayList<>(builder.cancellations));
        this.waitlisted = Collections.unmodifiableList(new ArrayList<>(builder.waitlisted));
    }

    /**
     * Status and reason code of every request touched, in decision order.
     */
    public List<AllocationDecision> getDecisions() {
        return decisions;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public List<Assignment> getCancellations() {
        return cancellations;
    }

    public List<WaitlistEntry> getWaitlisted() {
        return waitlisted;
    }

    public boolean isEmpty() {
        return decisions.isEmpty() && assignments.isEmpty() && cancellations.isEmpty() && waitlisted.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ScheduleBatch{decisions=%d, assignments=%d, cancellations=%d, waitlisted=%d}",
                decisions.size(), assignments.size(), cancellations.size(), waitlisted.size());
    }

    /**
     * Builder for ScheduleBatch.
     */
    public static final class Builder {
        private final List<AllocationDecision> decisions = new ArrayList<>();
        private final List<Assignment> assignments = new ArrayList<>();
        private final List<Assignment> cancellations = new ArrayList<>();
        private final List<WaitlistEntry> waitlisted = new ArrayList<>();

        public Builder decision(AllocationDecision decision) {
            decisions.add(decision);
            return this;
        }

        public Builder decisions(List<AllocationDecision> values) {
            decisions.addAll(values);
            return this;
        }

        public Builder assignment(Assignment assignment) {
            assignments.add(assignment);
            return this;
        }

        public Builder assignments(List<Assignment> values) {
            assignments.addAll(values);
            return this;
        }

        public Builder cancellations(List<Assignment> values) {
            cancellations.addAll(values);
            return this;
        }

        public Builder waitlisted(List<WaitlistEntry> values) {
            waitlisted.addAll(values);
            return this;
        }

        public ScheduleBatch build() {
            return new ScheduleBatch(this);
        }
    }
}
