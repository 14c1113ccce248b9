package org.readacademy.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of one allocation pass, decisions in ranked order.
 * A provisional result was never committed to the store.
 */
public final class AllocationResult {

    private final List<AllocationDecision> decisions;
    private final List<Assignment> assignments;
    private final List<WaitlistEntry> waitlisted;
    private final boolean provisional;

    public AllocationResult(List<AllocationDecision> decisions, List<Assignment> assignments,
                            List<WaitlistEntry> waitlisted, boolean provisional) {
        this.decisions = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(decisions, "decisions must not be null")));
        this.assignments = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(assignments, "assignments must not be null")));
        this.waitlisted = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(waitlisted, "waitlisted must not be null")));
        this.provisional = provisional;
    }

    public List<AllocationDecision> getDecisions() {
        return decisions;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public List<WaitlistEntry> getWaitlisted() {
        return waitlisted;
    }

    public boolean isProvisional() {
        return provisional;
    }

    public AllocationResult asProvisional() {
        return new AllocationResult(decisions, assignments, waitlisted, true);
    }

    public AllocationDecision decisionFor(String requestId) {
        return decisions.stream()
                .filter(d -> d.getRequestId().equals(requestId))
                .findFirst()
                .orElse(null);
    }

    public List<AllocationDecision> rejected() {
        return decisions.stream()
                .filter(d -> d.getStatus() == RequestStatus.PENDING)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("AllocationResult{assigned=%d, waitlisted=%d, rejected=%d, provisional=%s}",
                assignments.size(), waitlisted.size(), rejected().size(), provisional);
    }
}
