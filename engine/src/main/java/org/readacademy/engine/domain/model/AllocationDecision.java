package org.readacademy.engine.domain.model;

import java.util.Objects;

/**
 * One line of the staff-facing report: where a request ended up and why.
 */
public final class AllocationDecision {

    private final String requestId;
    private final RequestStatus status;
    private final String slotId;
    private final String reasonCode;
    private final String assignmentId;

    public AllocationDecision(String requestId, RequestStatus status, String slotId,
                              String reasonCode, String assignmentId) {
        this.requestId = Objects.requireNonNull(requestId, "requestId must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.reasonCode = Objects.requireNonNull(reasonCode, "reasonCode must not be null");
        this.slotId = slotId;
        this.assignmentId = assignmentId;
    }

    public static AllocationDecision assigned(Assignment assignment) {
        return new AllocationDecision(assignment.getRequestId(), RequestStatus.ASSIGNED,
                assignment.getSlotId(), assignment.getReasonCode(), assignment.getAssignmentId());
    }

    public static AllocationDecision waitlisted(WaitlistEntry entry) {
        return new AllocationDecision(entry.getRequestId(), RequestStatus.WAITLISTED,
                entry.getSlotId(), entry.getReason().getCode(), null);
    }

    public static AllocationDecision rejected(String requestId, ReasonCode reason) {
        return new AllocationDecision(requestId, RequestStatus.PENDING, null, reason.getCode(), null);
    }

    public String getRequestId() {
        return requestId;
    }

    public RequestStatus getStatus() {
        return status;
    }

    public String getSlotId() {
        return slotId;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public String getAssignmentId() {
        return assignmentId;
    }

    public boolean isAssigned() {
        return status == RequestStatus.ASSIGNED;
    }

    public boolean isWaitlisted() {
        return status == RequestStatus.WAITLISTED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AllocationDecision)) {
            return false;
        }
        AllocationDecision that = (AllocationDecision) o;
        return requestId.equals(that.requestId)
                && status == that.status
                && Objects.equals(slotId, that.slotId)
                && reasonCode.equals(that.reasonCode)
                && Objects.equals(assignmentId, that.assignmentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, status, slotId, reasonCode, assignmentId);
    }

    @Override
    public String toString() {
        return String.format("%s -> %s %s (%s)", requestId, status.code(),
                slotId != null ? slotId : "-", reasonCode);
    }
}
