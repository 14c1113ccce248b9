package org.readacademy.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A committed binding of one request to one slot. Immutable: cancelling an
 * assignment produces a cancelled copy, the original record never changes.
 */
public final class Assignment {

    private final String assignmentId;
    private final String requestId;
    private final String guardianId;
    private final String slotId;
    private final TimeWindow window;
    private final Instant decidedAt;
    private final String reasonCode;
    private final Instant cancelledAt;

    private Assignment(Builder builder) {
        this.requestId = Objects.requireNonNull(builder.requestId, "requestId must not be null");
        this.slotId = Objects.requireNonNull(builder.slotId, "slotId must not be null");
        this.guardianId = Objects.requireNonNull(builder.guardianId, "guardianId must not be null");
        this.window = Objects.requireNonNull(builder.window, "window must not be null");
        this.decidedAt = Objects.requireNonNull(builder.decidedAt, "decidedAt must not be null");
        this.reasonCode = Objects.requireNonNull(builder.reasonCode, "reasonCode must not be null");
        this.assignmentId = builder.assignmentId != null ? builder.assignmentId : idFor(requestId, slotId);
        this.cancelledAt = builder.cancelledAt;
    }

    /**
     * Deterministic identifier so repeated runs over the same input name assignments identically.
     */
    public static String idFor(String requestId, String slotId) {
        return "asg-" + requestId + "-" + slotId;
    }

    public String getAssignmentId() {
        return assignmentId;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getGuardianId() {
        return guardianId;
    }

    public String getSlotId() {
        return slotId;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public boolean isActive() {
        return cancelledAt == null;
    }

    public Assignment cancelledAt(Instant when) {
        Objects.requireNonNull(when, "when must not be null");
        if (!isActive()) {
            throw new IllegalStateException("Assignment " + assignmentId + " is already cancelled");
        }
        return new Builder()
                .assignmentId(assignmentId)
                .requestId(requestId)
                .guardianId(guardianId)
                .slotId(slotId)
                .window(window)
                .decidedAt(decidedAt)
                .reasonCode(reasonCode)
                .cancelledAt(when)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment that = (Assignment) o;
        return assignmentId.equals(that.assignmentId)
                && requestId.equals(that.requestId)
                && slotId.equals(that.slotId)
                && reasonCode.equals(that.reasonCode)
                && Objects.equals(cancelledAt, that.cancelledAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assignmentId, requestId, slotId, reasonCode, cancelledAt);
    }

    @Override
    public String toString() {
        return String.format("Assignment{id='%s', request='%s', slot='%s', reason=%s, active=%s}",
                assignmentId, requestId, slotId, reasonCode, isActive());
    }

    /**
     * Builder for Assignment.
     */
    public static final class Builder {
        private String assignmentId;
        private String requestId;
        private String guardianId;
        private String slotId;
        private TimeWindow window;
        private Instant decidedAt;
        private String reasonCode;
        private Instant cancelledAt;

        public Builder assignmentId(String assignmentId) {
            this.assignmentId = assignmentId;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder guardianId(String guardianId) {
            this.guardianId = guardianId;
            return this;
        }

        public Builder slotId(String slotId) {
            this.slotId = slotId;
            return this;
        }

        public Builder window(TimeWindow window) {
            this.window = window;
            return this;
        }

        public Builder decidedAt(Instant decidedAt) {
            this.decidedAt = decidedAt;
            return this;
        }

        public Builder reasonCode(String reasonCode) {
            this.reasonCode = reasonCode;
            return this;
        }

        public Builder cancelledAt(Instant cancelledAt) {
            this.cancelledAt = cancelledAt;
            return this;
        }

        public Assignment build() {
            return new Assignment(this);
        }
    }
}
