package org.readacademy.engine.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A finalized consultation application waiting for a slot.
 * Every field is fixed at creation except {@link #getStatus() status}.
 */
public final class ConsultationRequest {

    public static final int MIN_GRADE = 1;
    public static final int MAX_GRADE = 6;
    public static final int MAX_DISTANCE_TIER = 4;

    private final String requestId;
    private final String guardianId;
    private final String studentId;
    private final List<String> desiredSlotIds;
    private final Instant submittedAt;
    private final int gradeLevel;
    private final boolean siblingEnrolled;
    private final int distanceTier;
    private final boolean applicationComplete;

    private volatile RequestStatus status;

    private ConsultationRequest(Builder builder) {
        this.requestId = Objects.requireNonNull(builder.requestId, "requestId must not be null");
        this.guardianId = Objects.requireNonNull(builder.guardianId, "guardianId must not be null");
        this.studentId = Objects.requireNonNull(builder.studentId, "studentId must not be null");
        this.submittedAt = Objects.requireNonNull(builder.submittedAt, "submittedAt must not be null");
        this.desiredSlotIds = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(builder.desiredSlotIds, "desiredSlotIds must not be null")));
        if (desiredSlotIds.contains(null)) {
            throw new IllegalArgumentException("desiredSlotIds must not contain null for request " + requestId);
        }
        if (builder.gradeLevel < MIN_GRADE || builder.gradeLevel > MAX_GRADE) {
            throw new IllegalArgumentException("gradeLevel must be between " + MIN_GRADE + " and " + MAX_GRADE
                    + " for request " + requestId + ": " + builder.gradeLevel);
        }
        if (builder.distanceTier < 0 || builder.distanceTier > MAX_DISTANCE_TIER) {
            throw new IllegalArgumentException("distanceTier must be between 0 and " + MAX_DISTANCE_TIER
                    + " for request " + requestId + ": " + builder.distanceTier);
        }
        this.gradeLevel = builder.gradeLevel;
        this.siblingEnrolled = builder.siblingEnrolled;
        this.distanceTier = builder.distanceTier;
        this.applicationComplete = builder.applicationComplete;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
    }

    public String getRequestId() {
        return requestId;
    }

    public String getGuardianId() {
        return guardianId;
    }

    public String getStudentId() {
        return studentId;
    }

    /**
     * Acceptable slots, most preferred first.
     */
    public List<String> getDesiredSlotIds() {
        return desiredSlotIds;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public int getGradeLevel() {
        return gradeLevel;
    }

    public boolean isSiblingEnrolled() {
        return siblingEnrolled;
    }

    public int getDistanceTier() {
        return distanceTier;
    }

    public boolean isApplicationComplete() {
        return applicationComplete;
    }

    public RequestStatus getStatus() {
        return status;
    }

    public boolean hasPreferences() {
        return !desiredSlotIds.isEmpty();
    }

    /**
     * Most preferred slot, or null when the request names none.
     */
    public String getMostPreferredSlotId() {
        return desiredSlotIds.isEmpty() ? null : desiredSlotIds.get(0);
    }

    /**
     * Move to the next lifecycle status.
     *
     * @throws IllegalStateException if the transition would go backwards
     */
    public synchronized void transitionTo(RequestStatus next) {
        Objects.requireNonNull(next, "next must not be null");
        if (status == next) {
            return;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(String.format(
                    "Request %s cannot move from %s to %s", requestId, status, next));
        }
        status = next;
    }

    @Override
    public String toString() {
        return String.format("ConsultationRequest{id='%s', guardian='%s', student='%s', desired=%s, status=%s}",
                requestId, guardianId, studentId, desiredSlotIds, status);
    }

    /**
     * Builder for ConsultationRequest.
     */
    public static final class Builder {
        private String requestId;
        private String guardianId;
        private String studentId;
        private List<String> desiredSlotIds = Collections.emptyList();
        private Instant submittedAt;
        private int gradeLevel = MIN_GRADE;
        private boolean siblingEnrolled;
        private int distanceTier;
        private boolean applicationComplete;
        private RequestStatus status = RequestStatus.PENDING;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder guardianId(String guardianId) {
            this.guardianId = guardianId;
            return this;
        }

        public Builder studentId(String studentId) {
            this.studentId = studentId;
            return this;
        }

        public Builder desiredSlotIds(List<String> desiredSlotIds) {
            this.desiredSlotIds = desiredSlotIds;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder gradeLevel(int gradeLevel) {
            this.gradeLevel = gradeLevel;
            return this;
        }

        public Builder siblingEnrolled(boolean siblingEnrolled) {
            this.siblingEnrolled = siblingEnrolled;
            return this;
        }

        public Builder distanceTier(int distanceTier) {
            this.distanceTier = distanceTier;
            return this;
        }

        public Builder applicationComplete(boolean applicationComplete) {
            this.applicationComplete = applicationComplete;
            return this;
        }

        public Builder status(RequestStatus status) {
            this.status = status;
            return this;
        }

        public ConsultationRequest build() {
            return new ConsultationRequest(this);
        }
    }
}
