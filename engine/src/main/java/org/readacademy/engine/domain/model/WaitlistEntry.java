package org.readacademy.engine.domain.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A request waiting for capacity in its most preferred slot.
 * {@code slotId} is null for requests that named no slot; those are only ever
 * assigned by staff.
 */
public final class WaitlistEntry {

    /**
     * Stored waitlist order: priority score, then request id for identical scores.
     */
    public static final Comparator<WaitlistEntry> ORDER = Comparator
            .comparing(WaitlistEntry::getScore)
            .thenComparing(WaitlistEntry::getRequestId);

    private final ConsultationRequest request;
    private final String slotId;
    private final PriorityScore score;
    private final ReasonCode reason;
    private final Instant listedAt;

    public WaitlistEntry(ConsultationRequest request, String slotId, PriorityScore score,
                         ReasonCode reason, Instant listedAt) {
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.score = Objects.requireNonNull(score, "score must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.listedAt = Objects.requireNonNull(listedAt, "listedAt must not be null");
        this.slotId = slotId;
    }

    public ConsultationRequest getRequest() {
        return request;
    }

    public String getRequestId() {
        return request.getRequestId();
    }

    public String getGuardianId() {
        return request.getGuardianId();
    }

    public String getSlotId() {
        return slotId;
    }

    public PriorityScore getScore() {
        return score;
    }

    public ReasonCode getReason() {
        return reason;
    }

    public Instant getListedAt() {
        return listedAt;
    }

    /**
     * Entries wait-listed behind a blackout or against no slot never move on their own.
     */
    public boolean isAutoPromotable() {
        return slotId != null && reason != ReasonCode.ALL_BLACKOUT;
    }

    @Override
    public String toString() {
        return String.format("WaitlistEntry{request='%s', slot='%s', reason=%s, score=%s}",
                getRequestId(), slotId, reason, score);
    }
}
