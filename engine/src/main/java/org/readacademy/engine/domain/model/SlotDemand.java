package org.readacademy.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * How many open requests want one slot, and in which priority order.
 */
public final class SlotDemand {

    private final String slotId;
    private final TimeWindow window;
    private final int applicantCount;
    private final int firstPreferenceCount;
    private final int remainingCapacity;
    private final boolean highlighted;
    private final List<String> rankedRequestIds;

    public SlotDemand(String slotId, TimeWindow window, int applicantCount, int firstPreferenceCount,
                      int remainingCapacity, boolean highlighted, List<String> rankedRequestIds) {
        this.slotId = Objects.requireNonNull(slotId, "slotId must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.applicantCount = applicantCount;
        this.firstPreferenceCount = firstPreferenceCount;
        this.remainingCapacity = remainingCapacity;
        this.highlighted = highlighted;
        this.rankedRequestIds = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(rankedRequestIds, "rankedRequestIds must not be null")));
    }

    public String getSlotId() {
        return slotId;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public int getApplicantCount() {
        return applicantCount;
    }

    public int getFirstPreferenceCount() {
        return firstPreferenceCount;
    }

    public int getRemainingCapacity() {
        return remainingCapacity;
    }

    /**
     * Demand reached the threshold at which staff should consider opening the slot.
     */
    public boolean isHighlighted() {
        return highlighted;
    }

    public List<String> getRankedRequestIds() {
        return rankedRequestIds;
    }

    @Override
    public String toString() {
        return String.format("SlotDemand{slot='%s', applicants=%d, first=%d, highlighted=%s}",
                slotId, applicantCount, firstPreferenceCount, highlighted);
    }
}
