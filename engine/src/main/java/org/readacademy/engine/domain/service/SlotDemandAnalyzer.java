package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.PriorityScore;
import org.readacademy.engine.domain.model.RequestStatus;
import org.readacademy.engine.domain.model.SlotDemand;
import org.readacademy.engine.domain.model.TimeSlot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Per-slot demand overview for staff deciding which sessions to open.
 * Only pending and wait-listed requests count as demand.
 */
public final class SlotDemandAnalyzer {

    public static final int DEFAULT_HIGHLIGHT_THRESHOLD = 3;

    private final SlotCalendar calendar;
    private final PriorityScorer scorer;
    private final int highlightThreshold;

    public SlotDemandAnalyzer(SlotCalendar calendar, PriorityScorer scorer, int highlightThreshold) {
        this.calendar = Objects.requireNonNull(calendar, "calendar must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        if (highlightThreshold < 1) {
            throw new IllegalArgumentException("highlightThreshold must be at least 1");
        }
        this.highlightThreshold = highlightThreshold;
    }

    /**
     * One entry per calendar slot, in calendar order.
     */
    public List<SlotDemand> analyze(Collection<ConsultationRequest> requests) {
        List<ConsultationRequest> open = requests.stream()
                .filter(r -> r.getStatus() == RequestStatus.PENDING || r.getStatus() == RequestStatus.WAITLISTED)
                .collect(Collectors.toList());
        Map<String, PriorityScore> scores = open.stream()
                .collect(Collectors.toMap(ConsultationRequest::getRequestId, scorer::score, (a, b) -> a));
        Comparator<ConsultationRequest> byPriority = Comparator
                .comparing((ConsultationRequest r) -> scores.get(r.getRequestId()))
                .thenComparing(ConsultationRequest::getRequestId);

        List<SlotDemand> result = new ArrayList<>();
        for (TimeSlot slot : calendar.slots()) {
            String slotId = slot.getSlotId();
            List<ConsultationRequest> applicants = open.stream()
                    .filter(r -> r.getDesiredSlotIds().contains(slotId))
                    .sorted(byPriority)
                    .collect(Collectors.toList());
            int firstChoice = (int) applicants.stream()
                    .filter(r -> slotId.equals(r.getMostPreferredSlotId()))
                    .count();
            result.add(new SlotDemand(
                    slotId,
                    slot.getWindow(),
                    applicants.size(),
                    firstChoice,
                    calendar.remainingCapacity(slotId),
                    applicants.size() >= highlightThreshold,
                    applicants.stream().map(ConsultationRequest::getRequestId).collect(Collectors.toList())));
        }
        return result;
    }

    public int getHighlightThreshold() {
        return highlightThreshold;
    }
}
