package org.readacademy.engine.config;

import org.readacademy.engine.domain.model.ScoringWeights;
import org.readacademy.engine.domain.model.TimeSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cycle-start configuration: slot definitions, scoring weights and the demand threshold.
 */
public final class CalendarConfig {

    private final List<TimeSlot> slots;
    private final ScoringWeights weights;
    private final int demandHighlightThreshold;

    public CalendarConfig(List<TimeSlot> slots, ScoringWeights weights, int demandHighlightThreshold) {
        this.slots = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(slots, "slots must not be null")));
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        if (demandHighlightThreshold < 1) {
            throw new IllegalArgumentException("demand_highlight_threshold must be at least 1");
        }
        this.demandHighlightThreshold = demandHighlightThreshold;
    }

    public List<TimeSlot> getSlots() {
        return slots;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public int getDemandHighlightThreshold() {
        return demandHighlightThreshold;
    }

    @Override
    public String toString() {
        return "CalendarConfig{slots=" + slots.size() + ", weights=" + weights
                + ", demandHighlightThreshold=" + demandHighlightThreshold + '}';
    }
}
