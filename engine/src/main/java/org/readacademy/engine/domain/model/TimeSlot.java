package org.readacademy.engine.domain.model;

import java.util.Objects;

/**
 * Immutable definition of a consultation slot.
 * Occupancy is tracked by the owning calendar, never here.
 */
public final class TimeSlot {

    private final String slotId;
    private final TimeWindow window;
    private final int capacity;
    private final boolean blackout;

    private TimeSlot(Builder builder) {
        this.slotId = Objects.requireNonNull(builder.slotId, "slotId must not be null");
        this.window = Objects.requireNonNull(builder.window, "window must not be null");
        if (builder.capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive for slot " + builder.slotId);
        }
        this.capacity = builder.capacity;
        this.blackout = builder.blackout;
    }

    public String getSlotId() {
        return slotId;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isBlackout() {
        return blackout;
    }

    public boolean overlaps(TimeSlot other) {
        return window.overlaps(other.window);
    }

    @Override
    public String toString() {
        return String.format("TimeSlot{id='%s', window=%s, capacity=%d, blackout=%s}",
                slotId, window, capacity, blackout);
    }

    /**
     * Builder for TimeSlot.
     */
    public static final class Builder {
        private String slotId;
        private TimeWindow window;
        private int capacity;
        private boolean blackout;

        public Builder slotId(String slotId) {
            this.slotId = slotId;
            return this;
        }

        public Builder window(TimeWindow window) {
            this.window = window;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder blackout(boolean blackout) {
            this.blackout = blackout;
            return this;
        }

        public TimeSlot build() {
            return new TimeSlot(this);
        }
    }
}
