package org.readacademy.engine.domain.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open appointment window {@code [start, end)}.
 */
public final class TimeWindow {

    private final LocalDateTime start;
    private final LocalDateTime end;

    public TimeWindow(LocalDateTime start, LocalDateTime end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("start must be before end: " + start + " / " + end);
        }
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public long lengthMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    /**
     * Two windows overlap when each starts before the other ends.
     * Back-to-back windows (one ends exactly when the other starts) do not overlap.
     */
    public boolean overlaps(TimeWindow other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeWindow)) {
            return false;
        }
        TimeWindow that = (TimeWindow) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
