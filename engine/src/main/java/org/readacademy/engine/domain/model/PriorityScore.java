package org.readacademy.engine.domain.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Ranking tuple for a consultation request, compared field by field:
 * <ol>
 *   <li>sibling bonus (higher first)</li>
 *   <li>application completeness bonus (higher first)</li>
 *   <li>distance rank (higher first)</li>
 *   <li>grade urgency (higher first)</li>
 *   <li>submission time (earlier first)</li>
 * </ol>
 * Natural order puts the better-ranked score first, so an ascending sort yields
 * allocation order. Always re-derived from the request, never stored.
 */
public final class PriorityScore implements Comparable<PriorityScore> {

    private static final Comparator<PriorityScore> RANKING = Comparator
            .comparingLong(PriorityScore::getSiblingBonus).reversed()
            .thenComparing(Comparator.comparingLong(PriorityScore::getCompletenessBonus).reversed())
            .thenComparing(Comparator.comparingLong(PriorityScore::getDistanceRank).reversed())
            .thenComparing(Comparator.comparingLong(PriorityScore::getGradeUrgency).reversed())
            .thenComparing(PriorityScore::getSubmittedAt);

    private final long siblingBonus;
    private final long completenessBonus;
    private final long distanceRank;
    private final long gradeUrgency;
    private final Instant submittedAt;

    public PriorityScore(long siblingBonus, long completenessBonus, long distanceRank,
                         long gradeUrgency, Instant submittedAt) {
        this.siblingBonus = siblingBonus;
        this.completenessBonus = completenessBonus;
        this.distanceRank = distanceRank;
        this.gradeUrgency = gradeUrgency;
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt must not be null");
    }

    public long getSiblingBonus() {
        return siblingBonus;
    }

    public long getCompletenessBonus() {
        return completenessBonus;
    }

    public long getDistanceRank() {
        return distanceRank;
    }

    public long getGradeUrgency() {
        return gradeUrgency;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    /**
     * Sum of the weighted attribute components, for display only.
     * Ordering always uses the full tuple.
     */
    public long weightedTotal() {
        return siblingBonus + completenessBonus + distanceRank + gradeUrgency;
    }

    /**
     * Whether this score ranks strictly ahead of {@code other}.
     */
    public boolean ranksAhead(PriorityScore other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(PriorityScore other) {
        return RANKING.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriorityScore)) {
            return false;
        }
        PriorityScore that = (PriorityScore) o;
        return siblingBonus == that.siblingBonus
                && completenessBonus == that.completenessBonus
                && distanceRank == that.distanceRank
                && gradeUrgency == that.gradeUrgency
                && submittedAt.equals(that.submittedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(siblingBonus, completenessBonus, distanceRank, gradeUrgency, submittedAt);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d, %d, %d, %s)",
                siblingBonus, completenessBonus, distanceRank, gradeUrgency, submittedAt);
    }
}
