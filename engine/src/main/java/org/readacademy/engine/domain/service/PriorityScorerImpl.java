package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.PriorityScore;
import org.readacademy.engine.domain.model.ScoringWeights;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Weighted tuple scoring.
 *
 * Components (each compared on its own, higher = better):
 *   sibling     = sibling_bonus      if a sibling is already enrolled
 *   complete    = completeness_bonus if the application form is complete
 *   distance    = distance_weight * (MAX_DISTANCE_TIER - tier)
 *   urgency     = urgency_weight  * (MAX_GRADE + 1 - grade)
 * followed by the submission timestamp (earlier = better).
 *
 * Payment state (paid first, by payment date) and existing-student status are
 * not ranking inputs. The academy's older sheet-based schedule ordered on them;
 * here the tuple above is the whole ranking, and staff settle such cases with a
 * manual assignment.
 */
public final class PriorityScorerImpl implements PriorityScorer {

    private static final Logger LOG = Logger.getLogger(PriorityScorerImpl.class.getName());

    private final ScoringWeights weights;

    public PriorityScorerImpl(ScoringWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    @Override
    public PriorityScore score(ConsultationRequest request) {
        PriorityScore score = new PriorityScore(
                siblingComponent(request),
                completenessComponent(request),
                distanceComponent(request),
                urgencyComponent(request),
                request.getSubmittedAt());

        LOG.finer(() -> String.format("Scored %s: %s", request.getRequestId(), score));
        return score;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    private long siblingComponent(ConsultationRequest request) {
        return request.isSiblingEnrolled() ? weights.getSiblingBonus() : 0L;
    }

    private long completenessComponent(ConsultationRequest request) {
        return request.isApplicationComplete() ? weights.getCompletenessBonus() : 0L;
    }

    /**
     * Nearer families rank higher; tier 0 is the closest band.
     */
    private long distanceComponent(ConsultationRequest request) {
        int rank = ConsultationRequest.MAX_DISTANCE_TIER - request.getDistanceTier();
        return (long) weights.getDistanceWeight() * rank;
    }

    /**
     * Urgency falls as grade rises: first graders get the largest component.
     */
    private long urgencyComponent(ConsultationRequest request) {
        int urgency = ConsultationRequest.MAX_GRADE + 1 - request.getGradeLevel();
        return (long) weights.getUrgencyWeight() * urgency;
    }
}
