package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.PriorityScore;

/**
 * Computes the ranking tuple for consultation requests.
 */
public interface PriorityScorer {

    /**
     * Score a request. Pure: same attributes and submission time always give an equal score.
     * Requests reaching this method are already validated.
     *
     * @param request the request to score
     * @return the ranking tuple
     */
    PriorityScore score(ConsultationRequest request);
}
