package org.readacademy.engine.store;

import org.readacademy.engine.domain.exception.CommitFailedException;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.TimeSlot;

import java.util.List;

/**
 * Durable home of slots, requests and scheduling outcomes.
 * Each commit is atomic: it either fully lands or leaves the store unchanged.
 */
public interface ScheduleStore {

    /**
     * Slot definitions for the current admission cycle. Empty if the store has none.
     */
    List<TimeSlot> loadSlots();

    /**
     * Requests still waiting for their first allocation decision.
     */
    List<ConsultationRequest> loadPendingRequests();

    /**
     * Accept a finalized request from intake. It stays pending until the next allocation pass.
     */
    void submit(ConsultationRequest request);

    /**
     * Persist a batch of outcomes.
     *
     * @throws CommitFailedException if nothing could be persisted
     */
    void commit(ScheduleBatch batch);
}
