package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.exception.CapacityExceededException;
import org.readacademy.engine.domain.exception.CommitFailedException;
import org.readacademy.engine.domain.exception.EmptyRequestPoolException;
import org.readacademy.engine.domain.exception.UnknownSlotException;
import org.readacademy.engine.domain.model.AllocationDecision;
import org.readacademy.engine.domain.model.AllocationResult;
import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.CancellationResult;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.WaitlistEntry;

import java.util.List;

/**
 * Assigns consultation requests to the slots of one calendar.
 */
public interface Allocator {

    /**
     * Run one allocation pass over a request pool.
     * Requests that are no longer pending are ignored.
     *
     * @param requests the pool to allocate
     * @return decisions in ranked order, already committed
     * @throws EmptyRequestPoolException if the pool holds no pending request
     * @throws CommitFailedException if the store rejected the outcome; in-memory state is unchanged
     */
    AllocationResult allocate(List<ConsultationRequest> requests);

    /**
     * Cancel an active assignment and promote from that slot's waitlist, as one unit.
     *
     * @param assignmentId the assignment to revoke
     * @return the cancelled assignment and any promotions
     * @throws IllegalArgumentException if no active assignment has this id
     * @throws CommitFailedException if the store rejected the change; nothing was applied
     */
    CancellationResult cancel(String assignmentId);

    /**
     * Staff override: place a pending or wait-listed request into a specific slot.
     *
     * @throws IllegalArgumentException if the request is unknown or not assignable
     * @throws UnknownSlotException if the slot is not in the calendar
     * @throws CapacityExceededException if the slot is full or blacked out
     * @throws org.readacademy.engine.domain.exception.SchedulingException if the guardian is already
     *         booked in an overlapping slot
     */
    Assignment assignManually(String requestId, String slotId);

    /**
     * Withdraw a wait-listed request.
     *
     * @throws IllegalArgumentException if the request is not on the waitlist
     */
    AllocationDecision withdraw(String requestId);

    /**
     * Close the admission cycle: every request still waiting expires.
     *
     * @return number of requests expired
     */
    int closeCycle();

    /**
     * Latest decision for every request seen, in first-seen order.
     */
    List<AllocationDecision> report();

    /**
     * Ordered snapshot of one slot's waitlist.
     */
    List<WaitlistEntry> waitlist(String slotId);

    List<Assignment> activeAssignments();

    /**
     * Requests this allocator has seen that are still pending or wait-listed.
     */
    List<ConsultationRequest> openRequests();
}
