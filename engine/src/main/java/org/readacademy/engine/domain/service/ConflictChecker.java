package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.TimeSlot;

import java.util.Collection;

/**
 * Guards the hard rule that a guardian is never booked into two overlapping slots.
 * Overlap is never traded away for priority.
 */
public interface ConflictChecker {

    /**
     * Whether {@code candidateSlot} overlaps any active assignment of {@code guardianId}
     * among {@code existingAssignments}.
     */
    boolean conflicts(String guardianId, TimeSlot candidateSlot, Collection<Assignment> existingAssignments);

    /**
     * Same check against the assignments recorded in this checker.
     */
    boolean conflicts(String guardianId, TimeSlot candidateSlot);

    /**
     * Track an assignment's window for its guardian.
     */
    void record(Assignment assignment);

    /**
     * Stop tracking an assignment (cancelled or rolled back).
     */
    void forget(Assignment assignment);

    /**
     * Active assignments recorded for a guardian.
     */
    Collection<Assignment> assignmentsOf(String guardianId);
}
