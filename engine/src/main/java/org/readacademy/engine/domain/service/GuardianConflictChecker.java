package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.TimeSlot;
import org.readacademy.engine.domain.model.TimeWindow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Per-guardian index of booked windows with a linear overlap scan.
 * Guardians rarely hold more than a handful of bookings.
 */
public final class GuardianConflictChecker implements ConflictChecker {

    private static final Logger LOG = Logger.getLogger(GuardianConflictChecker.class.getName());

    private final Map<String, List<Assignment>> byGuardian = new ConcurrentHashMap<>();

    @Override
    public boolean conflicts(String guardianId, TimeSlot candidateSlot, Collection<Assignment> existingAssignments) {
        Objects.requireNonNull(guardianId, "guardianId must not be null");
        Objects.requireNonNull(candidateSlot, "candidateSlot must not be null");
        if (existingAssignments == null || existingAssignments.isEmpty()) {
            return false;
        }
        TimeWindow candidate = candidateSlot.getWindow();
        for (Assignment existing : existingAssignments) {
            if (!existing.isActive() || !guardianId.equals(existing.getGuardianId())) {
                continue;
            }
            if (existing.getWindow().overlaps(candidate)) {
                LOG.fine(() -> String.format("Guardian %s: %s overlaps %s held by %s",
                        guardianId, candidateSlot.getSlotId(), existing.getSlotId(), existing.getRequestId()));
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean conflicts(String guardianId, TimeSlot candidateSlot) {
        return conflicts(guardianId, candidateSlot, assignmentsOf(guardianId));
    }

    @Override
    public void record(Assignment assignment) {
        Objects.requireNonNull(assignment, "assignment must not be null");
        byGuardian.computeIfAbsent(assignment.getGuardianId(), k -> new CopyOnWriteArrayList<>())
                .add(assignment);
    }

    @Override
    public void forget(Assignment assignment) {
        Objects.requireNonNull(assignment, "assignment must not be null");
        byGuardian.computeIfPresent(assignment.getGuardianId(), (guardian, list) -> {
            list.removeIf(a -> a.getAssignmentId().equals(assignment.getAssignmentId()));
            return list.isEmpty() ? null : list;
        });
    }

    @Override
    public Collection<Assignment> assignmentsOf(String guardianId) {
        List<Assignment> list = byGuardian.get(guardianId);
        if (list == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
