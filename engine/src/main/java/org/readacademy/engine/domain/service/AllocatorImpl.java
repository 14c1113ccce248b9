package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.exception.CapacityExceededException;
import org.readacademy.engine.domain.exception.CommitFailedException;
import org.readacademy.engine.domain.exception.EmptyRequestPoolException;
import org.readacademy.engine.domain.exception.SchedulingException;
import org.readacademy.engine.domain.exception.UnknownSlotException;
import org.readacademy.engine.domain.model.AllocationDecision;
import org.readacademy.engine.domain.model.AllocationResult;
import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.CancellationResult;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.PriorityScore;
import org.readacademy.engine.domain.model.ReasonCode;
import org.readacademy.engine.domain.model.RequestStatus;
import org.readacademy.engine.domain.model.TimeSlot;
import org.readacademy.engine.domain.model.WaitlistEntry;
import org.readacademy.engine.store.ScheduleBatch;
import org.readacademy.engine.store.ScheduleStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Greedy priority allocator.
 *
 * A pass scores the pool, ranks it, and walks each request's preferences in order,
 * taking the first slot that is open, has capacity and does not overlap the
 * guardian's other bookings. Reservations happen in memory first; the store
 * commit follows, and a failed commit releases everything the pass reserved.
 *
 * Cancellation repairs locally: only the freed slot's waitlist is consulted,
 * in stored order, so no other committed assignment ever moves.
 *
 * All mutating operations run under one lock (single writer per calendar).
 */
public final class AllocatorImpl implements Allocator {

    private static final Logger LOG = Logger.getLogger(AllocatorImpl.class.getName());

    /**
     * Score first; request id settles identical tuples (same attributes and timestamp).
     */
    private static final Comparator<RankedRequest> RANK_ORDER = Comparator
            .comparing(RankedRequest::getScore)
            .thenComparing(r -> r.getRequest().getRequestId());

    private final SlotCalendar calendar;
    private final PriorityScorer scorer;
    private final ConflictChecker conflictChecker;
    private final ScheduleStore store;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Waitlist waitlist = new Waitlist();
    private final Map<String, Assignment> active = new LinkedHashMap<>();
    private final Map<String, ConsultationRequest> known = new LinkedHashMap<>();
    private final Map<String, AllocationDecision> latest = new LinkedHashMap<>();

    public AllocatorImpl(SlotCalendar calendar, PriorityScorer scorer, ConflictChecker conflictChecker,
                         ScheduleStore store) {
        this(calendar, scorer, conflictChecker, store, Clock.systemUTC());
    }

    public AllocatorImpl(SlotCalendar calendar, PriorityScorer scorer, ConflictChecker conflictChecker,
                         ScheduleStore store, Clock clock) {
        this.calendar = Objects.requireNonNull(calendar, "calendar must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.conflictChecker = Objects.requireNonNull(conflictChecker, "conflictChecker must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public AllocationResult allocate(List<ConsultationRequest> requests) {
        lock.lock();
        try {
            List<RankedRequest> ranked = rank(requests);
            LOG.info(() -> "Allocating " + ranked.size() + " pending requests over "
                    + calendar.slots().size() + " slots");

            Instant now = clock.instant();
            Draft draft = new Draft();
            for (RankedRequest candidate : ranked) {
                place(candidate, now, draft);
            }

            commitOrRollback(draft);
            draft.apply();

            AllocationResult result = draft.toResult(false);
            LOG.info(() -> "Allocation pass committed: " + result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CancellationResult cancel(String assignmentId) {
        lock.lock();
        try {
            Assignment current = active.get(assignmentId);
            if (current == null) {
                throw new IllegalArgumentException("No active assignment with id " + assignmentId);
            }
            ConsultationRequest request = known.get(current.getRequestId());
            Instant now = clock.instant();
            Assignment cancelled = current.cancelledAt(now);

            calendar.release(current.getSlotId());
            conflictChecker.forget(current);

            Draft draft = new Draft();
            draft.cancel(request, cancelled);
            promote(current.getSlotId(), now, draft);

            try {
                commitOrRollback(draft);
            } catch (CommitFailedException e) {
                restore(current);
                throw e;
            }
            draft.apply();

            LOG.info(() -> String.format("Cancelled %s; promoted %d from waitlist of %s",
                    assignmentId, draft.assignments.size(), current.getSlotId()));
            return new CancellationResult(cancelled, draft.assignments);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Assignment assignManually(String requestId, String slotId) {
        lock.lock();
        try {
            ConsultationRequest request = known.get(requestId);
            if (request == null) {
                throw new IllegalArgumentException("Unknown request " + requestId);
            }
            if (request.getStatus() != RequestStatus.PENDING && request.getStatus() != RequestStatus.WAITLISTED) {
                throw new IllegalArgumentException(String.format(
                        "Request %s is %s and cannot be assigned", requestId, request.getStatus().code()));
            }
            TimeSlot slot = calendar.slot(slotId);
            if (conflictChecker.conflicts(request.getGuardianId(), slot)) {
                throw new SchedulingException(String.format(
                        "Guardian %s already holds a booking overlapping %s", request.getGuardianId(), slotId));
            }
            calendar.reserve(slotId);

            Assignment assignment = newAssignment(request, slot, ReasonCode.MANUAL_OVERRIDE.getCode(), clock.instant());
            conflictChecker.record(assignment);

            Draft draft = new Draft();
            draft.assign(request, assignment);
            commitOrRollback(draft);
            draft.apply();

            LOG.info(() -> "Manual override: " + requestId + " -> " + slotId);
            return assignment;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AllocationDecision withdraw(String requestId) {
        lock.lock();
        try {
            WaitlistEntry entry = waitlist.get(requestId);
            if (entry == null) {
                throw new IllegalArgumentException("Request " + requestId + " is not wait-listed");
            }
            AllocationDecision decision = new AllocationDecision(requestId, RequestStatus.CANCELLED,
                    entry.getSlotId(), ReasonCode.CANCELLED.getCode(), null);
            commitStatusOnly(new ScheduleBatch.Builder().decision(decision).build());

            waitlist.remove(requestId);
            entry.getRequest().transitionTo(RequestStatus.CANCELLED);
            latest.put(requestId, decision);
            LOG.info(() -> "Withdrew wait-listed request " + requestId);
            return decision;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int closeCycle() {
        lock.lock();
        try {
            List<ConsultationRequest> open = known.values().stream()
                    .filter(r -> r.getStatus() == RequestStatus.WAITLISTED || r.getStatus() == RequestStatus.PENDING)
                    .collect(Collectors.toList());
            if (open.isEmpty()) {
                LOG.info("Cycle closed with nothing left waiting");
                return 0;
            }

            List<AllocationDecision> expiries = new ArrayList<>(open.size());
            for (ConsultationRequest request : open) {
                WaitlistEntry entry = waitlist.get(request.getRequestId());
                String slotId = entry != null ? entry.getSlotId() : null;
                expiries.add(new AllocationDecision(request.getRequestId(), RequestStatus.EXPIRED,
                        slotId, ReasonCode.CYCLE_CLOSED.getCode(), null));
            }
            commitStatusOnly(new ScheduleBatch.Builder().decisions(expiries).build());

            for (ConsultationRequest request : open) {
                request.transitionTo(RequestStatus.EXPIRED);
            }
            for (AllocationDecision expiry : expiries) {
                latest.put(expiry.getRequestId(), expiry);
            }
            waitlist.clear();

            LOG.info(() -> "Cycle closed: " + open.size() + " requests expired");
            return open.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<AllocationDecision> report() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(latest.values()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<WaitlistEntry> waitlist(String slotId) {
        lock.lock();
        try {
            return waitlist.entriesFor(slotId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Assignment> activeAssignments() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(active.values()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ConsultationRequest> openRequests() {
        lock.lock();
        try {
            return known.values().stream()
                    .filter(r -> r.getStatus() == RequestStatus.PENDING || r.getStatus() == RequestStatus.WAITLISTED)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pending requests, de-duplicated by id, scored and sorted into allocation order.
     */
    private List<RankedRequest> rank(List<ConsultationRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new EmptyRequestPoolException();
        }
        Set<String> seen = new HashSet<>();
        List<RankedRequest> ranked = new ArrayList<>(requests.size());
        for (ConsultationRequest request : requests) {
            if (request.getStatus() != RequestStatus.PENDING) {
                LOG.fine(() -> "Skipping " + request.getRequestId() + ", already " + request.getStatus().code());
                continue;
            }
            if (!seen.add(request.getRequestId())) {
                LOG.warning(() -> "Duplicate request id in pool, keeping first: " + request.getRequestId());
                continue;
            }
            if (alreadyDecided(request.getRequestId())) {
                continue;
            }
            ranked.add(new RankedRequest(request, scorer.score(request)));
        }
        if (ranked.isEmpty()) {
            throw new EmptyRequestPoolException();
        }
        ranked.sort(RANK_ORDER);
        return ranked;
    }

    /**
     * The allocator's own ledger wins over the status carried by an incoming copy:
     * a request it has moved past PENDING, or rejected for naming unknown slots,
     * is not placed again.
     */
    private boolean alreadyDecided(String requestId) {
        ConsultationRequest tracked = known.get(requestId);
        if (tracked == null) {
            return false;
        }
        if (tracked.getStatus() != RequestStatus.PENDING) {
            LOG.warning(() -> "Ignoring stale pending copy of " + requestId + ", already "
                    + tracked.getStatus().code());
            return true;
        }
        AllocationDecision last = latest.get(requestId);
        if (last != null && ReasonCode.UNKNOWN_SLOT.getCode().equals(last.getReasonCode())) {
            LOG.fine(() -> "Request " + requestId + " was rejected for unknown slots; left for staff");
            return true;
        }
        return false;
    }

    private void place(RankedRequest candidate, Instant now, Draft draft) {
        ConsultationRequest request = candidate.getRequest();

        if (!request.hasPreferences()) {
            LOG.warning(() -> "Request " + request.getRequestId() + " names no slot; waiting for manual assignment");
            draft.waitlist(new WaitlistEntry(request, null, candidate.getScore(), ReasonCode.NO_PREFERENCES, now));
            return;
        }

        List<String> unknown = request.getDesiredSlotIds().stream()
                .filter(id -> !calendar.contains(id))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            LOG.log(Level.WARNING, "Request {0} references unknown slots {1}; skipped",
                    new Object[]{request.getRequestId(), unknown});
            draft.reject(request, ReasonCode.UNKNOWN_SLOT);
            return;
        }

        boolean anyOpen = false;
        boolean anyFull = false;
        List<String> desired = request.getDesiredSlotIds();
        for (int rank = 0; rank < desired.size(); rank++) {
            String slotId = desired.get(rank);
            if (calendar.isBlackout(slotId)) {
                continue;
            }
            anyOpen = true;
            if (calendar.remainingCapacity(slotId) <= 0) {
                anyFull = true;
                continue;
            }
            TimeSlot slot = calendar.slot(slotId);
            if (conflictChecker.conflicts(request.getGuardianId(), slot)) {
                continue;
            }
            if (!tryReserve(slotId)) {
                anyFull = true;
                continue;
            }
            Assignment assignment = newAssignment(request, slot, ReasonCode.MATCHED_PREFERENCE.render(rank + 1), now);
            // visible to later requests of the same guardian in this pass
            conflictChecker.record(assignment);
            draft.assign(request, assignment);
            return;
        }

        ReasonCode reason;
        if (!anyOpen) {
            reason = ReasonCode.ALL_BLACKOUT;
        } else if (anyFull) {
            reason = ReasonCode.NO_CAPACITY;
        } else {
            reason = ReasonCode.ALL_CONFLICTS;
        }
        draft.waitlist(new WaitlistEntry(request, waitSlotFor(request), candidate.getScore(), reason, now));
    }

    /**
     * Most preferred slot that is not blacked out; the most preferred slot when all are.
     */
    private String waitSlotFor(ConsultationRequest request) {
        for (String slotId : request.getDesiredSlotIds()) {
            if (!calendar.isBlackout(slotId)) {
                return slotId;
            }
        }
        return request.getMostPreferredSlotId();
    }

    private boolean tryReserve(String slotId) {
        try {
            calendar.reserve(slotId);
            return true;
        } catch (CapacityExceededException | UnknownSlotException e) {
            LOG.fine(() -> "Skipping slot " + slotId + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Fill freed capacity from the slot's waitlist in stored order. Entries whose
     * guardian now overlaps the slot are passed over, they can never take it.
     */
    private void promote(String slotId, Instant now, Draft draft) {
        TimeSlot slot = calendar.slot(slotId);
        for (WaitlistEntry entry : waitlist.entriesFor(slotId)) {
            if (calendar.remainingCapacity(slotId) <= 0) {
                return;
            }
            if (!entry.isAutoPromotable()) {
                continue;
            }
            if (conflictChecker.conflicts(entry.getGuardianId(), slot)) {
                LOG.fine(() -> "Not promoting " + entry.getRequestId() + " into " + slotId + ": guardian conflict");
                continue;
            }
            if (!tryReserve(slotId)) {
                return;
            }
            Assignment promoted = newAssignment(entry.getRequest(), slot, ReasonCode.PROMOTED.getCode(), now);
            conflictChecker.record(promoted);
            draft.assign(entry.getRequest(), promoted);
        }
    }

    private void commitOrRollback(Draft draft) {
        ScheduleBatch batch = draft.toBatch();
        try {
            store.commit(batch);
        } catch (CommitFailedException e) {
            draft.rollback();
            LOG.log(Level.SEVERE, "Commit rejected, in-memory reservations rolled back", e);
            throw e.withProvisionalResult(draft.toResult(true));
        } catch (RuntimeException e) {
            draft.rollback();
            LOG.log(Level.SEVERE, "Commit failed, in-memory reservations rolled back", e);
            throw new CommitFailedException("Schedule store commit failed: " + e.getMessage(), e,
                    draft.toResult(true));
        }
    }

    /**
     * Commit a batch that reserved nothing, so there is nothing to roll back.
     */
    private void commitStatusOnly(ScheduleBatch batch) {
        try {
            store.commit(batch);
        } catch (CommitFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CommitFailedException("Schedule store commit failed: " + e.getMessage(), e);
        }
    }

    /**
     * Put a cancelled assignment back after a failed cancellation commit.
     */
    private void restore(Assignment assignment) {
        try {
            calendar.reserve(assignment.getSlotId());
        } catch (CapacityExceededException e) {
            LOG.log(Level.SEVERE, "Could not re-reserve " + assignment.getSlotId()
                    + " while restoring " + assignment.getAssignmentId(), e);
        }
        conflictChecker.record(assignment);
    }

    private Assignment newAssignment(ConsultationRequest request, TimeSlot slot, String reasonCode, Instant now) {
        return new Assignment.Builder()
                .requestId(request.getRequestId())
                .guardianId(request.getGuardianId())
                .slotId(slot.getSlotId())
                .window(slot.getWindow())
                .decidedAt(now)
                .reasonCode(reasonCode)
                .build();
    }

    /**
     * Decisions of one operation, held back until the store accepts them.
     */
    private final class Draft {
        private final List<AllocationDecision> decisions = new ArrayList<>();
        private final List<Assignment> assignments = new ArrayList<>();
        private final List<Assignment> cancellations = new ArrayList<>();
        private final List<WaitlistEntry> waitlisted = new ArrayList<>();
        private final Map<String, ConsultationRequest> requests = new LinkedHashMap<>();

        void assign(ConsultationRequest request, Assignment assignment) {
            requests.put(request.getRequestId(), request);
            assignments.add(assignment);
            decisions.add(AllocationDecision.assigned(assignment));
        }

        void waitlist(WaitlistEntry entry) {
            requests.put(entry.getRequestId(), entry.getRequest());
            waitlisted.add(entry);
            decisions.add(AllocationDecision.waitlisted(entry));
        }

        void reject(ConsultationRequest request, ReasonCode reason) {
            requests.put(request.getRequestId(), request);
            decisions.add(AllocationDecision.rejected(request.getRequestId(), reason));
        }

        void cancel(ConsultationRequest request, Assignment cancelled) {
            requests.put(request.getRequestId(), request);
            cancellations.add(cancelled);
            decisions.add(new AllocationDecision(cancelled.getRequestId(), RequestStatus.CANCELLED,
                    cancelled.getSlotId(), ReasonCode.CANCELLED.getCode(), cancelled.getAssignmentId()));
        }

        ScheduleBatch toBatch() {
            return new ScheduleBatch.Builder()
                    .decisions(decisions)
                    .assignments(assignments)
                    .cancellations(cancellations)
                    .waitlisted(waitlisted)
                    .build();
        }

        AllocationResult toResult(boolean provisional) {
            return new AllocationResult(decisions, assignments, waitlisted, provisional);
        }

        void rollback() {
            for (Assignment assignment : assignments) {
                calendar.release(assignment.getSlotId());
                conflictChecker.forget(assignment);
            }
        }

        void apply() {
            for (Assignment cancelled : cancellations) {
                active.remove(cancelled.getAssignmentId());
                requests.get(cancelled.getRequestId()).transitionTo(RequestStatus.CANCELLED);
            }
            for (Assignment assignment : assignments) {
                waitlist.remove(assignment.getRequestId());
                requests.get(assignment.getRequestId()).transitionTo(RequestStatus.ASSIGNED);
                active.put(assignment.getAssignmentId(), assignment);
            }
            for (WaitlistEntry entry : waitlisted) {
                entry.getRequest().transitionTo(RequestStatus.WAITLISTED);
                waitlist.add(entry);
            }
            known.putAll(requests);
            for (AllocationDecision decision : decisions) {
                latest.put(decision.getRequestId(), decision);
            }
        }
    }

    private static final class RankedRequest {
        private final ConsultationRequest request;
        private final PriorityScore score;

        RankedRequest(ConsultationRequest request, PriorityScore score) {
            this.request = request;
            this.score = score;
        }

        ConsultationRequest getRequest() {
            return request;
        }

        PriorityScore getScore() {
            return score;
        }
    }
}
