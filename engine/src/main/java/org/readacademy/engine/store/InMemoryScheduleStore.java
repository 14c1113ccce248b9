package org.readacademy.engine.store;

import org.readacademy.engine.domain.model.AllocationDecision;
import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.RequestStatus;
import org.readacademy.engine.domain.model.TimeSlot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Process-local store used when no REST backend is configured, and in tests.
 */
public final class InMemoryScheduleStore implements ScheduleStore {

    private static final Logger LOG = Logger.getLogger(InMemoryScheduleStore.class.getName());

    /** Committed batches kept for inspection; older ones are dropped first. */
    static final int HISTORY_LIMIT = 200;

    private final List<TimeSlot> slots;
    private final Map<String, ConsultationRequest> requests = new LinkedHashMap<>();
    private final Map<String, RequestStatus> statuses = new LinkedHashMap<>();
    private final Map<String, String> reasons = new LinkedHashMap<>();
    private final Map<String, Assignment> assignments = new LinkedHashMap<>();
    private final Deque<ScheduleBatch> history = new ArrayDeque<>();

    public InMemoryScheduleStore() {
        this(Collections.emptyList());
    }

    public InMemoryScheduleStore(Collection<TimeSlot> slots) {
        this.slots = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(slots, "slots must not be null")));
    }

    @Override
    public synchronized void submit(ConsultationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (statuses.containsKey(request.getRequestId())) {
            LOG.warning(() -> "Ignoring resubmission of " + request.getRequestId());
            return;
        }
        requests.put(request.getRequestId(), request);
        statuses.put(request.getRequestId(), request.getStatus());
    }

    @Override
    public List<TimeSlot> loadSlots() {
        return slots;
    }

    @Override
    public synchronized List<ConsultationRequest> loadPendingRequests() {
        return requests.values().stream()
                .filter(r -> statuses.get(r.getRequestId()) == RequestStatus.PENDING)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void commit(ScheduleBatch batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        for (AllocationDecision decision : batch.getDecisions()) {
            statuses.put(decision.getRequestId(), decision.getStatus());
            reasons.put(decision.getRequestId(), decision.getReasonCode());
        }
        for (Assignment assignment : batch.getAssignments()) {
            assignments.put(assignment.getAssignmentId(), assignment);
        }
        for (Assignment cancelled : batch.getCancellations()) {
            assignments.put(cancelled.getAssignmentId(), cancelled);
        }
        history.addLast(batch);
        if (history.size() > HISTORY_LIMIT) {
            history.removeFirst();
        }
        LOG.fine(() -> "Committed " + batch);
    }

    public synchronized RequestStatus statusOf(String requestId) {
        return statuses.get(requestId);
    }

    public synchronized String reasonOf(String requestId) {
        return reasons.get(requestId);
    }

    public synchronized Assignment assignment(String assignmentId) {
        return assignments.get(assignmentId);
    }

    public synchronized List<Assignment> activeAssignments() {
        return assignments.values().stream()
                .filter(Assignment::isActive)
                .collect(Collectors.toList());
    }

    public synchronized List<ScheduleBatch> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }
}
