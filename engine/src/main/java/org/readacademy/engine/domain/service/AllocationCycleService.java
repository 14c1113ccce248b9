package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.exception.CommitFailedException;
import org.readacademy.engine.domain.exception.EmptyRequestPoolException;
import org.readacademy.engine.domain.model.AllocationResult;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.store.ScheduleStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pulls pending requests from the store and runs them through the allocator.
 * Used by the periodic scheduler and the callback server.
 */
public final class AllocationCycleService {

    private static final Logger LOG = Logger.getLogger(AllocationCycleService.class.getName());

    private final ScheduleStore store;
    private final Allocator allocator;

    public AllocationCycleService(ScheduleStore store, Allocator allocator) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
    }

    /**
     * Hand finalized requests to the store. Failures are isolated per request.
     *
     * @return ids of the requests the store accepted
     */
    public List<String> submit(List<ConsultationRequest> requests) {
        List<String> accepted = new ArrayList<>();
        for (ConsultationRequest request : requests) {
            try {
                store.submit(request);
                accepted.add(request.getRequestId());
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Submission of " + request.getRequestId() + " failed", e);
            }
        }
        LOG.info(() -> "Accepted " + accepted.size() + " of " + requests.size() + " submitted requests");
        return accepted;
    }

    /**
     * Allocate whatever is pending right now.
     *
     * @return the committed result, or null when nothing was pending
     * @throws CommitFailedException if the store rejected the pass
     */
    public AllocationResult runPendingCycle() {
        List<ConsultationRequest> pending = store.loadPendingRequests();
        if (pending == null || pending.isEmpty()) {
            LOG.fine("No pending consultation requests");
            return null;
        }
        try {
            return allocator.allocate(pending);
        } catch (EmptyRequestPoolException e) {
            LOG.log(Level.FINE, "Pending requests were already decided", e);
            return null;
        }
    }

    /**
     * Open demand: requests pending in the store plus those the allocator holds on its waitlist.
     */
    public List<ConsultationRequest> openRequests() {
        Map<String, ConsultationRequest> byId = new LinkedHashMap<>();
        for (ConsultationRequest request : allocator.openRequests()) {
            byId.put(request.getRequestId(), request);
        }
        List<ConsultationRequest> pending = store.loadPendingRequests();
        if (pending != null) {
            for (ConsultationRequest request : pending) {
                byId.putIfAbsent(request.getRequestId(), request);
            }
        }
        return new ArrayList<>(byId.values());
    }

    public Allocator getAllocator() {
        return allocator;
    }
}
