package org.readacademy.engine.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.readacademy.engine.domain.exception.EmptyRequestPoolException;
import org.readacademy.engine.domain.model.AllocationResult;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.RequestStatus;
import org.readacademy.engine.domain.model.ScoringWeights;
import org.readacademy.engine.domain.model.TimeSlot;
import org.readacademy.engine.store.InMemoryScheduleStore;
import org.readacademy.engine.store.ScheduleStore;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.readacademy.engine.TestFixtures.request;
import static org.readacademy.engine.TestFixtures.slot;

@ExtendWith(MockitoExtension.class)
class AllocationCycleServiceTest {

    @Mock
    private ScheduleStore store;

    @Mock
    private Allocator allocator;

    @Test
    void allocatesPendingRequestsFromStore() {
        List<ConsultationRequest> pending = List.of(request("R1", "G1", 0, "S1").build());
        AllocationResult result = new AllocationResult(Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList(), false);
        when(store.loadPendingRequests()).thenReturn(pending);
        when(allocator.allocate(pending)).thenReturn(result);

        assertSame(result, new AllocationCycleService(store, allocator).runPendingCycle());
    }

    @Test
    void nothingPendingSkipsAllocation() {
        when(store.loadPendingRequests()).thenReturn(Collections.emptyList());

        assertNull(new AllocationCycleService(store, allocator).runPendingCycle());
        verify(allocator, never()).allocate(anyList());
    }

    @Test
    void alreadyDecidedPoolYieldsNoResult() {
        when(store.loadPendingRequests()).thenReturn(List.of(request("R1", "G1", 0, "S1").build()));
        when(allocator.allocate(anyList())).thenThrow(new EmptyRequestPoolException());

        assertNull(new AllocationCycleService(store, allocator).runPendingCycle());
    }

    @Test
    void submissionFailuresAreIsolated() {
        ConsultationRequest ok = request("OK", "G1", 0, "S1").build();
        ConsultationRequest bad = request("BAD", "G2", 0, "S1").build();
        doAnswer(invocation -> {
            ConsultationRequest submitted = invocation.getArgument(0);
            if ("BAD".equals(submitted.getRequestId())) {
                throw new IllegalStateException("rejected");
            }
            return null;
        }).when(store).submit(any(ConsultationRequest.class));

        List<String> accepted = new AllocationCycleService(store, allocator).submit(Arrays.asList(bad, ok));

        assertEquals(List.of("OK"), accepted);
        verify(store).submit(ok);
    }

    @Test
    void openRequestsMergeAllocatorAndStore() {
        ConsultationRequest waiting = request("W", "G1", 0, "S1").build();
        ConsultationRequest fresh = request("F", "G2", 0, "S1").build();
        when(allocator.openRequests()).thenReturn(List.of(waiting));
        when(store.loadPendingRequests()).thenReturn(Arrays.asList(fresh, waiting));

        List<String> ids = new AllocationCycleService(store, allocator).openRequests().stream()
                .map(ConsultationRequest::getRequestId)
                .collect(Collectors.toList());

        assertEquals(List.of("W", "F"), ids);
    }

    @Test
    void requestNamingUnknownSlotIsDecidedOnceAcrossCycles() {
        List<TimeSlot> slots = List.of(slot("S1", "2025-03-03T14:00", "2025-03-03T14:30", 2));
        InMemoryScheduleStore memoryStore = new InMemoryScheduleStore(slots);
        AllocationCycleService service = new AllocationCycleService(memoryStore, new AllocatorImpl(
                new InMemorySlotCalendar(slots), new PriorityScorerImpl(ScoringWeights.defaults()),
                new GuardianConflictChecker(), memoryStore));
        memoryStore.submit(request("GHOSTLY", "G1", 0, "GHOST").build());

        assertEquals(1, service.runPendingCycle().rejected().size());
        for (int i = 0; i < 4; i++) {
            assertNull(service.runPendingCycle());
        }

        assertEquals(1, memoryStore.history().size());
        assertEquals(RequestStatus.PENDING, memoryStore.statusOf("GHOSTLY"));
        assertEquals("unknown-slot", memoryStore.reasonOf("GHOSTLY"));
    }
}
