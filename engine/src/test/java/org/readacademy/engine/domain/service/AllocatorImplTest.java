package org.readacademy.engine.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.readacademy.engine.domain.exception.CapacityExceededException;
import org.readacademy.engine.domain.exception.CommitFailedException;
import org.readacademy.engine.domain.exception.EmptyRequestPoolException;
import org.readacademy.engine.domain.exception.SchedulingException;
import org.readacademy.engine.domain.model.AllocationDecision;
import org.readacademy.engine.domain.model.AllocationResult;
import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.CancellationResult;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.RequestStatus;
import org.readacademy.engine.domain.model.ScoringWeights;
import org.readacademy.engine.domain.model.TimeSlot;
import org.readacademy.engine.domain.model.WaitlistEntry;
import org.readacademy.engine.store.InMemoryScheduleStore;
import org.readacademy.engine.store.ScheduleBatch;
import org.readacademy.engine.store.ScheduleStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.readacademy.engine.TestFixtures.blackout;
import static org.readacademy.engine.TestFixtures.request;
import static org.readacademy.engine.TestFixtures.slot;

class AllocatorImplTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-02-10T00:00:00Z"), ZoneOffset.UTC);

    private static final TimeSlot S1 = slot("S1", "2025-03-03T14:00", "2025-03-03T14:30", 2);
    private static final TimeSlot S2 = slot("S2", "2025-03-03T10:00", "2025-03-03T10:30", 3);
    private static final TimeSlot S3 = slot("S3", "2025-03-03T10:15", "2025-03-03T10:45", 3);
    private static final TimeSlot HOLIDAY = blackout("HOLIDAY", "2025-03-01T10:00", "2025-03-01T10:30");

    private InMemorySlotCalendar calendar;
    private GuardianConflictChecker checker;
    private InMemoryScheduleStore store;
    private AllocatorImpl allocator;

    @BeforeEach
    void setUp() {
        List<TimeSlot> slots = Arrays.asList(S1, S2, S3, HOLIDAY);
        calendar = new InMemorySlotCalendar(slots);
        checker = new GuardianConflictChecker();
        store = new InMemoryScheduleStore(slots);
        allocator = newAllocator(calendar, checker, store);
    }

    private static AllocatorImpl newAllocator(SlotCalendar calendar, ConflictChecker checker, ScheduleStore store) {
        return new AllocatorImpl(calendar, new PriorityScorerImpl(ScoringWeights.defaults()), checker, store, CLOCK);
    }

    /**
     * A has a sibling enrolled, B a complete form, C neither; all want S1 (capacity 2).
     */
    private static List<ConsultationRequest> capacityScenario() {
        return new ArrayList<>(Arrays.asList(
                request("C", "GC", 0, "S1").applicationComplete(false).build(),
                request("B", "GB", 5, "S1").build(),
                request("A", "GA", 10, "S1").siblingEnrolled(true).applicationComplete(false).build()));
    }

    @Nested
    class Allocation {

        @Test
        void highestPriorityRequestsFillCapacityAndRestWait() {
            AllocationResult result = allocator.allocate(capacityScenario());

            assertEquals(RequestStatus.ASSIGNED, result.decisionFor("A").getStatus());
            assertEquals(RequestStatus.ASSIGNED, result.decisionFor("B").getStatus());
            assertEquals("matched-preference-1", result.decisionFor("A").getReasonCode());

            AllocationDecision c = result.decisionFor("C");
            assertEquals(RequestStatus.WAITLISTED, c.getStatus());
            assertEquals("S1", c.getSlotId());
            assertEquals("no-capacity", c.getReasonCode());

            assertEquals(2, calendar.occupancy("S1"));
            assertEquals(List.of("C"), ids(allocator.waitlist("S1")));
            assertFalse(result.isProvisional());
        }

        @Test
        void decisionsFollowRankedOrder() {
            AllocationResult result = allocator.allocate(capacityScenario());

            List<String> order = result.getDecisions().stream()
                    .map(AllocationDecision::getRequestId)
                    .collect(Collectors.toList());
            assertEquals(List.of("A", "B", "C"), order);
        }

        @Test
        void fullFirstChoiceFallsThroughToSecond() {
            List<ConsultationRequest> pool = capacityScenario();
            pool.add(request("D", "GD", 20, "S1", "S2").applicationComplete(false).build());

            AllocationResult result = allocator.allocate(pool);

            AllocationDecision d = result.decisionFor("D");
            assertEquals(RequestStatus.ASSIGNED, d.getStatus());
            assertEquals("S2", d.getSlotId());
            assertEquals("matched-preference-2", d.getReasonCode());
        }

        @Test
        void decisionsAreCommittedToStore() {
            allocator.allocate(capacityScenario());

            assertEquals(RequestStatus.ASSIGNED, store.statusOf("A"));
            assertEquals(RequestStatus.WAITLISTED, store.statusOf("C"));
            assertEquals(2, store.activeAssignments().size());
            assertEquals(1, store.history().size());
        }

        @Test
        void guardianCannotHoldOverlappingSlots() {
            List<ConsultationRequest> pool = Arrays.asList(
                    request("R1", "G", 0, "S2").build(),
                    request("R2", "G", 5, "S3").build());

            AllocationResult result = allocator.allocate(pool);

            assertEquals("S2", result.decisionFor("R1").getSlotId());
            AllocationDecision r2 = result.decisionFor("R2");
            assertEquals(RequestStatus.WAITLISTED, r2.getStatus());
            assertEquals("all-conflicts", r2.getReasonCode());
            assertEquals("S3", r2.getSlotId());
            assertEquals(0, calendar.occupancy("S3"));
        }

        @Test
        void differentGuardiansMayShareOverlappingSlots() {
            AllocationResult result = allocator.allocate(Arrays.asList(
                    request("R1", "G1", 0, "S2").build(),
                    request("R2", "G2", 5, "S3").build()));

            assertTrue(result.decisionFor("R1").isAssigned());
            assertTrue(result.decisionFor("R2").isAssigned());
        }

        @Test
        void sameInputGivesSameDecisionsRegardlessOfOrder() {
            List<ConsultationRequest> first = mixedPool();
            List<ConsultationRequest> second = mixedPool();
            Collections.shuffle(second, new Random(42));

            List<TimeSlot> slots = Arrays.asList(S1, S2, S3, HOLIDAY);
            AllocatorImpl a = newAllocator(new InMemorySlotCalendar(slots), new GuardianConflictChecker(),
                    new InMemoryScheduleStore(slots));
            AllocatorImpl b = newAllocator(new InMemorySlotCalendar(slots), new GuardianConflictChecker(),
                    new InMemoryScheduleStore(slots));

            assertEquals(a.allocate(first).getDecisions(), b.allocate(second).getDecisions());
        }

        @Test
        void identicalScoresAreOrderedByRequestId() {
            TimeSlot single = slot("ONE", "2025-03-04T10:00", "2025-03-04T10:30", 1);
            AllocatorImpl one = newAllocator(new InMemorySlotCalendar(List.of(single)),
                    new GuardianConflictChecker(), new InMemoryScheduleStore());

            AllocationResult result = one.allocate(Arrays.asList(
                    request("R2", "G2", 0, "ONE").build(),
                    request("R1", "G1", 0, "ONE").build()));

            assertTrue(result.decisionFor("R1").isAssigned());
            assertEquals(RequestStatus.WAITLISTED, result.decisionFor("R2").getStatus());
        }

        @Test
        void occupancyNeverExceedsCapacity() {
            List<ConsultationRequest> pool = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                pool.add(request("R" + i, "G" + i, i, "S1", "S2").build());
            }

            allocator.allocate(pool);

            assertEquals(S1.getCapacity(), calendar.occupancy("S1"));
            assertEquals(S2.getCapacity(), calendar.occupancy("S2"));
            assertEquals(15, allocator.waitlist("S1").size());
        }

        @Test
        void laterPassDoesNotMoveEarlierAssignments() {
            allocator.allocate(capacityScenario());
            List<Assignment> before = allocator.activeAssignments();

            allocator.allocate(List.of(request("E", "GE", 30, "S1").siblingEnrolled(true).build()));

            assertTrue(allocator.activeAssignments().containsAll(before));
            assertEquals(List.of("E", "C"), ids(allocator.waitlist("S1")));
        }

        @Test
        void emptyPoolAbortsCycle() {
            assertThrows(EmptyRequestPoolException.class, () -> allocator.allocate(Collections.emptyList()));
        }

        @Test
        void poolWithoutPendingRequestsAbortsCycle() {
            ConsultationRequest done = request("R1", "G1", 0, "S1").status(RequestStatus.ASSIGNED).build();

            assertThrows(EmptyRequestPoolException.class, () -> allocator.allocate(List.of(done)));
        }

        @Test
        void duplicateRequestIdIsAllocatedOnce() {
            ConsultationRequest r = request("R1", "G1", 0, "S1").build();

            AllocationResult result = allocator.allocate(Arrays.asList(r, r));

            assertEquals(1, result.getDecisions().size());
            assertEquals(1, calendar.occupancy("S1"));
        }

        @Test
        void requestNamingUnknownSlotIsRejectedAlone() {
            AllocationResult result = allocator.allocate(Arrays.asList(
                    request("GHOSTLY", "G1", 0, "S1", "GHOST").build(),
                    request("OK", "G2", 5, "S1").build()));

            AllocationDecision ghost = result.decisionFor("GHOSTLY");
            assertEquals(RequestStatus.PENDING, ghost.getStatus());
            assertEquals("unknown-slot", ghost.getReasonCode());
            assertEquals(1, result.rejected().size());
            assertTrue(result.decisionFor("OK").isAssigned());
            assertEquals(1, calendar.occupancy("S1"));
        }

        @Test
        void freshPendingCopyOfAssignedRequestIsNotPlacedAgain() {
            allocator.allocate(List.of(request("A", "GA", 0, "S1").build()));

            ConsultationRequest staleCopy = request("A", "GA", 0, "S2").build();
            assertThrows(EmptyRequestPoolException.class, () -> allocator.allocate(List.of(staleCopy)));

            List<String> slotsOfA = allocator.activeAssignments().stream()
                    .filter(a -> a.getRequestId().equals("A"))
                    .map(Assignment::getSlotId)
                    .collect(Collectors.toList());
            assertEquals(List.of("S1"), slotsOfA);
            assertEquals(1, calendar.occupancy("S1"));
            assertEquals(0, calendar.occupancy("S2"));
        }

        @Test
        void stalePendingCopyIsSkippedWhileNewRequestsAreStillPlaced() {
            allocator.allocate(capacityScenario());

            AllocationResult result = allocator.allocate(Arrays.asList(
                    request("C", "GC", 20, "S2").build(),
                    request("N", "GN", 40, "S2").build()));

            assertEquals(1, result.getDecisions().size());
            assertTrue(result.decisionFor("N").isAssigned());
            assertEquals(List.of("C"), ids(allocator.waitlist("S1")));
        }

        @Test
        void unknownSlotRejectionIsNotRepeatedOnLaterPasses() {
            allocator.allocate(List.of(request("GHOSTLY", "G1", 0, "GHOST").build()));

            assertThrows(EmptyRequestPoolException.class,
                    () -> allocator.allocate(List.of(request("GHOSTLY", "G1", 0, "GHOST").build())));
            assertEquals(1, store.history().size());
            assertEquals(RequestStatus.PENDING, allocator.report().get(0).getStatus());
        }

        @Test
        void allBlackoutPreferencesWaitWithoutAutoPromotion() {
            AllocationResult result = allocator.allocate(List.of(request("R1", "G1", 0, "HOLIDAY").build()));

            AllocationDecision d = result.decisionFor("R1");
            assertEquals(RequestStatus.WAITLISTED, d.getStatus());
            assertEquals("all-blackout", d.getReasonCode());
            assertEquals("HOLIDAY", d.getSlotId());
            assertFalse(allocator.waitlist("HOLIDAY").get(0).isAutoPromotable());
        }

        @Test
        void requestWithoutPreferencesWaitsWithoutSlot() {
            AllocationResult result = allocator.allocate(List.of(request("R1", "G1", 0).build()));

            AllocationDecision d = result.decisionFor("R1");
            assertEquals(RequestStatus.WAITLISTED, d.getStatus());
            assertNull(d.getSlotId());
            assertEquals("no-preferences", d.getReasonCode());
        }
    }

    @Nested
    class Cancellation {

        @Test
        void cancellingPromotesHeadOfSlotWaitlist() {
            List<ConsultationRequest> pool = capacityScenario();
            pool.add(request("D", "GD", 30, "S1").applicationComplete(false).build());
            allocator.allocate(pool);
            assertEquals(List.of("C", "D"), ids(allocator.waitlist("S1")));

            CancellationResult result = allocator.cancel(Assignment.idFor("A", "S1"));

            assertEquals(1, result.getPromoted().size());
            Assignment promoted = result.getPromoted().get(0);
            assertEquals("C", promoted.getRequestId());
            assertEquals("promoted-from-waitlist", promoted.getReasonCode());
            assertEquals(2, calendar.occupancy("S1"));
            assertEquals(List.of("D"), ids(allocator.waitlist("S1")));
            assertEquals(RequestStatus.CANCELLED, store.statusOf("A"));
            assertEquals(RequestStatus.ASSIGNED, store.statusOf("C"));
        }

        @Test
        void cancellingWithEmptyWaitlistFreesCapacity() {
            allocator.allocate(List.of(request("R1", "G1", 0, "S2").build()));

            CancellationResult result = allocator.cancel(Assignment.idFor("R1", "S2"));

            assertFalse(result.hasPromotion());
            assertEquals(0, calendar.occupancy("S2"));
            assertFalse(result.getCancelled().isActive());
            assertTrue(allocator.activeAssignments().isEmpty());
            assertFalse(store.assignment(Assignment.idFor("R1", "S2")).isActive());
        }

        @Test
        void cancellationReleasesGuardianWindow() {
            allocator.allocate(Arrays.asList(
                    request("R1", "G", 0, "S2").build(),
                    request("R2", "G", 5, "S3").build()));

            allocator.cancel(Assignment.idFor("R1", "S2"));

            assertFalse(checker.conflicts("G", S3));
            Assignment moved = allocator.assignManually("R2", "S3");
            assertEquals("S3", moved.getSlotId());
        }

        @Test
        void promotionSkipsGuardianWithOverlappingBooking() {
            TimeSlot early = slot("EARLY", "2025-03-05T10:00", "2025-03-05T10:30", 1);
            TimeSlot overlap = slot("OVERLAP", "2025-03-05T10:15", "2025-03-05T10:45", 1);
            List<TimeSlot> slots = Arrays.asList(early, overlap);
            InMemorySlotCalendar cal = new InMemorySlotCalendar(slots);
            AllocatorImpl local = newAllocator(cal, new GuardianConflictChecker(), new InMemoryScheduleStore(slots));

            local.allocate(Arrays.asList(
                    request("A", "GA", 0, "EARLY").siblingEnrolled(true).build(),
                    request("X2", "GX", 0, "OVERLAP").distanceTier(0).build(),
                    request("X1", "GX", 1, "EARLY").distanceTier(0).build(),
                    request("Y", "GY", 2, "EARLY").build()));
            assertEquals(List.of("X1", "Y"), ids(local.waitlist("EARLY")));

            CancellationResult result = local.cancel(Assignment.idFor("A", "EARLY"));

            assertEquals("Y", result.getPromoted().get(0).getRequestId());
            assertEquals(List.of("X1"), ids(local.waitlist("EARLY")));
        }

        @Test
        void unknownAssignmentIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> allocator.cancel("asg-none"));
        }

        @Test
        void failedCommitRestoresPreCancellationState() {
            ScheduleStore flaky = mock(ScheduleStore.class);
            doNothing().doThrow(new IllegalStateException("store down")).when(flaky).commit(any(ScheduleBatch.class));
            AllocatorImpl local = newAllocator(calendar, checker, flaky);
            local.allocate(capacityScenario());

            assertThrows(CommitFailedException.class, () -> local.cancel(Assignment.idFor("A", "S1")));

            assertEquals(2, calendar.occupancy("S1"));
            assertEquals(2, local.activeAssignments().size());
            assertEquals(List.of("C"), ids(local.waitlist("S1")));
            assertTrue(checker.conflicts("GA", S1));
            assertFalse(checker.conflicts("GC", S1));
        }
    }

    @Nested
    class CommitFailure {

        @Test
        void failedCommitRollsBackReservationsAndReportsProvisionalDecisions() {
            ScheduleStore broken = mock(ScheduleStore.class);
            doThrow(new IllegalStateException("store down")).when(broken).commit(any(ScheduleBatch.class));
            AllocatorImpl local = newAllocator(calendar, checker, broken);
            List<ConsultationRequest> pool = capacityScenario();

            CommitFailedException e = assertThrows(CommitFailedException.class, () -> local.allocate(pool));

            AllocationResult provisional = e.getProvisionalResult();
            assertNotNull(provisional);
            assertTrue(provisional.isProvisional());
            assertEquals(3, provisional.getDecisions().size());
            assertEquals(0, calendar.occupancy("S1"));
            assertFalse(checker.conflicts("GA", S1));
            assertTrue(local.activeAssignments().isEmpty());
            assertTrue(local.waitlist("S1").isEmpty());
            for (ConsultationRequest r : pool) {
                assertEquals(RequestStatus.PENDING, r.getStatus());
            }
        }

        @Test
        void poolCanBeRetriedAfterFailedCommit() {
            ScheduleStore flaky = mock(ScheduleStore.class);
            doThrow(new IllegalStateException("store down")).doNothing().when(flaky).commit(any(ScheduleBatch.class));
            AllocatorImpl local = newAllocator(calendar, checker, flaky);
            List<ConsultationRequest> pool = capacityScenario();

            assertThrows(CommitFailedException.class, () -> local.allocate(pool));
            AllocationResult retried = local.allocate(pool);

            assertTrue(retried.decisionFor("A").isAssigned());
            assertEquals(2, calendar.occupancy("S1"));
        }
    }

    @Nested
    class StaffOperations {

        @Test
        void manualOverridePlacesSlotlessRequest() {
            allocator.allocate(List.of(request("R1", "G1", 0).build()));

            Assignment assignment = allocator.assignManually("R1", "S2");

            assertEquals("manual-override", assignment.getReasonCode());
            assertEquals(1, calendar.occupancy("S2"));
            assertEquals(RequestStatus.ASSIGNED, store.statusOf("R1"));
            assertTrue(allocator.waitlist("S2").isEmpty());
        }

        @Test
        void manualOverrideHonoursCapacity() {
            allocator.allocate(capacityScenario());

            assertThrows(CapacityExceededException.class, () -> allocator.assignManually("C", "S1"));
        }

        @Test
        void manualOverrideHonoursBlackout() {
            allocator.allocate(List.of(request("R1", "G1", 0, "HOLIDAY").build()));

            assertThrows(CapacityExceededException.class, () -> allocator.assignManually("R1", "HOLIDAY"));
        }

        @Test
        void manualOverrideHonoursGuardianConflicts() {
            allocator.allocate(Arrays.asList(
                    request("R1", "G", 0, "S2").build(),
                    request("R2", "G", 5, "S3").build()));

            assertThrows(SchedulingException.class, () -> allocator.assignManually("R2", "S3"));
            assertEquals(0, calendar.occupancy("S3"));
        }

        @Test
        void manualOverrideRejectsAssignedRequest() {
            allocator.allocate(capacityScenario());

            assertThrows(IllegalArgumentException.class, () -> allocator.assignManually("A", "S2"));
        }

        @Test
        void withdrawCancelsWaitlistedRequest() {
            allocator.allocate(capacityScenario());

            AllocationDecision decision = allocator.withdraw("C");

            assertEquals(RequestStatus.CANCELLED, decision.getStatus());
            assertTrue(allocator.waitlist("S1").isEmpty());
            assertEquals(RequestStatus.CANCELLED, store.statusOf("C"));
            assertThrows(IllegalArgumentException.class, () -> allocator.withdraw("A"));
        }

        @Test
        void closingCycleExpiresEveryoneStillWaiting() {
            allocator.allocate(capacityScenario());
            allocator.allocate(List.of(request("N", "GN", 50).build()));

            int expired = allocator.closeCycle();

            assertEquals(2, expired);
            assertEquals(RequestStatus.EXPIRED, store.statusOf("C"));
            assertEquals("cycle-closed", store.reasonOf("N"));
            assertEquals(RequestStatus.ASSIGNED, store.statusOf("A"));
            assertTrue(allocator.waitlist("S1").isEmpty());
            assertTrue(allocator.openRequests().isEmpty());
            assertEquals(0, allocator.closeCycle());
        }

        @Test
        void reportHoldsLatestDecisionPerRequest() {
            allocator.allocate(capacityScenario());
            allocator.cancel(Assignment.idFor("A", "S1"));

            List<AllocationDecision> report = allocator.report();

            assertEquals(3, report.size());
            AllocationDecision a = report.stream().filter(d -> d.getRequestId().equals("A")).findFirst().get();
            AllocationDecision c = report.stream().filter(d -> d.getRequestId().equals("C")).findFirst().get();
            assertEquals(RequestStatus.CANCELLED, a.getStatus());
            assertEquals("promoted-from-waitlist", c.getReasonCode());
        }
    }

    @Test
    void storeIsNotTouchedWhenPoolIsEmpty() {
        ScheduleStore quiet = mock(ScheduleStore.class);
        AllocatorImpl local = newAllocator(calendar, checker, quiet);

        assertThrows(EmptyRequestPoolException.class, () -> local.allocate(Collections.emptyList()));
        verify(quiet, never()).commit(any(ScheduleBatch.class));
    }

    private static List<ConsultationRequest> mixedPool() {
        return new ArrayList<>(Arrays.asList(
                request("M1", "G1", 0, "S1", "S2").build(),
                request("M2", "G2", 0, "S1").siblingEnrolled(true).build(),
                request("M3", "G1", 3, "S3", "S1").gradeLevel(1).build(),
                request("M4", "G4", 1, "S1").distanceTier(0).build(),
                request("M5", "G5", 1, "S1").distanceTier(0).build(),
                request("M6", "G6", 2, "HOLIDAY").build(),
                request("M7", "G7", 2).build()));
    }

    private static List<String> ids(List<WaitlistEntry> entries) {
        return entries.stream().map(WaitlistEntry::getRequestId).collect(Collectors.toList());
    }
}
