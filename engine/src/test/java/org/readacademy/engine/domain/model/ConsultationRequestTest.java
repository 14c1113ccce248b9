package org.readacademy.engine.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.readacademy.engine.TestFixtures.request;

class ConsultationRequestTest {

    @Test
    void statusMovesForwardOnly() {
        ConsultationRequest r = request("R1", "G1", 0, "S1").build();

        r.transitionTo(RequestStatus.WAITLISTED);
        r.transitionTo(RequestStatus.ASSIGNED);

        assertEquals(RequestStatus.ASSIGNED, r.getStatus());
        assertThrows(IllegalStateException.class, () -> r.transitionTo(RequestStatus.WAITLISTED));
        assertThrows(IllegalStateException.class, () -> r.transitionTo(RequestStatus.PENDING));
    }

    @Test
    void cancellationIsTerminal() {
        ConsultationRequest r = request("R1", "G1", 0, "S1").build();
        r.transitionTo(RequestStatus.ASSIGNED);
        r.transitionTo(RequestStatus.CANCELLED);

        assertThrows(IllegalStateException.class, () -> r.transitionTo(RequestStatus.ASSIGNED));
    }

    @Test
    void gradeOutsideElementaryRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> request("R1", "G1", 0, "S1").gradeLevel(7).build());
        assertThrows(IllegalArgumentException.class, () -> request("R1", "G1", 0, "S1").gradeLevel(0).build());
    }

    @Test
    void distanceTierIsBounded() {
        assertThrows(IllegalArgumentException.class, () -> request("R1", "G1", 0, "S1").distanceTier(5).build());
    }

    @Test
    void requestWithoutPreferencesHasNoMostPreferredSlot() {
        ConsultationRequest r = request("R1", "G1", 0).build();

        assertNull(r.getMostPreferredSlotId());
    }
}
