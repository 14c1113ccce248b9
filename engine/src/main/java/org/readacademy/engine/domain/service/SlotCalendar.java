package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.exception.CapacityExceededException;
import org.readacademy.engine.domain.exception.UnknownSlotException;
import org.readacademy.engine.domain.model.TimeSlot;

import java.util.List;

/**
 * Owns the consultation slots of one admission cycle and their occupancy.
 * Occupancy changes only through {@link #reserve(String)} and {@link #release(String)}.
 */
public interface SlotCalendar {

    /**
     * Seats left in a slot. Blackout slots always report zero.
     *
     * @throws UnknownSlotException if the slot was never registered
     */
    int remainingCapacity(String slotId);

    /**
     * @throws UnknownSlotException if the slot was never registered
     */
    boolean isBlackout(String slotId);

    /**
     * Take one seat. Atomic with respect to concurrent reservations on the same slot.
     *
     * @throws CapacityExceededException if the slot is full or blacked out
     * @throws UnknownSlotException if the slot was never registered
     */
    void reserve(String slotId);

    /**
     * Give one seat back. Releasing an empty slot is a no-op.
     *
     * @throws UnknownSlotException if the slot was never registered
     */
    void release(String slotId);

    /**
     * @throws UnknownSlotException if the slot was never registered
     */
    TimeSlot slot(String slotId);

    /**
     * @throws UnknownSlotException if the slot was never registered
     */
    int occupancy(String slotId);

    boolean contains(String slotId);

    /**
     * All slots in registration order.
     */
    List<TimeSlot> slots();
}
