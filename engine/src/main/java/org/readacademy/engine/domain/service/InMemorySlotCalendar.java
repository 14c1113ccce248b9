package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.exception.CapacityExceededException;
import org.readacademy.engine.domain.exception.UnknownSlotException;
import org.readacademy.engine.domain.model.TimeSlot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Thread-safe calendar. Each slot carries its own atomic occupancy counter;
 * reservations use compare-and-set against capacity so no interleaving can overbook.
 */
public final class InMemorySlotCalendar implements SlotCalendar {

    private static final Logger LOG = Logger.getLogger(InMemorySlotCalendar.class.getName());

    private final Map<String, SlotState> slots;

    public InMemorySlotCalendar(Collection<TimeSlot> definitions) {
        Objects.requireNonNull(definitions, "definitions must not be null");
        Map<String, SlotState> byId = new LinkedHashMap<>();
        for (TimeSlot slot : definitions) {
            if (byId.put(slot.getSlotId(), new SlotState(slot)) != null) {
                throw new IllegalArgumentException("Duplicate slot id: " + slot.getSlotId());
            }
        }
        this.slots = Collections.unmodifiableMap(byId);
        LOG.info(() -> "Calendar initialized with " + slots.size() + " slots");
    }

    @Override
    public int remainingCapacity(String slotId) {
        SlotState state = stateOf(slotId);
        if (state.slot.isBlackout()) {
            return 0;
        }
        return state.slot.getCapacity() - state.occupancy.get();
    }

    @Override
    public boolean isBlackout(String slotId) {
        return stateOf(slotId).slot.isBlackout();
    }

    @Override
    public void reserve(String slotId) {
        SlotState state = stateOf(slotId);
        if (state.slot.isBlackout()) {
            throw new CapacityExceededException(slotId);
        }
        int capacity = state.slot.getCapacity();
        while (true) {
            int current = state.occupancy.get();
            if (current >= capacity) {
                throw new CapacityExceededException(slotId);
            }
            if (state.occupancy.compareAndSet(current, current + 1)) {
                LOG.finer(() -> String.format("Reserved %s (%d/%d)", slotId, current + 1, capacity));
                return;
            }
        }
    }

    @Override
    public void release(String slotId) {
        SlotState state = stateOf(slotId);
        while (true) {
            int current = state.occupancy.get();
            if (current == 0) {
                LOG.warning(() -> "Release on empty slot ignored: " + slotId);
                return;
            }
            if (state.occupancy.compareAndSet(current, current - 1)) {
                LOG.finer(() -> String.format("Released %s (%d/%d)",
                        slotId, current - 1, state.slot.getCapacity()));
                return;
            }
        }
    }

    @Override
    public TimeSlot slot(String slotId) {
        return stateOf(slotId).slot;
    }

    @Override
    public int occupancy(String slotId) {
        return stateOf(slotId).occupancy.get();
    }

    @Override
    public boolean contains(String slotId) {
        return slotId != null && slots.containsKey(slotId);
    }

    @Override
    public List<TimeSlot> slots() {
        List<TimeSlot> result = new ArrayList<>(slots.size());
        for (SlotState state : slots.values()) {
            result.add(state.slot);
        }
        return Collections.unmodifiableList(result);
    }

    private SlotState stateOf(String slotId) {
        SlotState state = slotId != null ? slots.get(slotId) : null;
        if (state == null) {
            throw new UnknownSlotException(slotId);
        }
        return state;
    }

    private static final class SlotState {
        private final TimeSlot slot;
        private final AtomicInteger occupancy = new AtomicInteger();

        private SlotState(TimeSlot slot) {
            this.slot = slot;
        }
    }
}
