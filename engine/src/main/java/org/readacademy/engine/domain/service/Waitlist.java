package org.readacademy.engine.domain.service;

import org.readacademy.engine.domain.model.WaitlistEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Wait-listed requests grouped by the slot they wait for, each group kept in
 * {@link WaitlistEntry#ORDER}. Entries without a slot sit in their own group.
 * Not thread-safe; the allocator serializes access.
 */
public final class Waitlist {

    private final Map<String, NavigableSet<WaitlistEntry>> bySlot = new TreeMap<>();
    private final NavigableSet<WaitlistEntry> unslotted = new TreeSet<>(WaitlistEntry.ORDER);
    private final Map<String, WaitlistEntry> byRequest = new HashMap<>();

    /**
     * Add an entry, replacing any earlier entry for the same request.
     */
    public void add(WaitlistEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        remove(entry.getRequestId());
        groupFor(entry.getSlotId(), true).add(entry);
        byRequest.put(entry.getRequestId(), entry);
    }

    /**
     * @return the removed entry, or null if the request was not wait-listed
     */
    public WaitlistEntry remove(String requestId) {
        WaitlistEntry entry = byRequest.remove(requestId);
        if (entry == null) {
            return null;
        }
        NavigableSet<WaitlistEntry> group = groupFor(entry.getSlotId(), false);
        if (group != null) {
            group.remove(entry);
            if (group.isEmpty() && entry.getSlotId() != null) {
                bySlot.remove(entry.getSlotId());
            }
        }
        return entry;
    }

    public WaitlistEntry get(String requestId) {
        return byRequest.get(requestId);
    }

    public boolean contains(String requestId) {
        return byRequest.containsKey(requestId);
    }

    /**
     * Ordered snapshot of one slot's waitlist.
     */
    public List<WaitlistEntry> entriesFor(String slotId) {
        NavigableSet<WaitlistEntry> group = bySlot.get(slotId);
        if (group == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(group));
    }

    /**
     * Requests that named no slot, in priority order.
     */
    public List<WaitlistEntry> unslottedEntries() {
        return Collections.unmodifiableList(new ArrayList<>(unslotted));
    }

    /**
     * Every entry: slot groups in slot id order, then the unslotted group.
     */
    public List<WaitlistEntry> all() {
        List<WaitlistEntry> result = new ArrayList<>(byRequest.size());
        for (NavigableSet<WaitlistEntry> group : bySlot.values()) {
            result.addAll(group);
        }
        result.addAll(unslotted);
        return Collections.unmodifiableList(result);
    }

    public int size() {
        return byRequest.size();
    }

    public boolean isEmpty() {
        return byRequest.isEmpty();
    }

    public void clear() {
        bySlot.clear();
        unslotted.clear();
        byRequest.clear();
    }

    private NavigableSet<WaitlistEntry> groupFor(String slotId, boolean create) {
        if (slotId == null) {
            return unslotted;
        }
        if (create) {
            return bySlot.computeIfAbsent(slotId, k -> new TreeSet<>(WaitlistEntry.ORDER));
        }
        return bySlot.get(slotId);
    }
}
