package com.eventalerts.alerter.domain.tracking;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory view of the notification history, keyed by event id.
 *
 * <p>Entries are never evicted. The store is not thread-safe: the scheduler lends it to
 * one poll cycle at a time. Any {@link #record} marks it dirty until the caller confirms a
 * successful write with {@link #markPersisted()}, so a failed write is retried by the next cycle.
 */
public class TrackingStore {

    /** Numeric ids sort numerically and before any non-numeric id. */
    public static final Comparator<String> EVENT_ID_ORDER = (left, right) -> {
        var leftNumber = asNumber(left);
        var rightNumber = asNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return Long.compare(leftNumber, rightNumber);
        }
        if (leftNumber != null) {
            return -1;
        }
        if (rightNumber != null) {
            return 1;
        }
        return left.compareTo(right);
    };

    private final Map<String, TrackingEntry> entries = new HashMap<>();
    private boolean dirty;

    private TrackingStore() {
    }

    public static TrackingStore empty() {
        return new TrackingStore();
    }

    public static TrackingStore of(Collection<TrackingEntry> entries) {
        var store = new TrackingStore();
        entries.forEach(entry -> store.entries.put(entry.eventId(), entry));
        return store;
    }

    public Optional<TrackingEntry> get(String eventId) {
        return Optional.ofNullable(entries.get(eventId));
    }

    public TrackingEntry record(String eventId, Instant notifiedAt) {
        var updated = entries.compute(eventId, (id, existing) -> existing == null
                ? TrackingEntry.firstNotification(id, notifiedAt)
                : existing.notifiedAgainAt(notifiedAt));
        dirty = true;
        return updated;
    }

    /** Snapshot of all entries ordered by event id. */
    public List<TrackingEntry> entries() {
        return entries.values().stream()
                .sorted(Comparator.comparing(TrackingEntry::eventId, EVENT_ID_ORDER))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markPersisted() {
        dirty = false;
    }

    private static Long asNumber(String id) {
        if (id.isEmpty() || id.length() > 18) {
            return null;
        }
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return null;
            }
        }
        return Long.parseLong(id);
    }
}
