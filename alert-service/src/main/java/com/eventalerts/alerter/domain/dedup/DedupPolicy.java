package com.eventalerts.alerter.domain.dedup;

import com.eventalerts.alerter.domain.tracking.TrackingEntry;
import com.eventalerts.common.event.EventRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether an observed event is notified now. Pure: the outcome depends only on
 * the arguments and the configured reminder frequency.
 */
public class DedupPolicy {

    private final Duration reminderFrequency;

    public DedupPolicy(Duration reminderFrequency) {
        Objects.requireNonNull(reminderFrequency, "reminderFrequency");
        if (reminderFrequency.isNegative()) {
            throw new IllegalArgumentException("reminderFrequency must not be negative: " + reminderFrequency);
        }
        this.reminderFrequency = reminderFrequency;
    }

    /**
     * @param entry tracking entry for {@code event.id()}, or {@code null} if the event was never notified
     */
    public DedupDecision decide(EventRecord event, TrackingEntry entry, Instant now) {
        if (entry == null) {
            return DedupDecision.NOTIFY_NEW;
        }
        if (!entry.eventId().equals(event.id())) {
            throw new IllegalArgumentException(
                    "Tracking entry " + entry.eventId() + " does not belong to event " + event.id());
        }
        // Reminder is due once the full frequency has elapsed, boundary included.
        // A last notification in the future (clock skew) is never due.
        var reminderDueAt = entry.lastNotifiedAt().plus(reminderFrequency);
        return now.isBefore(reminderDueAt) ? DedupDecision.SKIP : DedupDecision.NOTIFY_REMINDER;
    }

    public Duration reminderFrequency() {
        return reminderFrequency;
    }
}
