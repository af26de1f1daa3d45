package com.eventalerts.alerter.domain.tracking;

import java.time.Instant;
import java.util.Objects;

/**
 * When an event was first and most recently notified. {@code firstSeenAt} is diagnostic only.
 */
public record TrackingEntry(String eventId, Instant firstSeenAt, Instant lastNotifiedAt) {

    public TrackingEntry {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(lastNotifiedAt, "lastNotifiedAt");
        if (firstSeenAt == null) {
            firstSeenAt = lastNotifiedAt;
        }
    }

    public static TrackingEntry firstNotification(String eventId, Instant notifiedAt) {
        return new TrackingEntry(eventId, notifiedAt, notifiedAt);
    }

    public TrackingEntry notifiedAgainAt(Instant notifiedAt) {
        return new TrackingEntry(eventId, firstSeenAt, notifiedAt);
    }
}
