package com.eventalerts.alerter.infrastructure.file;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/**
 * On-disk shape of the tracking file. Timestamps are ISO-8601 strings.
 */
@JsonPropertyOrder({"sent_events", "last_updated"})
record TrackingFile(
        @JsonProperty("sent_events") Map<String, Entry> sentEvents,
        @JsonProperty("last_updated") String lastUpdated) {

    @JsonPropertyOrder({"first_seen_at", "last_notified_at"})
    record Entry(
            @JsonProperty("first_seen_at") String firstSeenAt,
            @JsonProperty("last_notified_at") String lastNotifiedAt) {}
}
