package com.eventalerts.common.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * One matched database row, normalized for the alerting pipeline.
 * Only {@code id} takes part in deduplication; every other field is descriptive and may
 * change between observations of the same event.
 */
@Builder(toBuilder = true)
public record EventRecord(
        String id,
        String name,
        String type,
        String status,
        String recipientEmail,
        Instant createdAt,
        Map<String, Object> attributes,
        Instant observedAt) {

    public EventRecord {
        Objects.requireNonNull(id, "id");
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean hasRecipientMatching(String fragment) {
        return recipientEmail != null
                && fragment != null
                && !fragment.isBlank()
                && recipientEmail.toLowerCase().contains(fragment.toLowerCase());
    }
}
