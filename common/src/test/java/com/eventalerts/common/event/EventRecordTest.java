package com.eventalerts.common.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRecordTest {

    @Test
    void requiresId() {
        assertThatThrownBy(() -> EventRecord.builder().name("Hot work").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessage("id");
    }

    @Test
    void attributesDefaultToEmpty() {
        var event = EventRecord.builder().id("1").build();

        assertThat(event.attributes()).isEmpty();
    }

    @Test
    void attributesKeepColumnOrderAndAreDetachedFromSource() {
        var source = new LinkedHashMap<String, Object>();
        source.put("vessel", "Aurora");
        source.put("deck", null);
        source.put("crew", 12);

        var event = EventRecord.builder().id("1").attributes(source).build();
        source.put("late", "ignored");

        assertThat(event.attributes()).containsOnlyKeys("vessel", "deck", "crew");
        assertThat(event.attributes().keySet()).containsExactly("vessel", "deck", "crew");
        assertThatThrownBy(() -> event.attributes().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void descriptiveFieldsDoNotChangeIdentity() {
        var first = EventRecord.builder()
                .id("42")
                .name("Hot work - engine room")
                .status("for-review")
                .observedAt(Instant.parse("2026-10-18T08:00:00Z"))
                .build();
        var renamed = first.toBuilder()
                .name("Hot work - deck")
                .status("approved")
                .attributes(Map.of("vessel", "Aurora"))
                .build();

        assertThat(renamed.id()).isEqualTo(first.id());
    }

    @Test
    void recipientMatchIsCaseInsensitive() {
        var event = EventRecord.builder().id("1").recipientEmail("Master@Prominence.example").build();

        assertThat(event.hasRecipientMatching("prominence")).isTrue();
        assertThat(event.hasRecipientMatching("seatraders")).isFalse();
        assertThat(event.hasRecipientMatching(" ")).isFalse();
    }

    @Test
    void recipientMatchIsFalseWithoutMetadata() {
        var event = EventRecord.builder().id("1").build();

        assertThat(event.hasRecipientMatching("prominence")).isFalse();
    }
}
