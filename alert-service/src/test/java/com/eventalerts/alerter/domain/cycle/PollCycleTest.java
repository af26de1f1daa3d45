package com.eventalerts.alerter.domain.cycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import com.eventalerts.alerter.domain.exceptions.NotificationException;
import com.eventalerts.alerter.domain.notification.Delivery;
import com.eventalerts.alerter.domain.notification.RenderedMessage;
import com.eventalerts.alerter.domain.tracking.TrackingEntry;
import com.eventalerts.alerter.domain.tracking.TrackingStore;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class PollCycleTest extends PollCycleBaseTest {

    @Test
    void shouldNotifyNewEventAndDueReminder() {
        // given
        var store = TrackingStore.of(List.of(
                TrackingEntry.firstNotification("2", NOW.minus(Duration.ofDays(10)))));
        given(eventQuery.fetch(FILTER)).willReturn(List.of(event("1", "Hot work A"), event("2", "Hot work B")));

        // when
        var report = pollCycle.run(store, NOW);

        // then
        assertThat(report.fetched()).isEqualTo(2);
        assertThat(report.notified()).containsExactly("1", "2");
        assertThat(report.skipped()).isEmpty();
        assertThat(report.failed()).isEmpty();
        assertThat(report.persisted()).isTrue();
        assertThat(store.get("1")).contains(new TrackingEntry("1", NOW, NOW));
        assertThat(store.get("2").orElseThrow().lastNotifiedAt()).isEqualTo(NOW);
        assertThat(store.get("2").orElseThrow().firstSeenAt()).isEqualTo(NOW.minus(Duration.ofDays(10)));
        then(emailNotifier).should(times(2)).send(any(RenderedMessage.class), any());
        then(trackingRepository).should().save(store);
    }

    @Test
    void shouldSendReminderSubjectForKnownEvent() {
        // given
        var store = TrackingStore.of(List.of(
                TrackingEntry.firstNotification("2", NOW.minus(Duration.ofDays(10)))));
        given(eventQuery.fetch(FILTER)).willReturn(List.of(event("2", "Hot work B")));

        // when
        pollCycle.run(store, NOW);

        // then
        then(emailNotifier).should().send(
                argThat(message -> message.subject().contains("Reminder")), eq(INTERNAL));
    }

    @Test
    void shouldSkipEventsWithinCoolDown() {
        // given
        var store = TrackingStore.of(List.of(
                TrackingEntry.firstNotification("1", NOW.minus(Duration.ofDays(3)))));
        given(eventQuery.fetch(FILTER)).willReturn(List.of(event("1", "Hot work A")));

        // when
        var report = pollCycle.run(store, NOW);

        // then
        assertThat(report.skipped()).containsExactly("1");
        assertThat(report.notified()).isEmpty();
        assertThat(report.persisted()).isTrue();
        then(emailNotifier).should(never()).send(any(), anyList());
        then(trackingRepository).should(never()).save(any());
    }

    @Test
    void shouldBeIdempotentWithinTheSameWindow() {
        // given
        var store = TrackingStore.empty();
        given(eventQuery.fetch(FILTER)).willReturn(List.of(event("1", "Hot work A"), event("2", "Hot work B")));
        pollCycle.run(store, NOW);

        // when
        var second = pollCycle.run(store, NOW.plus(Duration.ofHours(1)));

        // then
        assertThat(second.notified()).isEmpty();
        assertThat(second.skipped()).containsExactly("1", "2");
        then(emailNotifier).should(times(2)).send(any(), anyList());
        then(trackingRepository).should(times(1)).save(store);
    }

    @Test
    void shouldLeaveFailedEventUntrackedAndRetryNextCycle() {
        // given
        var store = TrackingStore.empty();
        given(eventQuery.fetch(FILTER)).willReturn(List.of(event("1", "Hot work A"), event("2", "Hot work B")));
        willAnswer(invocation -> {
            RenderedMessage message = invocation.getArgument(0);
            if (message.subject().contains("Hot work B")) {
                throw NotificationException.deliveryFailed(Delivery.EMAIL, new IllegalStateException("smtp down"));
            }
            return null;
        }).given(emailNotifier).send(any(), anyList());

        // when
        var report = pollCycle.run(store, NOW);

        // then
        assertThat(report.notified()).containsExactly("1");
        assertThat(report.failed()).containsExactly("2");
        assertThat(store.get("1")).isPresent();
        assertThat(store.get("2")).isEmpty();

        // when the transport recovers
        willAnswer(invocation -> null).given(emailNotifier).send(any(), anyList());
        var retry = pollCycle.run(store, NOW.plus(Duration.ofHours(1)));

        // then
        assertThat(retry.notified()).containsExactly("2");
        assertThat(retry.skipped()).containsExactly("1");
        assertThat(store.get("2").orElseThrow().lastNotifiedAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void shouldCompleteWithNothingToDoWhenQueryFindsNoEvents() {
        // given
        var store = TrackingStore.empty();
        given(eventQuery.fetch(FILTER)).willReturn(List.of());

        // when
        var report = pollCycle.run(store, NOW);

        // then
        assertThat(report).isEqualTo(new CycleReport(0, List.of(), List.of(), List.of(), false, true));
        then(trackingRepository).should(never()).save(any());
    }
}
