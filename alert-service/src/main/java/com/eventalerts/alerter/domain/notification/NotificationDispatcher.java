package com.eventalerts.alerter.domain.notification;

import com.eventalerts.alerter.domain.cycle.DeadlineExecutor;
import com.eventalerts.common.event.EventRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class NotificationDispatcher {

    private final Map<String, Notifier> notifiersByChannel;
    private final RecipientRouter router;
    private final DeadlineExecutor deadlineExecutor;

    public NotificationDispatcher(List<Notifier> notifiers, RecipientRouter router, DeadlineExecutor deadlineExecutor) {
        this.notifiersByChannel = notifiers.stream()
                .collect(Collectors.toUnmodifiableMap(Notifier::channel, Function.identity()));
        this.router = router;
        this.deadlineExecutor = deadlineExecutor;
    }

    /**
     * Sends the message through every delivery routed for the event. Failures are logged
     * and counted, never thrown, so that one bad transport does not stop the cycle.
     */
    public DispatchResult dispatch(EventRecord event, RenderedMessage message, Instant deadline) {
        var deliveries = router.route(event);
        if (deliveries.isEmpty()) {
            log.warn("notification.unrouted: event_id={}, no channel or recipient configured", event.id());
            return new DispatchResult(0, 0);
        }

        int succeeded = 0;
        for (var delivery : deliveries) {
            if (send(event, message, delivery, deadline)) {
                succeeded++;
            }
        }
        return new DispatchResult(deliveries.size(), succeeded);
    }

    private boolean send(EventRecord event, RenderedMessage message, Delivery delivery, Instant deadline) {
        var notifier = notifiersByChannel.get(delivery.channel());
        if (notifier == null) {
            log.error("notification.failed: event_id={}, channel={}, delivery={}, cause=no notifier registered",
                    event.id(), delivery.channel(), delivery.label());
            return false;
        }
        var body = delivery.compact() ? message.compact() : message;
        try {
            deadlineExecutor.call(() -> {
                notifier.send(body, delivery.recipients());
                return null;
            }, deadline);
            log.info("notification.sent: event_id={}, channel={}, delivery={}, recipients={}",
                    event.id(), delivery.channel(), delivery.label(), delivery.recipients().size());
            return true;
        } catch (TimeoutException e) {
            log.error("notification.failed: event_id={}, channel={}, delivery={}, cause=cycle deadline reached",
                    event.id(), delivery.channel(), delivery.label());
            return false;
        } catch (RuntimeException e) {
            log.error("notification.failed: event_id={}, channel={}, delivery={}, cause={}",
                    event.id(), delivery.channel(), delivery.label(), e.getMessage(), e);
            return false;
        }
    }
}
