package com.eventalerts.alerter.domain.cycle;

import com.eventalerts.alerter.domain.dedup.DedupPolicy;
import com.eventalerts.alerter.domain.exceptions.FetchException;
import com.eventalerts.alerter.domain.exceptions.PersistException;
import com.eventalerts.alerter.domain.notification.MessageRenderer;
import com.eventalerts.alerter.domain.notification.NotificationDispatcher;
import com.eventalerts.alerter.domain.query.EventFilter;
import com.eventalerts.alerter.domain.query.EventQuery;
import com.eventalerts.alerter.domain.tracking.TrackingRepository;
import com.eventalerts.alerter.domain.tracking.TrackingStore;
import com.eventalerts.common.event.EventRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * One fetch, decide, notify, persist pass.
 *
 * <p>An event's tracking entry is only updated after a successful notification, so an event
 * whose notification failed is offered again by the next cycle. The store is written once,
 * at the end of the cycle, and only when something changed.
 */
@Slf4j
@Builder
public class PollCycle {

    private final EventQuery eventQuery;
    private final EventFilter eventFilter;
    private final DedupPolicy dedupPolicy;
    private final MessageRenderer messageRenderer;
    private final NotificationDispatcher dispatcher;
    private final TrackingRepository trackingRepository;
    private final DeadlineExecutor deadlineExecutor;
    private final StopSignal stopSignal;
    private final Duration cycleTimeout;
    private final boolean dryRun;

    /**
     * @throws FetchException if candidate events could not be fetched; nothing is notified
     *     or recorded in that case
     */
    public CycleReport run(TrackingStore store, Instant now) {
        var deadline = now.plus(cycleTimeout);
        var events = fetch(deadline);
        log.info("cycle.fetched: events={}, tracked={}", events.size(), store.size());

        var notified = new ArrayList<String>();
        var skipped = new ArrayList<String>();
        var failed = new ArrayList<String>();
        var interrupted = false;

        for (int i = 0; i < events.size(); i++) {
            if (stopSignal.isStopRequested()) {
                log.info("cycle.interrupted: stop requested, {} event(s) left for a later run", events.size() - i);
                interrupted = true;
                break;
            }
            var event = events.get(i);
            var decision = dedupPolicy.decide(event, store.get(event.id()).orElse(null), now);
            if (!decision.shouldNotify()) {
                log.debug("event.skipped: event_id={}, within reminder window", event.id());
                skipped.add(event.id());
                continue;
            }

            var message = messageRenderer.render(event, decision, now);
            if (dryRun) {
                log.info("event.dry_run: event_id={}, decision={}, subject=\"{}\"", event.id(), decision, message.subject());
                skipped.add(event.id());
                continue;
            }

            var result = dispatcher.dispatch(event, message, deadline);
            if (result.delivered()) {
                store.record(event.id(), now);
                notified.add(event.id());
                log.info("event.notified: event_id={}, decision={}, deliveries={}/{}",
                        event.id(), decision, result.succeeded(), result.attempted());
            } else {
                failed.add(event.id());
                log.warn("event.notify_failed: event_id={}, decision={}, deliveries={}, will retry next cycle",
                        event.id(), decision, result.attempted());
            }
        }

        var persisted = persist(store);
        return new CycleReport(events.size(), notified, skipped, failed, interrupted, persisted);
    }

    private List<EventRecord> fetch(Instant deadline) {
        try {
            return deadlineExecutor.call(() -> eventQuery.fetch(eventFilter), deadline);
        } catch (TimeoutException e) {
            throw FetchException.timedOut(cycleTimeout);
        } catch (FetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw FetchException.queryFailed(eventFilter.toString(), e);
        }
    }

    private boolean persist(TrackingStore store) {
        if (!store.isDirty()) {
            return true;
        }
        try {
            trackingRepository.save(store);
            store.markPersisted();
            return true;
        } catch (PersistException e) {
            log.error("CRITICAL tracking.persist_failed: entries={}, notified events may repeat after a restart, "
                    + "the write is retried next cycle", store.size(), e);
            return false;
        }
    }
}
