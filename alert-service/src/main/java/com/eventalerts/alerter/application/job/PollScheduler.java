package com.eventalerts.alerter.application.job;

import com.eventalerts.alerter.domain.cycle.PollCycle;
import com.eventalerts.alerter.domain.exceptions.FetchException;
import com.eventalerts.alerter.domain.tracking.TrackingRepository;
import com.eventalerts.alerter.domain.tracking.TrackingStore;
import com.eventalerts.alerter.infrastructure.file.LivenessFile;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owns the tracking store and runs one poll cycle per tick.
 *
 * <p>The store is loaded on the first tick and then lent to each cycle in turn. Nothing a
 * cycle throws escapes this class, so a failed cycle never cancels the schedule. The
 * liveness file is touched after every cycle, failed or not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollScheduler {

    private final TrackingRepository trackingRepository;
    private final PollCycle pollCycle;
    private final LivenessFile livenessFile;
    private final ShutdownSignal shutdownSignal;
    private final Clock clock;
    private final Counter eventsNotifiedCounter;
    private final Counter eventsSkippedCounter;
    private final Counter eventsFailedCounter;
    private final Counter cyclesFailedCounter;

    private volatile SchedulerState state = SchedulerState.IDLE;
    private TrackingStore store;
    private long cycleNumber;

    /**
     * @return true if the cycle completed and its changes were persisted
     */
    public synchronized boolean runCycle() {
        if (shutdownSignal.isStopRequested()) {
            state = SchedulerState.STOPPED;
            log.info("cycle.skipped: scheduler is stopped");
            return false;
        }

        var cycle = ++cycleNumber;
        var startedAt = clock.instant();
        var phase = "load";
        state = SchedulerState.RUNNING;
        log.info("cycle.started: cycle={}", cycle);
        try {
            if (store == null) {
                store = trackingRepository.load();
            }
            phase = "poll";
            var report = pollCycle.run(store, startedAt);
            eventsNotifiedCounter.increment(report.notified().size());
            eventsSkippedCounter.increment(report.skipped().size());
            eventsFailedCounter.increment(report.failed().size());
            log.info("cycle.completed: cycle={} fetched={} notified={} skipped={} failed={} interrupted={} "
                            + "persisted={} tracked={} duration_ms={}",
                    cycle, report.fetched(), report.notified().size(), report.skipped().size(),
                    report.failed().size(), report.interrupted(), report.persisted(), store.size(),
                    Duration.between(startedAt, clock.instant()).toMillis());
            return report.persisted();
        } catch (FetchException e) {
            cyclesFailedCounter.increment();
            log.error("cycle.failed: cycle={} phase=fetch cause={}", cycle, e.getMessage(), e);
            return false;
        } catch (RuntimeException e) {
            cyclesFailedCounter.increment();
            log.error("cycle.failed: cycle={} phase={} unexpected error", cycle, phase, e);
            return false;
        } finally {
            livenessFile.touch();
            state = shutdownSignal.isStopRequested() ? SchedulerState.STOPPED : SchedulerState.IDLE;
        }
    }

    public SchedulerState state() {
        return state;
    }

    public synchronized long cycleCount() {
        return cycleNumber;
    }
}
