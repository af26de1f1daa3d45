package com.eventalerts.alerter.application.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.SimpleTriggerContext;

class PollTriggerTest {

    private static final Instant START = Instant.parse("2026-10-19T08:00:00Z");
    private static final Duration INTERVAL = Duration.ofMinutes(1);

    private final PollTrigger trigger = new PollTrigger(INTERVAL);

    @Test
    void shouldRunFirstCycleImmediately() {
        // given
        var context = new SimpleTriggerContext(Clock.fixed(START, ZoneOffset.UTC));

        // when/then
        assertThat(trigger.nextExecution(context)).isEqualTo(START);
    }

    @Test
    void shouldKeepCadenceWhenCycleFinishesInTime() {
        // given
        var context = new SimpleTriggerContext(START, START, START.plusSeconds(20));

        // when/then
        assertThat(trigger.nextExecution(context)).isEqualTo(START.plus(INTERVAL));
    }

    @Test
    void shouldStartNextCycleOnCompletionWhenCycleOverran() {
        // given
        var finished = START.plus(INTERVAL.multipliedBy(5)).plusSeconds(7);
        var context = new SimpleTriggerContext(START, START, finished);

        // when/then
        assertThat(trigger.nextExecution(context)).isEqualTo(finished);
    }

    @Test
    void shouldRunOneFollowUpAfterOverrunInsteadOfBacklog() throws InterruptedException {
        // given
        var interval = Duration.ofMillis(100);
        var starts = new CopyOnWriteArrayList<Long>();
        var runs = new AtomicInteger();
        var thirdStart = new CountDownLatch(3);
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();

        try {
            // when
            scheduler.schedule(() -> {
                starts.add(System.nanoTime());
                thirdStart.countDown();
                if (runs.incrementAndGet() == 1) {
                    sleep(550);
                }
            }, new PollTrigger(interval));

            // then
            assertThat(thirdStart.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            scheduler.shutdown();
        }
        List<Long> snapshot = List.copyOf(starts);
        var gapAfterFollowUp = Duration.ofNanos(snapshot.get(2) - snapshot.get(1));
        assertThat(gapAfterFollowUp).isGreaterThanOrEqualTo(Duration.ofMillis(80));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
