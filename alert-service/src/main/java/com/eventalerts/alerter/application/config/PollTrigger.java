package com.eventalerts.alerter.application.config;

import java.time.Duration;
import java.time.Instant;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

/**
 * Fixed-rate trigger that never queues catch-up runs. A cycle that overruns its interval
 * is followed by exactly one immediate cycle, after which the normal cadence resumes.
 */
class PollTrigger implements Trigger {

    private final Duration interval;

    PollTrigger(Duration interval) {
        this.interval = interval;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        var lastStart = triggerContext.lastActualExecution();
        if (lastStart == null) {
            return triggerContext.getClock().instant();
        }
        var next = lastStart.plus(interval);
        var lastCompletion = triggerContext.lastCompletion();
        if (lastCompletion != null && lastCompletion.isAfter(next)) {
            return lastCompletion;
        }
        return next;
    }
}
