package com.eventalerts.alerter.application.config;

import com.eventalerts.alerter.application.job.PollScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Fixed-rate poll schedule, first cycle immediately. Runs on Boot's task scheduler, which
 * has a single thread, so cycles never overlap. A cycle that overruns is followed straight
 * away by one more, never by a backlog.
 */
@Slf4j
@Configuration
@EnableScheduling
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "alerts.scheduler", name = "run-once", havingValue = "false", matchIfMissing = true)
public class SchedulingConfig implements SchedulingConfigurer {

    private final AlertsProperties properties;
    private final PollScheduler pollScheduler;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        var interval = properties.scheduler().interval();
        log.info("Scheduling poll cycles every {} (reminder frequency {}, cycle timeout {})",
                interval, properties.reminderFrequency(), properties.scheduler().cycleTimeout());
        taskRegistrar.addTriggerTask(pollScheduler::runCycle, new PollTrigger(interval));
    }
}
