package com.eventalerts.alerter.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter eventsNotifiedCounter(MeterRegistry registry) {
        return Counter.builder("alerts.events.notified")
                .description("Events notified through at least one delivery")
                .register(registry);
    }

    @Bean
    public Counter eventsSkippedCounter(MeterRegistry registry) {
        return Counter.builder("alerts.events.skipped")
                .description("Events skipped within the reminder window or in dry-run")
                .register(registry);
    }

    @Bean
    public Counter eventsFailedCounter(MeterRegistry registry) {
        return Counter.builder("alerts.events.failed")
                .description("Events whose every delivery failed")
                .register(registry);
    }

    @Bean
    public Counter cyclesFailedCounter(MeterRegistry registry) {
        return Counter.builder("alerts.cycles.failed")
                .description("Poll cycles aborted by an error")
                .register(registry);
    }
}
