package com.eventalerts.alerter.application.job;

import com.eventalerts.alerter.domain.cycle.StopSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * Raised when the application context starts closing (SIGTERM, SIGINT). Context close
 * happens before the task scheduler is shut down, so an in-flight cycle sees the signal
 * between events and drains.
 */
@Slf4j
@Component
public class ShutdownSignal implements StopSignal, ApplicationListener<ContextClosedEvent> {

    private volatile boolean stopRequested;

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        requestStop();
    }

    public void requestStop() {
        if (!stopRequested) {
            log.info("Shutdown requested, finishing the current event and stopping");
        }
        stopRequested = true;
    }

    @Override
    public boolean isStopRequested() {
        return stopRequested;
    }
}
