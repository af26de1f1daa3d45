package com.eventalerts.alerter.application.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single cycle at startup instead of the recurring schedule. The exit code is 1 when the
 * cycle failed or its changes could not be persisted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "alerts.scheduler", name = "run-once", havingValue = "true")
public class RunOnceRunner implements ApplicationRunner, ExitCodeGenerator {

    private final PollScheduler pollScheduler;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Run-once mode: running a single poll cycle");
        exitCode = pollScheduler.runCycle() ? 0 : 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
