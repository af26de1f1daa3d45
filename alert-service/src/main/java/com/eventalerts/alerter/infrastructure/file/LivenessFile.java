package com.eventalerts.alerter.infrastructure.file;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

/**
 * Heartbeat for external health checks: holds the time the last poll cycle ended.
 */
@Slf4j
public class LivenessFile {

    private final Path file;
    private final Clock clock;

    public LivenessFile(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public void touch() {
        try {
            var directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            Files.writeString(file, clock.instant().toString() + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("liveness.touch_failed: file={}, cause={}", file, e.getMessage());
        }
    }

    public Path path() {
        return file;
    }
}
