package com.eventalerts.alerter.infrastructure.file;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LivenessFileTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    @TempDir
    Path directory;

    @Test
    void shouldWriteTimeOfLastCycle() throws IOException {
        // given
        var file = directory.resolve("health").resolve("last_run.txt");
        var liveness = new LivenessFile(file, Clock.fixed(NOW, ZoneOffset.UTC));

        // when
        liveness.touch();

        // then
        assertThat(Files.readString(file).trim()).isEqualTo("2026-10-19T08:00:00Z");
    }

    @Test
    void shouldNotFailWhenFileCannotBeWritten() throws IOException {
        // given
        var blocker = Files.writeString(directory.resolve("blocker"), "x");
        var liveness = new LivenessFile(blocker.resolve("last_run.txt"), Clock.fixed(NOW, ZoneOffset.UTC));

        // when
        liveness.touch();

        // then
        assertThat(Files.isRegularFile(blocker)).isTrue();
    }
}
