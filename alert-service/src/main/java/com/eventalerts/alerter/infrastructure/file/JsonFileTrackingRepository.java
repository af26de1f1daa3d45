package com.eventalerts.alerter.infrastructure.file;

import com.eventalerts.alerter.domain.exceptions.PersistException;
import com.eventalerts.alerter.domain.tracking.TrackingEntry;
import com.eventalerts.alerter.domain.tracking.TrackingRepository;
import com.eventalerts.alerter.domain.tracking.TrackingStore;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Keeps the tracking store in a single JSON file.
 *
 * <p>Writes go to a temporary file in the same directory which is flushed to disk and then
 * moved over the target, so a crash leaves either the old or the new content. Older files
 * that map ids straight to a timestamp, or only list notified ids under
 * {@code sent_event_ids}, are still read.
 */
@Slf4j
public class JsonFileTrackingRepository implements TrackingRepository {

    private static final TypeReference<Map<String, Object>> RAW_FILE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonFileTrackingRepository(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public TrackingStore load() {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            log.warn("tracking.load: no tracking file at {}, starting with empty history", file);
            return TrackingStore.empty();
        } catch (IOException e) {
            log.error("tracking.load_failed: cannot read {}, starting with empty history", file, e);
            return TrackingStore.empty();
        }

        Map<String, Object> raw;
        try {
            raw = objectMapper.readValue(content, RAW_FILE);
        } catch (JacksonException e) {
            log.error("tracking.load_failed: {} is not valid JSON, starting with empty history", file, e);
            return TrackingStore.empty();
        }
        if (raw == null) {
            log.error("tracking.load_failed: {} holds no JSON object, starting with empty history", file);
            return TrackingStore.empty();
        }

        var entries = new LinkedHashMap<String, TrackingEntry>();
        readLegacyIds(raw.get("sent_event_ids"), entries);
        readSentEvents(raw.get("sent_events"), entries);
        log.info("tracking.loaded: entries={}, file={}", entries.size(), file);
        return TrackingStore.of(entries.values());
    }

    @Override
    public void save(TrackingStore store) {
        var sentEvents = new LinkedHashMap<String, TrackingFile.Entry>();
        for (var entry : store.entries()) {
            sentEvents.put(entry.eventId(), new TrackingFile.Entry(
                    entry.firstSeenAt().toString(), entry.lastNotifiedAt().toString()));
        }
        var trackingFile = new TrackingFile(sentEvents, clock.instant().toString());

        Path temp = null;
        try {
            var directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName() + ".", ".tmp");
            write(temp, objectMapper.writeValueAsBytes(trackingFile));
            replace(temp);
            log.debug("tracking.saved: entries={}, file={}", sentEvents.size(), file);
        } catch (IOException | RuntimeException e) {
            var failure = PersistException.writeFailed(file, e);
            deleteQuietly(temp, failure);
            throw failure;
        }
    }

    private void readSentEvents(Object value, Map<String, TrackingEntry> entries) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Map<?, ?> sentEvents)) {
            log.warn("tracking.load: ignoring sent_events of unexpected type {}", value.getClass().getSimpleName());
            return;
        }
        sentEvents.forEach((id, recorded) -> {
            var eventId = String.valueOf(id);
            try {
                entries.put(eventId, toEntry(eventId, recorded));
            } catch (DateTimeParseException | IllegalArgumentException e) {
                log.warn("tracking.load: dropping entry for event {}: {}", eventId, e.getMessage());
            }
        });
    }

    // Legacy list of ids without timestamps: treat them as notified now
    private void readLegacyIds(Object value, Map<String, TrackingEntry> entries) {
        if (!(value instanceof List<?> ids)) {
            return;
        }
        var migratedAt = clock.instant();
        for (var id : ids) {
            if (id != null) {
                entries.put(String.valueOf(id), TrackingEntry.firstNotification(String.valueOf(id), migratedAt));
            }
        }
        log.info("tracking.load: migrated {} legacy event id(s)", ids.size());
    }

    private TrackingEntry toEntry(String eventId, Object recorded) {
        if (recorded instanceof String timestamp) {
            return TrackingEntry.firstNotification(eventId, parse(timestamp));
        }
        if (recorded instanceof Map<?, ?> fields) {
            var lastNotified = fields.get("last_notified_at");
            if (!(lastNotified instanceof String lastNotifiedAt)) {
                throw new IllegalArgumentException("missing last_notified_at");
            }
            var firstSeen = fields.get("first_seen_at");
            var firstSeenAt = firstSeen instanceof String text ? parse(text) : null;
            return new TrackingEntry(eventId, firstSeenAt, parse(lastNotifiedAt));
        }
        throw new IllegalArgumentException("unexpected value " + recorded);
    }

    // Timestamps without an offset are read in the clock's zone
    private Instant parse(String timestamp) {
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(timestamp).atZone(clock.getZone()).toInstant();
        }
    }

    private static void write(Path target, byte[] content) throws IOException {
        try (var channel = FileChannel.open(target, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            var buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void replace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("tracking.save: atomic move not supported for {}, falling back to a plain replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, Exception failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
