package com.eventalerts.alerter.infrastructure.db;

import com.eventalerts.alerter.domain.exceptions.FetchException;
import com.eventalerts.common.event.EventRecord;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ResultSetExtractor;

/**
 * Maps the event query result to {@link EventRecord}s. Columns without a dedicated field
 * end up in {@link EventRecord#attributes()} in result order.
 */
@Slf4j
class EventExtractor implements ResultSetExtractor<List<EventRecord>> {

    static final List<String> REQUIRED_COLUMNS = List.of("id", "event_name", "created_at");

    private static final Set<String> MAPPED_COLUMNS =
            Set.of("id", "event_name", "created_at", "type_name", "status_name", "email");

    private final Instant observedAt;

    EventExtractor(Instant observedAt) {
        this.observedAt = observedAt;
    }

    @Override
    public List<EventRecord> extractData(ResultSet rs) throws SQLException {
        var columns = columns(rs);
        var missing = REQUIRED_COLUMNS.stream().filter(column -> !columns.contains(column)).toList();
        if (!missing.isEmpty()) {
            throw FetchException.missingColumns(missing, columns);
        }

        var events = new ArrayList<EventRecord>();
        while (rs.next()) {
            if (rs.getObject("id") == null) {
                log.warn("event.query: skipping row {} without an id", rs.getRow());
                continue;
            }
            events.add(map(rs, columns));
        }
        return events;
    }

    private EventRecord map(ResultSet rs, List<String> columns) throws SQLException {
        var attributes = new LinkedHashMap<String, Object>();
        for (int i = 0; i < columns.size(); i++) {
            if (!MAPPED_COLUMNS.contains(columns.get(i))) {
                attributes.put(columns.get(i), value(rs.getObject(i + 1)));
            }
        }
        var createdAt = rs.getTimestamp("created_at");
        return EventRecord.builder()
                .id(id(rs.getObject("id")))
                .name(rs.getString("event_name"))
                .type(optionalString(rs, columns, "type_name"))
                .status(optionalString(rs, columns, "status_name"))
                .recipientEmail(optionalString(rs, columns, "email"))
                .createdAt(createdAt == null ? null : createdAt.toInstant())
                .attributes(attributes)
                .observedAt(observedAt)
                .build();
    }

    private static List<String> columns(ResultSet rs) throws SQLException {
        var metaData = rs.getMetaData();
        var columns = new ArrayList<String>(metaData.getColumnCount());
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            columns.add(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return columns;
    }

    private static String optionalString(ResultSet rs, List<String> columns, String column) throws SQLException {
        return columns.contains(column) ? rs.getString(column) : null;
    }

    // 42, 42L and 42.0 all identify event "42"
    private static String id(Object raw) {
        if (raw instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (raw instanceof Double || raw instanceof Float) {
            return new BigDecimal(raw.toString()).stripTrailingZeros().toPlainString();
        }
        return raw.toString().trim();
    }

    private static Object value(Object raw) {
        if (raw instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (raw instanceof OffsetDateTime dateTime) {
            return dateTime.toInstant();
        }
        return raw;
    }
}
