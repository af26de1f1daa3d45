package com.eventalerts.alerter.infrastructure.db;

import com.eventalerts.alerter.application.config.AlertsProperties;
import com.eventalerts.alerter.domain.exceptions.FetchException;
import com.eventalerts.alerter.domain.query.EventFilter;
import com.eventalerts.alerter.domain.query.EventQuery;
import com.eventalerts.common.event.EventRecord;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class JdbcEventQuery implements EventQuery {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final String queryFile;
    private final String sql;

    public JdbcEventQuery(
            NamedParameterJdbcTemplate jdbcTemplate,
            SqlQueryLoader queryLoader,
            AlertsProperties properties,
            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.queryFile = properties.query().file();
        this.sql = queryLoader.load(queryFile);
    }

    @Override
    public List<EventRecord> fetch(EventFilter filter) {
        var parameters = parameters(filter);
        log.debug("event.query: file={}, parameters={}", queryFile, parameters.getValues());
        try {
            var events = jdbcTemplate.query(sql, parameters, new EventExtractor(clock.instant()));
            return events == null ? List.of() : events;
        } catch (DataAccessException e) {
            throw FetchException.queryFailed(queryFile, e);
        }
    }

    static MapSqlParameterSource parameters(EventFilter filter) {
        return new MapSqlParameterSource()
                .addValue("type_id", filter.typeId())
                .addValue("status_id", filter.statusId())
                .addValue("name_filter", contains(filter.nameFilter()))
                .addValue("name_excluded", excluded(filter.nameExclude()))
                .addValue("lookback_days", filter.lookbackDays());
    }

    private static String contains(String text) {
        return "%" + (text == null ? "" : text.trim().toLowerCase(Locale.ROOT)) + "%";
    }

    // '%%' would exclude every name, so a blank exclusion matches nothing instead
    private static String excluded(String text) {
        return text == null || text.isBlank() ? "" : contains(text);
    }
}
