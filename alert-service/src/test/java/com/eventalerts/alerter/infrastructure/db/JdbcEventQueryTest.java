package com.eventalerts.alerter.infrastructure.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import com.eventalerts.alerter.application.config.AlertsPropertiesFixture;
import com.eventalerts.alerter.domain.exceptions.FetchException;
import com.eventalerts.alerter.domain.query.EventFilter;
import com.eventalerts.common.event.EventRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

@ExtendWith(MockitoExtension.class)
class JdbcEventQueryTest {

    private static final String SQL = "SELECT id, event_name, created_at FROM events WHERE type_id = :type_id";
    private static final EventFilter FILTER = EventFilter.builder()
            .typeId(18)
            .statusId(3)
            .nameFilter(" Hot ")
            .nameExclude("Vessel")
            .lookbackDays(17)
            .build();

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Mock
    private SqlQueryLoader queryLoader;

    private JdbcEventQuery eventQuery;

    @BeforeEach
    void setUp() {
        given(queryLoader.load("events.sql")).willReturn(SQL);
        eventQuery = new JdbcEventQuery(jdbcTemplate, queryLoader, AlertsPropertiesFixture.defaults(),
                Clock.fixed(Instant.parse("2026-10-19T08:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldRunConfiguredQueryWithFilterParameters() {
        // given
        var event = EventRecord.builder().id("1").name("Hot work").build();
        given(jdbcTemplate.query(eq(SQL), any(SqlParameterSource.class), any(EventExtractor.class)))
                .willReturn(List.of(event));

        // when
        var events = eventQuery.fetch(FILTER);

        // then
        assertThat(events).containsExactly(event);
        var parameters = ArgumentCaptor.forClass(SqlParameterSource.class);
        then(jdbcTemplate).should().query(eq(SQL), parameters.capture(), any(EventExtractor.class));
        assertThat(((MapSqlParameterSource) parameters.getValue()).getValues())
                .containsEntry("type_id", 18)
                .containsEntry("status_id", 3)
                .containsEntry("name_filter", "%hot%")
                .containsEntry("name_excluded", "%vessel%")
                .containsEntry("lookback_days", 17);
    }

    @Test
    void shouldWrapDatabaseFailure() {
        // given
        given(jdbcTemplate.query(eq(SQL), any(SqlParameterSource.class), any(EventExtractor.class)))
                .willThrow(new DataAccessResourceFailureException("connection refused"));

        // when/then
        assertThatThrownBy(() -> eventQuery.fetch(FILTER))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("events.sql")
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void shouldMatchEveryNameWhenFilterIsBlank() {
        // when
        var values = JdbcEventQuery.parameters(FILTER.toBuilder().nameFilter("").nameExclude(" ").build())
                .getValues();

        // then
        assertThat(values)
                .containsEntry("name_filter", "%%")
                .containsEntry("name_excluded", "");
    }
}
