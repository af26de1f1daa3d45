package com.eventalerts.alerter.infrastructure.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.eventalerts.alerter.domain.exceptions.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.DefaultResourceLoader;

class SqlQueryLoaderTest {

    private final SqlQueryLoader loader = new SqlQueryLoader(new DefaultResourceLoader());

    @Test
    void shouldLoadBundledEventQuery() {
        // when
        var sql = loader.load("events.sql");

        // then
        assertThat(sql).contains(":type_id", ":status_id", ":name_filter", ":name_excluded", ":lookback_days");
    }

    @ParameterizedTest
    @ValueSource(strings = {"../application.yml", "..sql", "/etc/passwd.sql", "events.txt", "sub/events.sql", ""})
    void shouldRejectNamesThatAreNotPlainSqlFiles(String fileName) {
        assertThatThrownBy(() -> loader.load(fileName))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("alerts.query.file");
    }

    @Test
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> loader.load("absent.sql"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void shouldRejectEmptyFile() {
        assertThatThrownBy(() -> loader.load("blank.sql"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("is empty");
    }
}
