package com.eventalerts.alerter.infrastructure.db;

import com.eventalerts.alerter.domain.exceptions.ConfigException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads named SQL files from {@code classpath:queries/}. Only plain file names are accepted,
 * so a configured name can never point outside that directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqlQueryLoader {

    static final String QUERIES_LOCATION = "classpath:queries/";

    private static final Pattern FILE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*\\.sql");
    private static final String PROPERTY = "alerts.query.file";

    private final ResourceLoader resourceLoader;

    public String load(String fileName) {
        if (fileName == null || !FILE_NAME.matcher(fileName).matches() || fileName.contains("..")) {
            throw ConfigException.invalid(PROPERTY, "'" + fileName + "' is not a plain .sql file name");
        }

        var location = QUERIES_LOCATION + fileName;
        var resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw ConfigException.invalid(PROPERTY, location + " does not exist");
        }

        String sql;
        try {
            sql = resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw ConfigException.unreadable(PROPERTY, location, e);
        }
        if (sql.isBlank()) {
            throw ConfigException.invalid(PROPERTY, location + " is empty");
        }
        log.info("Loaded event query from {}", location);
        return sql;
    }
}
