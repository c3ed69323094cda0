package com.coursesync.scrape.persistence;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.coursesync.scrape.persistence.JdbcSupport.timestamp;

@Repository
public class ScraperSettingsRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public ScraperSettingsRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Map<String, String> findAll() {
        Map<String, String> values = new LinkedHashMap<>();
        jdbc.query(
            "SELECT setting_key, setting_value FROM scraper_settings ORDER BY setting_key",
            new MapSqlParameterSource(),
            rs -> {
                values.put(rs.getString("setting_key"), rs.getString("setting_value"));
            }
        );
        return values;
    }

    public void put(String key, String value, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", value)
            .addValue("now", timestamp(now));
        String update = """
            UPDATE scraper_settings
            SET setting_value = :value,
                updated_at = :now
            WHERE setting_key = :key
            """;
        if (jdbc.update(update, params) == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO scraper_settings (setting_key, setting_value, updated_at)
                        VALUES (:key, :value, :now)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(update, params);
            }
        }
    }
}
