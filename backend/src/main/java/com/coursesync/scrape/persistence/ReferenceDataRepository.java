package com.coursesync.scrape.persistence;

import com.coursesync.scrape.model.CodeDescription;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static com.coursesync.scrape.persistence.JdbcSupport.timestamp;

@Repository
public class ReferenceDataRepository {
    public static final String TERMS = "TERM";
    public static final String SUBJECTS = "SUBJECT";
    public static final String CAMPUSES = "CAMPUS";
    public static final String INSTRUCTIONAL_METHODS = "INSTRUCTIONAL_METHOD";

    private final NamedParameterJdbcTemplate jdbc;

    public ReferenceDataRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public int replaceCategory(String category, List<CodeDescription> values, Instant now) {
        int sortOrder = 0;
        for (CodeDescription value : values) {
            upsert(category, value, sortOrder++, now);
        }
        // anything the upstream no longer lists is stale
        return jdbc.update(
            """
                DELETE FROM reference_data
                WHERE category = :category
                  AND updated_at < :now
                """,
            new MapSqlParameterSource()
                .addValue("category", category)
                .addValue("now", timestamp(now))
        );
    }

    public List<CodeDescription> findCategory(String category) {
        return jdbc.query(
            """
                SELECT code, description
                FROM reference_data
                WHERE category = :category
                ORDER BY sort_order, code
                """,
            new MapSqlParameterSource("category", category),
            (rs, rowNum) -> new CodeDescription(rs.getString("code"), rs.getString("description"))
        );
    }

    public Instant lastRefreshed(String category) {
        Timestamp value = jdbc.queryForObject(
            "SELECT MAX(updated_at) FROM reference_data WHERE category = :category",
            new MapSqlParameterSource("category", category),
            Timestamp.class
        );
        return value == null ? null : value.toInstant();
    }

    private void upsert(String category, CodeDescription value, int sortOrder, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("category", category)
            .addValue("code", value.code())
            .addValue("description", value.description())
            .addValue("sortOrder", sortOrder)
            .addValue("now", timestamp(now));
        String update = """
            UPDATE reference_data
            SET description = :description,
                sort_order = :sortOrder,
                updated_at = :now
            WHERE category = :category
              AND code = :code
            """;
        if (jdbc.update(update, params) == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO reference_data (category, code, description, sort_order, updated_at)
                        VALUES (:category, :code, :description, :sortOrder, :now)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(update, params);
            }
        }
    }
}
