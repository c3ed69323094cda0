package com.coursesync.scrape.persistence;

import com.coursesync.scrape.model.FailureKind;
import com.coursesync.scrape.model.RequestLane;
import com.coursesync.scrape.model.ScrapePriority;
import com.coursesync.scrape.model.ScrapeResult;
import com.coursesync.scrape.model.ScraperStatsResponse;
import com.coursesync.scrape.model.TargetType;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.coursesync.scrape.persistence.JdbcSupport.instant;
import static com.coursesync.scrape.persistence.JdbcSupport.timestamp;

@Repository
public class ScrapeResultRepository {
    private static final RowMapper<ScrapeResult> RESULT_MAPPER = (rs, rowNum) -> {
        long jobId = rs.getLong("job_id");
        Long nullableJobId = rs.wasNull() ? null : jobId;
        String failureKind = rs.getString("failure_kind");
        return new ScrapeResult(
            rs.getLong("id"),
            nullableJobId,
            TargetType.valueOf(rs.getString("target_type")),
            rs.getString("target_key"),
            ScrapePriority.fromRank(rs.getInt("priority")),
            RequestLane.valueOf(rs.getString("lane")),
            instant(rs, "started_at"),
            instant(rs, "completed_at"),
            rs.getLong("duration_ms"),
            rs.getBoolean("success"),
            failureKind == null ? null : FailureKind.valueOf(failureKind),
            rs.getString("error_message"),
            rs.getInt("retry_count"),
            rs.getInt("courses_fetched"),
            rs.getInt("courses_changed"),
            rs.getInt("courses_unchanged"),
            rs.getInt("audits_generated")
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeResultRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public ScrapeResult insert(ScrapeResult result) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", result.jobId())
            .addValue("targetType", result.targetType().name())
            .addValue("targetKey", result.targetKey())
            .addValue("priority", result.priority().rank())
            .addValue("lane", result.lane().name())
            .addValue("startedAt", timestamp(result.startedAt()))
            .addValue("completedAt", timestamp(result.completedAt()))
            .addValue("durationMs", result.durationMs())
            .addValue("success", result.success())
            .addValue("failureKind", result.failureKind() == null ? null : result.failureKind().name())
            .addValue("errorMessage", result.errorMessage())
            .addValue("retryCount", result.retryCount())
            .addValue("coursesFetched", result.coursesFetched())
            .addValue("coursesChanged", result.coursesChanged())
            .addValue("coursesUnchanged", result.coursesUnchanged())
            .addValue("auditsGenerated", result.auditsGenerated());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_results (
                    job_id, target_type, target_key, priority, lane, started_at, completed_at, duration_ms,
                    success, failure_kind, error_message, retry_count, courses_fetched, courses_changed,
                    courses_unchanged, audits_generated
                )
                VALUES (
                    :jobId, :targetType, :targetKey, :priority, :lane, :startedAt, :completedAt, :durationMs,
                    :success, :failureKind, :errorMessage, :retryCount, :coursesFetched, :coursesChanged,
                    :coursesUnchanged, :auditsGenerated
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return new ScrapeResult(
            key == null ? null : key.longValue(),
            result.jobId(),
            result.targetType(),
            result.targetKey(),
            result.priority(),
            result.lane(),
            result.startedAt(),
            result.completedAt(),
            result.durationMs(),
            result.success(),
            result.failureKind(),
            result.errorMessage(),
            result.retryCount(),
            result.coursesFetched(),
            result.coursesChanged(),
            result.coursesUnchanged(),
            result.auditsGenerated()
        );
    }

    public List<ScrapeResult> findRecent(String targetKey, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("targetKey", targetKey)
            .addValue("limit", Math.max(1, limit));
        String where = targetKey == null ? "" : "WHERE target_key = :targetKey\n";
        return jdbc.query(
            "SELECT * FROM scrape_results\n" + where + """
                ORDER BY completed_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            RESULT_MAPPER
        );
    }

    public List<ScrapeResult> findByJob(long jobId) {
        return jdbc.query(
            "SELECT * FROM scrape_results WHERE job_id = :jobId ORDER BY id",
            new MapSqlParameterSource("jobId", jobId),
            RESULT_MAPPER
        );
    }

    public ScraperStatsResponse stats(Instant since, int hours) {
        MapSqlParameterSource params = new MapSqlParameterSource("since", timestamp(since));
        Map<String, Object> row = jdbc.queryForMap(
            """
                SELECT COUNT(*) AS total_runs,
                       COALESCE(SUM(CASE WHEN success THEN 1 ELSE 0 END), 0) AS successful_runs,
                       COALESCE(SUM(CASE WHEN success THEN 0 ELSE 1 END), 0) AS failed_runs,
                       AVG(CAST(duration_ms AS DOUBLE PRECISION)) AS avg_duration_ms,
                       COALESCE(SUM(courses_fetched), 0) AS courses_fetched,
                       COALESCE(SUM(courses_changed), 0) AS courses_changed,
                       COALESCE(SUM(audits_generated), 0) AS audits_generated
                FROM scrape_results
                WHERE completed_at >= :since
                """,
            params
        );
        Map<String, Long> failuresByKind = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT failure_kind, COUNT(*) AS failures
                FROM scrape_results
                WHERE completed_at >= :since
                  AND success = FALSE
                  AND failure_kind IS NOT NULL
                GROUP BY failure_kind
                ORDER BY failure_kind
                """,
            params,
            rs -> {
                failuresByKind.put(rs.getString("failure_kind"), rs.getLong("failures"));
            }
        );
        long total = longValue(row.get("total_runs"));
        long successes = longValue(row.get("successful_runs"));
        Object avg = row.get("avg_duration_ms");
        return new ScraperStatsResponse(
            hours,
            total,
            successes,
            longValue(row.get("failed_runs")),
            total == 0 ? 0.0 : (double) successes / total,
            avg == null ? null : ((Number) avg).doubleValue(),
            longValue(row.get("courses_fetched")),
            longValue(row.get("courses_changed")),
            longValue(row.get("audits_generated")),
            failuresByKind
        );
    }

    private static long longValue(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
