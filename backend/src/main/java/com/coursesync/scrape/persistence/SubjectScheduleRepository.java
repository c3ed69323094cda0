package com.coursesync.scrape.persistence;

import com.coursesync.scrape.model.PausedReason;
import com.coursesync.scrape.model.ScheduleState;
import com.coursesync.scrape.model.SubjectSchedule;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.coursesync.scrape.persistence.JdbcSupport.instant;
import static com.coursesync.scrape.persistence.JdbcSupport.timestamp;

@Repository
public class SubjectScheduleRepository {
    private static final String COLUMNS = """
        subject, term_code, course_count, current_interval_seconds, last_scraped_at, last_attempt_at,
        avg_change_ratio, consecutive_zero_changes, consecutive_empty_fetches, consecutive_failures,
        recent_runs, recent_failures, schedule_state, paused_reason, next_eligible_at, updated_at
        """;

    private static final RowMapper<SubjectSchedule> SCHEDULE_MAPPER = (rs, rowNum) -> {
        String pausedReason = rs.getString("paused_reason");
        return new SubjectSchedule(
            rs.getString("subject"),
            rs.getString("term_code"),
            rs.getInt("course_count"),
            Duration.ofSeconds(rs.getLong("current_interval_seconds")),
            instant(rs, "last_scraped_at"),
            instant(rs, "last_attempt_at"),
            rs.getDouble("avg_change_ratio"),
            rs.getInt("consecutive_zero_changes"),
            rs.getInt("consecutive_empty_fetches"),
            rs.getInt("consecutive_failures"),
            rs.getInt("recent_runs"),
            rs.getInt("recent_failures"),
            ScheduleState.valueOf(rs.getString("schedule_state")),
            pausedReason == null ? null : PausedReason.valueOf(pausedReason),
            instant(rs, "next_eligible_at"),
            instant(rs, "updated_at")
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public SubjectScheduleRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<SubjectSchedule> findAll() {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM subject_schedules ORDER BY subject",
            new MapSqlParameterSource(),
            SCHEDULE_MAPPER
        );
    }

    public Optional<SubjectSchedule> find(String subject) {
        List<SubjectSchedule> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM subject_schedules WHERE subject = :subject",
            new MapSqlParameterSource("subject", subject),
            SCHEDULE_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Inserts a schedule for a newly seen subject; an existing row is left untouched.
     *
     * @return true when the row was created
     */
    public boolean insertIfAbsent(SubjectSchedule schedule) {
        if (find(schedule.subject()).isPresent()) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO subject_schedules (
                        subject, term_code, course_count, current_interval_seconds, last_scraped_at, last_attempt_at,
                        avg_change_ratio, consecutive_zero_changes, consecutive_empty_fetches, consecutive_failures,
                        recent_runs, recent_failures, schedule_state, paused_reason, next_eligible_at, updated_at
                    )
                    VALUES (
                        :subject, :termCode, :courseCount, :intervalSeconds, :lastScrapedAt, :lastAttemptAt,
                        :avgChangeRatio, :zeroChanges, :emptyFetches, :failures,
                        :recentRuns, :recentFailures, :state, :pausedReason, :nextEligibleAt, :updatedAt
                    )
                    """,
                params(schedule)
            );
            return true;
        } catch (DataIntegrityViolationException ignored) {
            return false;
        }
    }

    public void save(SubjectSchedule schedule) {
        MapSqlParameterSource params = params(schedule);
        int updated = jdbc.update(
            """
                UPDATE subject_schedules
                SET term_code = :termCode,
                    course_count = :courseCount,
                    current_interval_seconds = :intervalSeconds,
                    last_scraped_at = :lastScrapedAt,
                    last_attempt_at = :lastAttemptAt,
                    avg_change_ratio = :avgChangeRatio,
                    consecutive_zero_changes = :zeroChanges,
                    consecutive_empty_fetches = :emptyFetches,
                    consecutive_failures = :failures,
                    recent_runs = :recentRuns,
                    recent_failures = :recentFailures,
                    schedule_state = :state,
                    paused_reason = :pausedReason,
                    next_eligible_at = :nextEligibleAt,
                    updated_at = :updatedAt
                WHERE subject = :subject
                """,
            params
        );
        if (updated == 0 && !insertIfAbsent(schedule)) {
            save(schedule);
        }
    }

    private MapSqlParameterSource params(SubjectSchedule schedule) {
        return new MapSqlParameterSource()
            .addValue("subject", schedule.subject())
            .addValue("termCode", schedule.termCode())
            .addValue("courseCount", schedule.courseCount())
            .addValue("intervalSeconds", schedule.currentInterval().getSeconds())
            .addValue("lastScrapedAt", timestamp(schedule.lastScrapedAt()))
            .addValue("lastAttemptAt", timestamp(schedule.lastAttemptAt()))
            .addValue("avgChangeRatio", schedule.avgChangeRatio())
            .addValue("zeroChanges", schedule.consecutiveZeroChanges())
            .addValue("emptyFetches", schedule.consecutiveEmptyFetches())
            .addValue("failures", schedule.consecutiveFailures())
            .addValue("recentRuns", schedule.recentRuns())
            .addValue("recentFailures", schedule.recentFailures())
            .addValue("state", schedule.state().name())
            .addValue("pausedReason", schedule.pausedReason() == null ? null : schedule.pausedReason().name())
            .addValue("nextEligibleAt", timestamp(schedule.nextEligibleAt()))
            .addValue("updatedAt", timestamp(schedule.updatedAt()));
    }
}
