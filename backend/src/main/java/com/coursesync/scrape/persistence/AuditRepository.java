package com.coursesync.scrape.persistence;

import com.coursesync.scrape.model.AuditEntry;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.coursesync.scrape.persistence.JdbcSupport.instant;
import static com.coursesync.scrape.persistence.JdbcSupport.timestamp;

@Repository
public class AuditRepository {
    private static final RowMapper<AuditEntry> AUDIT_MAPPER = (rs, rowNum) -> {
        long jobId = rs.getLong("job_id");
        return new AuditEntry(
            rs.getLong("id"),
            rs.wasNull() ? null : jobId,
            rs.getString("term_code"),
            rs.getString("crn"),
            rs.getString("subject"),
            rs.getString("course_number"),
            rs.getString("field_changed"),
            rs.getString("old_value"),
            rs.getString("new_value"),
            instant(rs, "changed_at")
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public AuditRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public int insertAll(List<AuditEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return 0;
        }
        SqlParameterSource[] batch = entries.stream()
            .map(entry -> new MapSqlParameterSource()
                .addValue("jobId", entry.jobId())
                .addValue("termCode", entry.termCode())
                .addValue("crn", entry.crn())
                .addValue("subject", entry.subject())
                .addValue("courseNumber", entry.courseNumber() == null ? "" : entry.courseNumber())
                .addValue("fieldChanged", entry.fieldChanged())
                .addValue("oldValue", entry.oldValue())
                .addValue("newValue", entry.newValue())
                .addValue("changedAt", timestamp(entry.changedAt())))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO course_audits (
                    job_id, term_code, crn, subject, course_number, field_changed, old_value, new_value, changed_at
                )
                VALUES (
                    :jobId, :termCode, :crn, :subject, :courseNumber, :fieldChanged, :oldValue, :newValue, :changedAt
                )
                """,
            batch
        );
        return entries.size();
    }

    public List<AuditEntry> findRecent(String subject, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("subject", subject)
            .addValue("limit", Math.max(1, limit));
        String where = subject == null ? "" : "WHERE subject = :subject\n";
        return jdbc.query(
            "SELECT * FROM course_audits\n" + where + """
                ORDER BY changed_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            AUDIT_MAPPER
        );
    }

    public List<AuditEntry> findByJob(long jobId) {
        return jdbc.query(
            "SELECT * FROM course_audits WHERE job_id = :jobId ORDER BY id",
            new MapSqlParameterSource("jobId", jobId),
            AUDIT_MAPPER
        );
    }
}
