package com.coursesync.scrape.persistence;

import com.coursesync.scrape.model.JobStatus;
import com.coursesync.scrape.model.QueueErrorSample;
import com.coursesync.scrape.model.QueueStats;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapePriority;
import com.coursesync.scrape.model.TargetType;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.coursesync.scrape.persistence.JdbcSupport.instant;
import static com.coursesync.scrape.persistence.JdbcSupport.timestamp;

/**
 * Durable job queue. Claiming is a single conditional write so that exactly one worker wins a job; every
 * later transition is guarded by {@code locked_by} so a worker whose lock expired cannot overwrite the new
 * owner's progress.
 */
@Repository
public class ScrapeJobRepository {
    private static final int CLAIM_CANDIDATES = 5;
    private static final int CLAIM_ROUNDS = 3;
    private static final String JOB_COLUMNS = """
        id, target_type, target_key, priority, status, execute_at, created_at, locked_at, locked_by,
        retry_count, max_retries, last_error, finished_at
        """;
    private static final String CLAIMABLE = """
        (status = 'PENDING' OR (status = 'LOCKED' AND (locked_at IS NULL OR locked_at < :expiredBefore)))
        """;

    private static final RowMapper<ScrapeJob> JOB_MAPPER = (rs, rowNum) -> new ScrapeJob(
        rs.getLong("id"),
        TargetType.valueOf(rs.getString("target_type")),
        rs.getString("target_key"),
        ScrapePriority.fromRank(rs.getInt("priority")),
        JobStatus.valueOf(rs.getString("status")),
        instant(rs, "execute_at"),
        instant(rs, "created_at"),
        instant(rs, "locked_at"),
        rs.getString("locked_by"),
        rs.getInt("retry_count"),
        rs.getInt("max_retries"),
        rs.getString("last_error"),
        instant(rs, "finished_at")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ScrapeJobRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    public boolean isStoreReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    /**
     * Inserts a pending job unless the target already has a PENDING or LOCKED one.
     *
     * @return the new job id, or empty when an active job for the target already exists
     */
    public Optional<Long> enqueue(
        TargetType targetType,
        String targetKey,
        ScrapePriority priority,
        Instant executeAt,
        int maxRetries,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("targetType", targetType.name())
            .addValue("targetKey", targetKey)
            .addValue("priority", priority.rank())
            .addValue("executeAt", timestamp(executeAt))
            .addValue("maxRetries", Math.max(0, maxRetries))
            .addValue("now", timestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        int inserted;
        if (postgres) {
            // Backed by the partial unique index on (target_type, target_key) for active jobs.
            inserted = jdbc.update(
                """
                    INSERT INTO scrape_jobs (
                        target_type, target_key, priority, status, execute_at, created_at, retry_count, max_retries
                    )
                    VALUES (
                        :targetType, :targetKey, :priority, 'PENDING', :executeAt, :now, 0, :maxRetries
                    )
                    ON CONFLICT (target_type, target_key) WHERE status IN ('PENDING', 'LOCKED')
                    DO NOTHING
                    """,
                params,
                keyHolder,
                new String[] {"id"}
            );
        } else {
            inserted = jdbc.update(
                """
                    INSERT INTO scrape_jobs (
                        target_type, target_key, priority, status, execute_at, created_at, retry_count, max_retries
                    )
                    SELECT CAST(:targetType AS VARCHAR(32)),
                           CAST(:targetKey AS VARCHAR(64)),
                           CAST(:priority AS SMALLINT),
                           'PENDING',
                           CAST(:executeAt AS TIMESTAMP WITH TIME ZONE),
                           CAST(:now AS TIMESTAMP WITH TIME ZONE),
                           0,
                           CAST(:maxRetries AS INTEGER)
                    WHERE NOT EXISTS (
                        SELECT 1
                        FROM scrape_jobs
                        WHERE target_type = :targetType
                          AND target_key = :targetKey
                          AND status IN ('PENDING', 'LOCKED')
                    )
                    """,
                params,
                keyHolder,
                new String[] {"id"}
            );
        }
        if (inserted == 0) {
            return Optional.empty();
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Insert into scrape_jobs returned no id");
        }
        return Optional.of(key.longValue());
    }

    public Optional<ScrapeJob> findById(long id) {
        List<ScrapeJob> jobs = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM scrape_jobs WHERE id = :id",
            new MapSqlParameterSource("id", id),
            JOB_MAPPER
        );
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    public Optional<ScrapeJob> findActiveForTarget(TargetType targetType, String targetKey) {
        List<ScrapeJob> jobs = jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM scrape_jobs
                WHERE target_type = :targetType
                  AND target_key = :targetKey
                  AND status IN ('PENDING', 'LOCKED')
                ORDER BY priority DESC, execute_at ASC, id ASC
                """,
            new MapSqlParameterSource()
                .addValue("targetType", targetType.name())
                .addValue("targetKey", targetKey),
            JOB_MAPPER
        );
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    public Set<String> findActiveTargetKeys(TargetType targetType) {
        List<String> keys = jdbc.queryForList(
            """
                SELECT DISTINCT target_key
                FROM scrape_jobs
                WHERE target_type = :targetType
                  AND status IN ('PENDING', 'LOCKED')
                """,
            new MapSqlParameterSource("targetType", targetType.name()),
            String.class
        );
        return new HashSet<>(keys);
    }

    /**
     * Raises the priority of a pending job and pulls its execute_at forward; never lowers either.
     */
    public boolean promote(long id, ScrapePriority priority, Instant executeAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("priority", priority.rank())
            .addValue("executeAt", timestamp(executeAt));
        int updated = jdbc.update(
            """
                UPDATE scrape_jobs
                SET priority = CASE WHEN priority < :priority THEN :priority ELSE priority END,
                    execute_at = CASE WHEN execute_at > :executeAt THEN :executeAt ELSE execute_at END
                WHERE id = :id
                  AND status = 'PENDING'
                """,
            params
        );
        return updated == 1;
    }

    public Optional<ScrapeJob> claimNext(String owner, Instant now, Duration lockExpiry) {
        MapSqlParameterSource params = claimParams(owner, now, lockExpiry);
        if (postgres) {
            List<ScrapeJob> results = jdbc.query(
                """
                    WITH candidate AS (
                        SELECT id
                        FROM scrape_jobs
                        WHERE execute_at <= :now
                          AND %s
                        ORDER BY priority DESC, execute_at ASC, id ASC
                        LIMIT 1
                        FOR UPDATE SKIP LOCKED
                    )
                    UPDATE scrape_jobs sj
                    SET status = 'LOCKED',
                        locked_at = :now,
                        locked_by = :owner
                    FROM candidate
                    WHERE sj.id = candidate.id
                    RETURNING sj.id, sj.target_type, sj.target_key, sj.priority, sj.status, sj.execute_at,
                              sj.created_at, sj.locked_at, sj.locked_by, sj.retry_count, sj.max_retries,
                              sj.last_error, sj.finished_at
                    """.formatted(CLAIMABLE.strip()),
                params,
                JOB_MAPPER
            );
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        }

        for (int round = 0; round < CLAIM_ROUNDS; round++) {
            List<Long> candidates = jdbc.queryForList(
                """
                    SELECT id
                    FROM scrape_jobs
                    WHERE execute_at <= :now
                      AND %s
                    ORDER BY priority DESC, execute_at ASC, id ASC
                    LIMIT %d
                    """.formatted(CLAIMABLE.strip(), CLAIM_CANDIDATES),
                params,
                Long.class
            );
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            for (Long candidate : candidates) {
                if (tryLock(candidate, params, true)) {
                    return findById(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Claims one specific job regardless of its execute_at, as long as nobody holds a live lock on it.
     */
    public Optional<ScrapeJob> claimById(long id, String owner, Instant now, Duration lockExpiry) {
        MapSqlParameterSource params = claimParams(owner, now, lockExpiry);
        return tryLock(id, params, false) ? findById(id) : Optional.empty();
    }

    public boolean complete(long id, String owner, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", normalizeOwner(owner))
            .addValue("now", timestamp(now));
        int updated = jdbc.update(
            """
                UPDATE scrape_jobs
                SET status = 'COMPLETED',
                    locked_at = NULL,
                    locked_by = NULL,
                    last_error = NULL,
                    finished_at = :now
                WHERE id = :id
                  AND status = 'LOCKED'
                  AND locked_by = :owner
                """,
            params
        );
        return updated == 1;
    }

    public boolean scheduleRetry(long id, String owner, Instant nextExecuteAt, String error) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", normalizeOwner(owner))
            .addValue("executeAt", timestamp(nextExecuteAt))
            .addValue("lastError", error);
        int updated = jdbc.update(
            """
                UPDATE scrape_jobs
                SET status = 'PENDING',
                    locked_at = NULL,
                    locked_by = NULL,
                    retry_count = retry_count + 1,
                    execute_at = :executeAt,
                    last_error = :lastError
                WHERE id = :id
                  AND status = 'LOCKED'
                  AND locked_by = :owner
                """,
            params
        );
        return updated == 1;
    }

    public boolean markFailed(long id, String owner, String error, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", normalizeOwner(owner))
            .addValue("lastError", error)
            .addValue("now", timestamp(now));
        int updated = jdbc.update(
            """
                UPDATE scrape_jobs
                SET status = 'FAILED',
                    locked_at = NULL,
                    locked_by = NULL,
                    retry_count = retry_count + 1,
                    last_error = :lastError,
                    finished_at = :now
                WHERE id = :id
                  AND status = 'LOCKED'
                  AND locked_by = :owner
                """,
            params
        );
        return updated == 1;
    }

    /**
     * Hands a job back without counting an attempt (timeouts on shutdown, interactive conflicts).
     */
    public boolean release(long id, String owner, String reason) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", normalizeOwner(owner))
            .addValue("reason", reason);
        int updated = jdbc.update(
            """
                UPDATE scrape_jobs
                SET status = 'PENDING',
                    locked_at = NULL,
                    locked_by = NULL,
                    last_error = COALESCE(:reason, last_error)
                WHERE id = :id
                  AND status = 'LOCKED'
                  AND locked_by = :owner
                """,
            params
        );
        return updated == 1;
    }

    public int releaseAllHeldBy(String ownerPrefix) {
        if (ownerPrefix == null || ownerPrefix.isBlank()) {
            return 0;
        }
        return jdbc.update(
            """
                UPDATE scrape_jobs
                SET status = 'PENDING',
                    locked_at = NULL,
                    locked_by = NULL
                WHERE status = 'LOCKED'
                  AND locked_by LIKE :ownerPattern
                """,
            new MapSqlParameterSource("ownerPattern", escapeLike(ownerPrefix) + "%")
        );
    }

    public List<ScrapeJob> listJobs(JobStatus status, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", status == null ? null : status.name())
            .addValue("limit", Math.max(1, limit));
        String where = status == null ? "" : "WHERE status = :status\n";
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM scrape_jobs\n" + where + """
                ORDER BY CASE WHEN status IN ('PENDING', 'LOCKED') THEN 0 ELSE 1 END,
                         priority DESC,
                         execute_at ASC,
                         id DESC
                LIMIT :limit
                """,
            params,
            JOB_MAPPER
        );
    }

    public QueueStats fetchQueueStats(Instant now, Duration lockExpiry, int errorSampleLimit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", timestamp(now))
            .addValue("expiredBefore", timestamp(now.minus(lockExpiry)))
            .addValue("limit", Math.max(1, errorSampleLimit));

        long pending = count("SELECT COUNT(*) FROM scrape_jobs WHERE status = 'PENDING'", params);
        long due = count(
            "SELECT COUNT(*) FROM scrape_jobs WHERE execute_at <= :now AND " + CLAIMABLE.strip(),
            params
        );
        long locked = count(
            """
                SELECT COUNT(*)
                FROM scrape_jobs
                WHERE status = 'LOCKED'
                  AND locked_at >= :expiredBefore
                """,
            params
        );
        long expired = count(
            """
                SELECT COUNT(*)
                FROM scrape_jobs
                WHERE status = 'LOCKED'
                  AND (locked_at IS NULL OR locked_at < :expiredBefore)
                """,
            params
        );
        long completed = count("SELECT COUNT(*) FROM scrape_jobs WHERE status = 'COMPLETED'", params);
        long failed = count("SELECT COUNT(*) FROM scrape_jobs WHERE status = 'FAILED'", params);
        Timestamp nextDue = jdbc.queryForObject(
            """
                SELECT MIN(execute_at)
                FROM scrape_jobs
                WHERE status = 'PENDING'
                """,
            params,
            Timestamp.class
        );

        List<QueueErrorSample> errors = jdbc.query(
            """
                SELECT id,
                       target_key,
                       last_error,
                       finished_at,
                       retry_count
                FROM scrape_jobs
                WHERE last_error IS NOT NULL
                ORDER BY COALESCE(finished_at, execute_at) DESC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> new QueueErrorSample(
                rs.getLong("id"),
                rs.getString("target_key"),
                rs.getString("last_error"),
                instant(rs, "finished_at"),
                rs.getInt("retry_count")
            )
        );

        return new QueueStats(
            pending,
            due,
            locked,
            expired,
            completed,
            failed,
            nextDue == null ? null : nextDue.toInstant(),
            errors
        );
    }

    private boolean tryLock(long id, MapSqlParameterSource claimParams, boolean requireDue) {
        MapSqlParameterSource params = new MapSqlParameterSource(claimParams.getValues()).addValue("id", id);
        String dueClause = requireDue ? "AND execute_at <= :now\n" : "";
        int updated = jdbc.update(
            """
                UPDATE scrape_jobs
                SET status = 'LOCKED',
                    locked_at = :now,
                    locked_by = :owner
                WHERE id = :id
                """ + dueClause + "AND " + CLAIMABLE.strip(),
            params
        );
        return updated == 1;
    }

    private MapSqlParameterSource claimParams(String owner, Instant now, Duration lockExpiry) {
        return new MapSqlParameterSource()
            .addValue("owner", normalizeOwner(owner))
            .addValue("now", timestamp(now))
            .addValue("expiredBefore", timestamp(now.minus(lockExpiry)));
    }

    /**
     * Lock owners are compared verbatim in every transition, so claims and transitions share this form.
     */
    static String normalizeOwner(String owner) {
        return (owner == null || owner.isBlank()) ? "unknown" : owner.trim();
    }

    private long count(String sql, MapSqlParameterSource params) {
        Long value = jdbc.queryForObject(sql, params, Long.class);
        return value == null ? 0L : value;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
