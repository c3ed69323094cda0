package com.coursesync.scrape.persistence;

import com.coursesync.scrape.model.CourseSnapshot;
import com.coursesync.scrape.model.MeetingTime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.coursesync.scrape.persistence.JdbcSupport.timestamp;

@Repository
public class CourseRepository {
    private static final Logger log = LoggerFactory.getLogger(CourseRepository.class);
    private static final TypeReference<List<MeetingTime>> MEETING_TIMES = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<CourseSnapshot> courseMapper;
    private final boolean postgres;

    public CourseRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
        this.courseMapper = (rs, rowNum) -> new CourseSnapshot(
            rs.getString("term_code"),
            rs.getString("crn"),
            rs.getString("subject"),
            rs.getString("course_number"),
            rs.getString("title"),
            rs.getInt("enrollment"),
            rs.getInt("max_enrollment"),
            rs.getInt("wait_count"),
            rs.getInt("wait_capacity"),
            rs.getInt("seats_available"),
            rs.getBoolean("open_section"),
            rs.getString("instructor"),
            readMeetingTimes(rs.getString("meeting_times"))
        );
    }

    public Map<String, CourseSnapshot> findBySubject(String termCode, String subject) {
        List<CourseSnapshot> rows = jdbc.query(
            """
                SELECT term_code, crn, subject, course_number, title, enrollment, max_enrollment, wait_count,
                       wait_capacity, seats_available, open_section, instructor, meeting_times
                FROM courses
                WHERE term_code = :termCode
                  AND subject = :subject
                ORDER BY crn
                """,
            new MapSqlParameterSource()
                .addValue("termCode", termCode)
                .addValue("subject", subject),
            courseMapper
        );
        Map<String, CourseSnapshot> byCrn = new LinkedHashMap<>();
        for (CourseSnapshot row : rows) {
            byCrn.put(row.crn(), row);
        }
        return byCrn;
    }

    public long countBySubject(String termCode, String subject) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM courses WHERE term_code = :termCode AND subject = :subject",
            new MapSqlParameterSource()
                .addValue("termCode", termCode)
                .addValue("subject", subject),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public void upsert(CourseSnapshot course, Instant scrapedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("termCode", course.termCode())
            .addValue("crn", course.crn())
            .addValue("subject", course.subject())
            .addValue("courseNumber", course.courseNumber() == null ? "" : course.courseNumber())
            .addValue("title", course.title())
            .addValue("enrollment", course.enrollment())
            .addValue("maxEnrollment", course.maxEnrollment())
            .addValue("waitCount", course.waitCount())
            .addValue("waitCapacity", course.waitCapacity())
            .addValue("seatsAvailable", course.seatsAvailable())
            .addValue("openSection", course.openSection())
            .addValue("instructor", course.instructor())
            .addValue("meetingTimes", writeMeetingTimes(course.meetingTimes()))
            .addValue("scrapedAt", timestamp(scrapedAt));

        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO courses (
                        term_code, crn, subject, course_number, title, enrollment, max_enrollment, wait_count,
                        wait_capacity, seats_available, open_section, instructor, meeting_times, last_scraped_at
                    )
                    VALUES (
                        :termCode, :crn, :subject, :courseNumber, :title, :enrollment, :maxEnrollment, :waitCount,
                        :waitCapacity, :seatsAvailable, :openSection, :instructor, :meetingTimes, :scrapedAt
                    )
                    ON CONFLICT (term_code, crn)
                    DO UPDATE SET
                        subject = EXCLUDED.subject,
                        course_number = EXCLUDED.course_number,
                        title = EXCLUDED.title,
                        enrollment = EXCLUDED.enrollment,
                        max_enrollment = EXCLUDED.max_enrollment,
                        wait_count = EXCLUDED.wait_count,
                        wait_capacity = EXCLUDED.wait_capacity,
                        seats_available = EXCLUDED.seats_available,
                        open_section = EXCLUDED.open_section,
                        instructor = EXCLUDED.instructor,
                        meeting_times = EXCLUDED.meeting_times,
                        last_scraped_at = EXCLUDED.last_scraped_at
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO courses (
                    term_code, crn, subject, course_number, title, enrollment, max_enrollment, wait_count,
                    wait_capacity, seats_available, open_section, instructor, meeting_times, last_scraped_at
                )
                KEY(term_code, crn)
                VALUES (
                    :termCode, :crn, :subject, :courseNumber, :title, :enrollment, :maxEnrollment, :waitCount,
                    :waitCapacity, :seatsAvailable, :openSection, :instructor, :meetingTimes, :scrapedAt
                )
                """,
            params
        );
    }

    public String writeMeetingTimes(List<MeetingTime> meetingTimes) {
        try {
            return objectMapper.writeValueAsString(meetingTimes == null ? List.of() : meetingTimes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize meeting times", e);
        }
    }

    private List<MeetingTime> readMeetingTimes(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, MEETING_TIMES);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable meeting_times value: {}", e.getOriginalMessage());
            return List.of();
        }
    }
}
