package com.coursesync.scrape.diff;

import com.coursesync.scrape.model.AuditEntry;
import com.coursesync.scrape.model.CourseSnapshot;
import com.coursesync.scrape.model.MeetingTime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field-level comparison of two snapshots of the same course. Only the fields in {@link TrackedField} are
 * compared; a course without a previous snapshot yields nothing.
 */
@Component
public class CourseDiffEngine {
    private final ObjectMapper objectMapper;

    public CourseDiffEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<AuditEntry> diff(CourseSnapshot previous, CourseSnapshot current, Instant changedAt) {
        List<AuditEntry> entries = new ArrayList<>();
        if (previous == null || current == null) {
            return entries;
        }
        for (TrackedField field : TrackedField.values()) {
            Object before = field.valueOf(previous);
            Object after = field.valueOf(current);
            if (Objects.equals(before, after)) {
                continue;
            }
            entries.add(new AuditEntry(
                null,
                null,
                current.termCode(),
                current.crn(),
                current.subject(),
                current.courseNumber(),
                field.column(),
                serialize(before),
                serialize(after),
                changedAt
            ));
        }
        return entries;
    }

    public SubjectDiff diffSubject(
        Map<String, CourseSnapshot> previousByCrn,
        List<CourseSnapshot> fetched,
        Instant changedAt
    ) {
        List<AuditEntry> entries = new ArrayList<>();
        int changed = 0;
        for (CourseSnapshot course : fetched) {
            List<AuditEntry> courseEntries = diff(previousByCrn.get(course.crn()), course, changedAt);
            if (!courseEntries.isEmpty()) {
                changed++;
                entries.addAll(courseEntries);
            }
        }
        return new SubjectDiff(fetched.size(), changed, fetched.size() - changed, entries);
    }

    String serialize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list && (list.isEmpty() || list.get(0) instanceof MeetingTime)) {
            try {
                return objectMapper.writeValueAsString(list);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Unable to serialize meeting times", e);
            }
        }
        return String.valueOf(value);
    }

    public record SubjectDiff(int coursesFetched, int coursesChanged, int coursesUnchanged, List<AuditEntry> entries) {
        public SubjectDiff {
            entries = List.copyOf(entries);
        }
    }
}
