package com.coursesync.scrape.diff;

import com.coursesync.scrape.model.AuditEntry;
import com.coursesync.scrape.model.CourseSnapshot;
import com.coursesync.scrape.model.MeetingTime;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CourseDiffEngineTest {
    private static final Instant AT = Instant.parse("2026-03-02T12:00:00Z");
    private static final MeetingTime MWF = new MeetingTime("1000", "1050", "MWF", "NPB", "1.120", null, null, "MC");
    private static final MeetingTime TR = new MeetingTime("1300", "1415", "TR", "NPB", "1.120", null, null, "MC");

    private final CourseDiffEngine engine = new CourseDiffEngine(new ObjectMapper());

    @Test
    void enrollmentChangeProducesOneAuditWithBothValues() {
        CourseSnapshot before = course("10001", 40, "Ortiz, Sam", List.of(MWF), true);
        CourseSnapshot after = course("10001", 42, "Ortiz, Sam", List.of(MWF), true);

        List<AuditEntry> entries = engine.diff(before, after, AT);

        assertThat(entries).hasSize(1);
        AuditEntry entry = entries.get(0);
        assertThat(entry.fieldChanged()).isEqualTo("enrollment");
        assertThat(entry.oldValue()).isEqualTo("40");
        assertThat(entry.newValue()).isEqualTo("42");
        assertThat(entry.crn()).isEqualTo("10001");
        assertThat(entry.subject()).isEqualTo("CS");
        assertThat(entry.changedAt()).isEqualTo(AT);
    }

    @Test
    void firstSightingProducesNoAudits() {
        assertThat(engine.diff(null, course("10001", 40, null, List.of(), true), AT)).isEmpty();
    }

    @Test
    void instructorAndMeetingTimeChangesAreSerialized() {
        CourseSnapshot before = course("10001", 40, null, List.of(MWF), true);
        CourseSnapshot after = course("10001", 40, "Lee, Ada", List.of(TR), false);

        List<AuditEntry> entries = engine.diff(before, after, AT);

        assertThat(entries).extracting(AuditEntry::fieldChanged)
            .containsExactly("meeting_times", "instructor", "open_section");
        AuditEntry meetings = entries.get(0);
        assertThat(meetings.oldValue()).contains("\"days\":\"MWF\"");
        assertThat(meetings.newValue()).contains("\"days\":\"TR\"");
        assertThat(entries.get(1).oldValue()).isNull();
        assertThat(entries.get(1).newValue()).isEqualTo("Lee, Ada");
        assertThat(entries.get(2).newValue()).isEqualTo("false");
    }

    @Test
    void untrackedFieldsAreIgnored() {
        CourseSnapshot before = course("10001", 40, null, List.of(), true);
        CourseSnapshot after = new CourseSnapshot(
            "202610", "10001", "CS", "1083", "Renamed Title", 40, 45, 0, 10, 99, true, null, List.of()
        );

        assertThat(engine.diff(before, after, AT)).isEmpty();
    }

    @Test
    void subjectDiffCountsChangedAndUnchangedCourses() {
        CourseSnapshot a = course("10001", 40, null, List.of(), true);
        CourseSnapshot b = course("10002", 10, null, List.of(), true);
        CourseSnapshot c = course("10003", 5, null, List.of(), true);
        Map<String, CourseSnapshot> previous = Map.of("10001", a, "10002", b);

        CourseDiffEngine.SubjectDiff diff = engine.diffSubject(
            previous,
            List.of(course("10001", 41, null, List.of(), true), b, c),
            AT
        );

        assertThat(diff.coursesFetched()).isEqualTo(3);
        assertThat(diff.coursesChanged()).isEqualTo(1);
        assertThat(diff.coursesUnchanged()).isEqualTo(2);
        assertThat(diff.entries()).hasSize(1);
    }

    private static CourseSnapshot course(
        String crn,
        int enrollment,
        String instructor,
        List<MeetingTime> meetingTimes,
        boolean open
    ) {
        return new CourseSnapshot(
            "202610", crn, "CS", "1083", "Programming I", enrollment, 45, 0, 10, 45 - enrollment, open, instructor, meetingTimes
        );
    }
}
