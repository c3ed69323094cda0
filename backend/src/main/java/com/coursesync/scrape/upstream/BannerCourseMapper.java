package com.coursesync.scrape.upstream;

import com.coursesync.scrape.model.CourseSnapshot;
import com.coursesync.scrape.model.MeetingTime;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class BannerCourseMapper {
    private static final String[] DAY_FIELDS = {
        "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday"
    };
    private static final String[] DAY_CODES = {"M", "T", "W", "R", "F", "S", "U"};

    public CourseSnapshot toSnapshot(JsonNode node, String fallbackTerm) {
        String crn = text(node, "courseReferenceNumber");
        if (crn == null) {
            throw new IllegalArgumentException("Course record without courseReferenceNumber");
        }
        String term = text(node, "term");
        String subject = text(node, "subject");
        return new CourseSnapshot(
            term == null ? fallbackTerm : term,
            crn,
            subject == null ? null : subject.toUpperCase(Locale.ROOT),
            text(node, "courseNumber"),
            text(node, "courseTitle"),
            node.path("enrollment").asInt(0),
            node.path("maximumEnrollment").asInt(0),
            node.path("waitCount").asInt(0),
            node.path("waitCapacity").asInt(0),
            node.path("seatsAvailable").asInt(0),
            node.path("openSection").asBoolean(false),
            primaryInstructor(node.path("faculty")),
            meetingTimes(node.path("meetingsFaculty"))
        );
    }

    public List<MeetingTime> meetingTimes(JsonNode meetings) {
        List<MeetingTime> times = new ArrayList<>();
        if (meetings == null || !meetings.isArray()) {
            return times;
        }
        for (JsonNode meeting : meetings) {
            JsonNode time = meeting.has("meetingTime") ? meeting.path("meetingTime") : meeting;
            if (time.isMissingNode() || time.isNull()) {
                continue;
            }
            times.add(new MeetingTime(
                text(time, "beginTime"),
                text(time, "endTime"),
                days(time),
                text(time, "building"),
                text(time, "room"),
                text(time, "startDate"),
                text(time, "endDate"),
                text(time, "campus")
            ));
        }
        return times;
    }

    String primaryInstructor(JsonNode faculty) {
        if (faculty == null || !faculty.isArray() || faculty.isEmpty()) {
            return null;
        }
        for (JsonNode member : faculty) {
            if (member.path("primaryIndicator").asBoolean(false)) {
                return text(member, "displayName");
            }
        }
        return text(faculty.get(0), "displayName");
    }

    private static String days(JsonNode time) {
        StringBuilder days = new StringBuilder();
        for (int i = 0; i < DAY_FIELDS.length; i++) {
            if (time.path(DAY_FIELDS[i]).asBoolean(false)) {
                days.append(DAY_CODES[i]);
            }
        }
        return days.toString();
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
