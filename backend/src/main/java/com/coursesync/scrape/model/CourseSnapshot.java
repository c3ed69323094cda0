package com.coursesync.scrape.model;

import java.util.List;

public record CourseSnapshot(
    String termCode,
    String crn,
    String subject,
    String courseNumber,
    String title,
    int enrollment,
    int maxEnrollment,
    int waitCount,
    int waitCapacity,
    int seatsAvailable,
    boolean openSection,
    String instructor,
    List<MeetingTime> meetingTimes
) {
    public CourseSnapshot {
        meetingTimes = meetingTimes == null ? List.of() : List.copyOf(meetingTimes);
    }

    public CourseSnapshot withMeetingTimes(List<MeetingTime> times) {
        return new CourseSnapshot(
            termCode,
            crn,
            subject,
            courseNumber,
            title,
            enrollment,
            maxEnrollment,
            waitCount,
            waitCapacity,
            seatsAvailable,
            openSection,
            instructor,
            times
        );
    }
}
