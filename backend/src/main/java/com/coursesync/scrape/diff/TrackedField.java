package com.coursesync.scrape.diff;

import com.coursesync.scrape.model.CourseSnapshot;

import java.util.function.Function;

public enum TrackedField {
    ENROLLMENT("enrollment", CourseSnapshot::enrollment),
    MAX_ENROLLMENT("max_enrollment", CourseSnapshot::maxEnrollment),
    WAIT_COUNT("wait_count", CourseSnapshot::waitCount),
    WAIT_CAPACITY("wait_capacity", CourseSnapshot::waitCapacity),
    MEETING_TIMES("meeting_times", CourseSnapshot::meetingTimes),
    INSTRUCTOR("instructor", CourseSnapshot::instructor),
    OPEN_SECTION("open_section", CourseSnapshot::openSection);

    private final String column;
    private final Function<CourseSnapshot, Object> accessor;

    TrackedField(String column, Function<CourseSnapshot, Object> accessor) {
        this.column = column;
        this.accessor = accessor;
    }

    public String column() {
        return column;
    }

    Object valueOf(CourseSnapshot snapshot) {
        return accessor.apply(snapshot);
    }
}
