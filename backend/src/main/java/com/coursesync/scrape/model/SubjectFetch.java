package com.coursesync.scrape.model;

import java.util.List;

/**
 * Everything fetched for one subject in one run, before it is diffed against the mirror.
 */
public record SubjectFetch(String subject, String termCode, List<CourseSnapshot> courses) {
    public SubjectFetch {
        courses = courses == null ? List.of() : List.copyOf(courses);
    }
}
