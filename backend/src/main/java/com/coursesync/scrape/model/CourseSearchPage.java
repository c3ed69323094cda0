package com.coursesync.scrape.model;

import java.util.List;

public record CourseSearchPage(int totalCount, List<CourseSnapshot> courses) {
}
