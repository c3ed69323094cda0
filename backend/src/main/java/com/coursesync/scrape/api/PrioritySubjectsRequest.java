package com.coursesync.scrape.api;

import java.util.List;

public record PrioritySubjectsRequest(List<String> subjects) {
}
