package com.coursesync.scrape.model;

import java.util.List;

public record ScraperSettingsView(
    List<String> prioritySubjects,
    int minIntervalMinutes,
    int maxIntervalHours,
    int minSpacingMinutes
) {
}
