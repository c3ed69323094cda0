package com.coursesync.scrape.api;

public record IntervalSettingsRequest(
    Integer minIntervalMinutes,
    Integer maxIntervalHours,
    Integer minSpacingMinutes
) {
}
