package com.coursesync.scrape.model;

import java.util.Map;

public record ScraperStatsResponse(
    int hours,
    long totalRuns,
    long successfulRuns,
    long failedRuns,
    double successRate,
    Double avgDurationMs,
    long coursesFetched,
    long coursesChanged,
    long auditsGenerated,
    Map<String, Long> failuresByKind
) {
}
