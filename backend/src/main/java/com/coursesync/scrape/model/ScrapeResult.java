package com.coursesync.scrape.model;

import java.time.Instant;

public record ScrapeResult(
    Long id,
    Long jobId,
    TargetType targetType,
    String targetKey,
    ScrapePriority priority,
    RequestLane lane,
    Instant startedAt,
    Instant completedAt,
    long durationMs,
    boolean success,
    FailureKind failureKind,
    String errorMessage,
    int retryCount,
    int coursesFetched,
    int coursesChanged,
    int coursesUnchanged,
    int auditsGenerated
) {
}
