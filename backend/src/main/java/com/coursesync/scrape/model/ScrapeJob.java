package com.coursesync.scrape.model;

import java.time.Duration;
import java.time.Instant;

public record ScrapeJob(
    long id,
    TargetType targetType,
    String targetKey,
    ScrapePriority priority,
    JobStatus status,
    Instant executeAt,
    Instant createdAt,
    Instant lockedAt,
    String lockedBy,
    int retryCount,
    int maxRetries,
    String lastError,
    Instant finishedAt
) {
    public JobOrderKey orderKey() {
        return new JobOrderKey(priority.rank(), executeAt, id);
    }

    public boolean isLockExpired(Instant now, Duration lockExpiry) {
        return lockedAt == null || lockedAt.isBefore(now.minus(lockExpiry));
    }
}
