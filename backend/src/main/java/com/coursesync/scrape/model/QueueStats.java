package com.coursesync.scrape.model;

import java.time.Instant;
import java.util.List;

public record QueueStats(
    long pendingCount,
    long dueCount,
    long lockedCount,
    long expiredLockCount,
    long completedCount,
    long failedCount,
    Instant nextDueAt,
    List<QueueErrorSample> lastErrors
) {
}
