package com.coursesync.scrape.model;

import java.time.Instant;

public record ScrapeJobEvent(
    Type type,
    long jobId,
    String subject,
    ScrapePriority priority,
    String owner,
    String detail,
    Instant occurredAt
) {
    public enum Type {
        ENQUEUED,
        PROMOTED,
        CLAIMED,
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED,
        RELEASED
    }
}
