package com.coursesync.scrape.model;

public record QueueStatusResponse(
    boolean workersRunning,
    int workerCount,
    boolean schedulerRunning,
    QueueStats queueStats
) {
}
