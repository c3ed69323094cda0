package com.coursesync.scrape.model;

import java.time.Instant;

public record QueueErrorSample(
    long jobId, String subject, String lastError, Instant finishedAt, int retryCount) {}
