package com.coursesync.scrape.model;

public record RateLimitStatus(
    double bucketTokens,
    double bucketCapacity,
    double burstTokens,
    double burstCapacity,
    long foregroundAdmitted,
    long backgroundAdmitted
) {
}
