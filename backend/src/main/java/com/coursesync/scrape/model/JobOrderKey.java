package com.coursesync.scrape.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * Claim order for queued jobs: higher priority first, then earlier execute_at, then lower id.
 */
public record JobOrderKey(int priorityRank, Instant executeAt, long id) implements Comparable<JobOrderKey> {
    private static final Comparator<JobOrderKey> ORDER = Comparator
        .comparingInt(JobOrderKey::priorityRank).reversed()
        .thenComparing(JobOrderKey::executeAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparingLong(JobOrderKey::id);

    @Override
    public int compareTo(JobOrderKey other) {
        return ORDER.compare(this, other);
    }
}
