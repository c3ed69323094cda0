package com.coursesync.scrape.model;

import java.time.Instant;

public record TickSummary(
    Instant tickedAt,
    String termCode,
    boolean referenceDataRefreshed,
    boolean catalogRefreshed,
    boolean ratingDataRefreshed,
    int subjectsEvaluated,
    int stateTransitions,
    int jobsEnqueued
) {
}
