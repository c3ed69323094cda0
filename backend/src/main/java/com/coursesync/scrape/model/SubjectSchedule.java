package com.coursesync.scrape.model;

import java.time.Duration;
import java.time.Instant;

public record SubjectSchedule(
    String subject,
    String termCode,
    int courseCount,
    Duration currentInterval,
    Instant lastScrapedAt,
    Instant lastAttemptAt,
    double avgChangeRatio,
    int consecutiveZeroChanges,
    int consecutiveEmptyFetches,
    int consecutiveFailures,
    int recentRuns,
    int recentFailures,
    ScheduleState state,
    PausedReason pausedReason,
    Instant nextEligibleAt,
    Instant updatedAt
) {
    public static SubjectSchedule fresh(String subject, String termCode, Duration interval, Instant now) {
        return new SubjectSchedule(
            subject,
            termCode,
            0,
            interval,
            null,
            null,
            0.0,
            0,
            0,
            0,
            0,
            0,
            ScheduleState.ELIGIBLE,
            null,
            now,
            now
        );
    }

    public boolean isPaused() {
        return state == ScheduleState.PAUSED;
    }

    public boolean isAdminPaused() {
        return state == ScheduleState.PAUSED && pausedReason == PausedReason.ADMIN;
    }

    public SubjectSchedule withState(ScheduleState nextState, PausedReason reason, Instant now) {
        return new SubjectSchedule(
            subject,
            termCode,
            courseCount,
            currentInterval,
            lastScrapedAt,
            lastAttemptAt,
            avgChangeRatio,
            consecutiveZeroChanges,
            consecutiveEmptyFetches,
            consecutiveFailures,
            recentRuns,
            recentFailures,
            nextState,
            nextState == ScheduleState.PAUSED ? reason : null,
            nextEligibleAt,
            now
        );
    }

    public SubjectSchedule withTerm(String nextTermCode, Instant now) {
        return new SubjectSchedule(
            subject,
            nextTermCode,
            courseCount,
            currentInterval,
            lastScrapedAt,
            lastAttemptAt,
            avgChangeRatio,
            consecutiveZeroChanges,
            consecutiveEmptyFetches,
            consecutiveFailures,
            recentRuns,
            recentFailures,
            state,
            pausedReason,
            nextEligibleAt,
            now
        );
    }

    public SubjectSchedule withNextEligibleAt(Instant next, Instant now) {
        return new SubjectSchedule(
            subject,
            termCode,
            courseCount,
            currentInterval,
            lastScrapedAt,
            lastAttemptAt,
            avgChangeRatio,
            consecutiveZeroChanges,
            consecutiveEmptyFetches,
            consecutiveFailures,
            recentRuns,
            recentFailures,
            state,
            pausedReason,
            next,
            now
        );
    }

    public SubjectSchedule resumed(Instant now) {
        return new SubjectSchedule(
            subject,
            termCode,
            courseCount,
            currentInterval,
            lastScrapedAt,
            lastAttemptAt,
            avgChangeRatio,
            consecutiveZeroChanges,
            consecutiveEmptyFetches,
            0,
            recentRuns,
            recentFailures,
            ScheduleState.ELIGIBLE,
            null,
            now,
            now
        );
    }
}
