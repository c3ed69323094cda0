package com.coursesync.scrape.model;

/**
 * Lifecycle of a queued scrape job. An expired LOCKED job is claimable again as if it were PENDING.
 */
public enum JobStatus {
    PENDING,
    LOCKED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isActive() {
        return this == PENDING || this == LOCKED;
    }

    public boolean canTransitionTo(JobStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == LOCKED;
            case LOCKED -> next == COMPLETED || next == PENDING || next == FAILED || next == LOCKED;
            case COMPLETED, FAILED -> false;
        };
    }
}
