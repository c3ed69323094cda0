package com.coursesync.scrape.model;

public enum PausedReason {
    ADMIN,
    FAILURES,
    EMPTY_FETCHES;

    /**
     * Automatic pauses are probed again after the pause probe interval; admin pauses never are.
     */
    public boolean isAutomatic() {
        return this != ADMIN;
    }
}
