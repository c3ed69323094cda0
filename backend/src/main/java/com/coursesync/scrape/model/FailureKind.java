package com.coursesync.scrape.model;

public enum FailureKind {
    TRANSIENT,
    PERMANENT,
    SESSION_EXPIRED,
    TIMEOUT;

    public boolean isRetryable() {
        return this != PERMANENT;
    }
}
