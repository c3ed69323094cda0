package com.coursesync.scrape.upstream;

import com.coursesync.scrape.model.FailureKind;

public class UpstreamException extends RuntimeException {
    private final FailureKind kind;
    private final int statusCode;

    public UpstreamException(FailureKind kind, String message) {
        this(kind, message, 0, null);
    }

    public UpstreamException(FailureKind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public FailureKind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }
}
