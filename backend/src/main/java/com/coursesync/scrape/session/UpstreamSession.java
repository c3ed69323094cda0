package com.coursesync.scrape.session;

import java.time.Duration;
import java.time.Instant;

public record UpstreamSession(String token, Instant createdAt, Instant lastActivityAt, String selectedTerm) {

    public boolean isValidAt(Instant now, Duration validity) {
        return now.isBefore(expiresAt(validity));
    }

    public Instant expiresAt(Duration validity) {
        return lastActivityAt.plus(validity);
    }

    UpstreamSession touch(Instant now) {
        return new UpstreamSession(token, createdAt, now, selectedTerm);
    }

    UpstreamSession withSelectedTerm(String term) {
        return new UpstreamSession(token, createdAt, lastActivityAt, term);
    }
}
