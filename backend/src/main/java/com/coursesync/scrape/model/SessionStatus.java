package com.coursesync.scrape.model;

import java.time.Instant;

public record SessionStatus(
    boolean present,
    boolean valid,
    Instant createdAt,
    Instant lastActivityAt,
    Instant expiresAt,
    String selectedTerm,
    long rotations
) {
}
