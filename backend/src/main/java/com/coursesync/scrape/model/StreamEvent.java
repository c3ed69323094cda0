package com.coursesync.scrape.model;

import java.time.Instant;

/**
 * Envelope kept in the replay buffer and pushed to stream subscribers.
 */
public record StreamEvent(long sequence, String type, Instant publishedAt, Object payload) {
}
