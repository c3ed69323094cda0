package com.coursesync.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;

@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class ScrapeTooSoonException extends RuntimeException {
    private final Instant retryAfter;

    public ScrapeTooSoonException(String subject, Instant retryAfter) {
        super("Subject " + subject + " was scraped recently; retry after " + retryAfter);
        this.retryAfter = retryAfter;
    }

    public Instant getRetryAfter() {
        return retryAfter;
    }
}
