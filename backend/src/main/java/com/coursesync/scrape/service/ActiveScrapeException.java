package com.coursesync.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveScrapeException extends RuntimeException {
    private final Long activeJobId;

    public ActiveScrapeException(String message, Long activeJobId) {
        super(message);
        this.activeJobId = activeJobId;
    }

    public Long getActiveJobId() {
        return activeJobId;
    }
}
