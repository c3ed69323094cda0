package com.coursesync.scrape.model;

public record ScrapeOutcome(ScrapeResult result, JobStatus jobStatus) {
}
