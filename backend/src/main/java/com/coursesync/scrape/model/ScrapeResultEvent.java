package com.coursesync.scrape.model;

public record ScrapeResultEvent(ScrapeResult result) {
}
