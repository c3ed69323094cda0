package com.coursesync.scrape.model;

public enum RequestLane {
    FOREGROUND,
    BACKGROUND
}
