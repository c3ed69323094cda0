package com.coursesync.scrape.model;

public enum TargetType {
    SUBJECT
}
