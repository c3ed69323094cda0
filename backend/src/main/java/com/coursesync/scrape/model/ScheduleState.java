package com.coursesync.scrape.model;

public enum ScheduleState {
    ELIGIBLE,
    COOLDOWN,
    PAUSED,
    READ_ONLY
}
