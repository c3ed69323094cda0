package com.coursesync.scrape.model;

public enum UpstreamEndpoint {
    SESSION_SETUP("session"),
    TERMS("terms"),
    SUBJECTS("subjects"),
    CAMPUSES("campuses"),
    INSTRUCTIONAL_METHODS("instructional-methods"),
    SELECT_TERM("select-term"),
    RESET_FORM("reset-form"),
    SEARCH("search"),
    MEETING_TIMES("meeting-times");

    private final String configKey;

    UpstreamEndpoint(String configKey) {
        this.configKey = configKey;
    }

    public String configKey() {
        return configKey;
    }
}
