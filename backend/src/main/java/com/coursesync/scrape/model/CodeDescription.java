package com.coursesync.scrape.model;

public record CodeDescription(String code, String description) {
    public boolean isViewOnly() {
        return description != null && description.contains("(View Only)");
    }
}
