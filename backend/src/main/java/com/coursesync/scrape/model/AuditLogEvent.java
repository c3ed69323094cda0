package com.coursesync.scrape.model;

import java.util.List;

public record AuditLogEvent(String subject, String termCode, Long jobId, List<AuditEntry> entries) {
    public AuditLogEvent {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
