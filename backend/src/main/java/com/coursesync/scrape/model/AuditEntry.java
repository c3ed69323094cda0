package com.coursesync.scrape.model;

import java.time.Instant;

public record AuditEntry(
    Long id,
    Long jobId,
    String termCode,
    String crn,
    String subject,
    String courseNumber,
    String fieldChanged,
    String oldValue,
    String newValue,
    Instant changedAt
) {
    public AuditEntry withJobId(Long newJobId) {
        return new AuditEntry(id, newJobId, termCode, crn, subject, courseNumber, fieldChanged, oldValue, newValue, changedAt);
    }
}
