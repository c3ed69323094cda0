package com.coursesync.scrape.model;

/**
 * Outcome of one staleness evaluation. The schedule may carry a state transition (cooldown expiry,
 * failure-pause probe) that the scheduler persists whether or not a job is enqueued.
 */
public record ScheduleDecision(
    SubjectSchedule schedule,
    boolean transitioned,
    boolean enqueue,
    ScrapePriority priority,
    String reason
) {
    public static ScheduleDecision skip(SubjectSchedule schedule, boolean transitioned, String reason) {
        return new ScheduleDecision(schedule, transitioned, false, null, reason);
    }

    public static ScheduleDecision enqueue(
        SubjectSchedule schedule,
        boolean transitioned,
        ScrapePriority priority,
        String reason
    ) {
        return new ScheduleDecision(schedule, transitioned, true, priority, reason);
    }
}
