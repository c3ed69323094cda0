package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.PausedReason;
import com.coursesync.scrape.model.ScheduleDecision;
import com.coursesync.scrape.model.ScheduleState;
import com.coursesync.scrape.model.ScrapePriority;
import com.coursesync.scrape.model.SubjectSchedule;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class StalenessAnalyzer {
    private final ScraperProperties.Scheduler config;
    private final ScraperSettingsService settings;

    public StalenessAnalyzer(ScraperProperties properties, ScraperSettingsService settings) {
        this.config = properties.getScheduler();
        this.settings = settings;
    }

    public ScheduleDecision evaluate(SubjectSchedule schedule, Instant now) {
        SubjectSchedule current = schedule;
        boolean transitioned = false;

        if (current.state() == ScheduleState.PAUSED) {
            PausedReason reason = current.pausedReason();
            if (reason == null || !reason.isAutomatic()) {
                return ScheduleDecision.skip(current, false, "paused by admin");
            }
            Instant probeAt = probeAt(current);
            if (probeAt != null && now.isBefore(probeAt)) {
                return ScheduleDecision.skip(current, false, "paused (" + reason + ") until " + probeAt);
            }
            current = current.withState(ScheduleState.ELIGIBLE, null, now);
            transitioned = true;
        }

        if (current.state() == ScheduleState.COOLDOWN) {
            if (!isDue(current, now)) {
                return ScheduleDecision.skip(current, false, "cooling down");
            }
            current = current.withState(ScheduleState.ELIGIBLE, null, now);
            transitioned = true;
        } else if (!isDue(current, now)) {
            return ScheduleDecision.skip(current, transitioned, "not due");
        }

        Instant lastTouched = lastTouched(current);
        Duration minSpacing = settings.minSpacing();
        if (lastTouched != null && now.isBefore(lastTouched.plus(minSpacing))) {
            return ScheduleDecision.skip(current, transitioned, "scraped within minimum spacing");
        }

        ScrapePriority priority = priorityFor(current, now);
        return ScheduleDecision.enqueue(current, transitioned, priority, "due");
    }

    public ScrapePriority priorityFor(SubjectSchedule schedule, Instant now) {
        if (settings.isPrioritySubject(schedule.subject())) {
            return ScrapePriority.URGENT;
        }
        if (schedule.state() == ScheduleState.READ_ONLY) {
            return ScrapePriority.LOW;
        }
        if (isStale(schedule, now)) {
            return ScrapePriority.HIGH;
        }
        return ScrapePriority.NORMAL;
    }

    boolean isStale(SubjectSchedule schedule, Instant now) {
        if (schedule.lastScrapedAt() == null || schedule.currentInterval() == null) {
            return false;
        }
        Duration age = Duration.between(schedule.lastScrapedAt(), now);
        double threshold = schedule.currentInterval().getSeconds() * config.getStaleFactor();
        return age.getSeconds() >= threshold;
    }

    private boolean isDue(SubjectSchedule schedule, Instant now) {
        return schedule.nextEligibleAt() == null || !now.isBefore(schedule.nextEligibleAt());
    }

    private Instant probeAt(SubjectSchedule schedule) {
        Instant lastTouched = lastTouched(schedule);
        return lastTouched == null ? null : lastTouched.plus(Duration.ofHours(config.getPauseProbeHours()));
    }

    private static Instant lastTouched(SubjectSchedule schedule) {
        Instant attempt = schedule.lastAttemptAt();
        Instant scraped = schedule.lastScrapedAt();
        if (attempt == null) {
            return scraped;
        }
        if (scraped == null) {
            return attempt;
        }
        return attempt.isAfter(scraped) ? attempt : scraped;
    }
}
