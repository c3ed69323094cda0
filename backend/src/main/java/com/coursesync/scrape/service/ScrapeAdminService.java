package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.http.CostWeightedRateLimiter;
import com.coursesync.scrape.model.AuditEntry;
import com.coursesync.scrape.model.JobStatus;
import com.coursesync.scrape.model.PausedReason;
import com.coursesync.scrape.model.QueueStats;
import com.coursesync.scrape.model.QueueStatusResponse;
import com.coursesync.scrape.model.RateLimitStatus;
import com.coursesync.scrape.model.RequestLane;
import com.coursesync.scrape.model.ScheduleState;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapeJobEvent;
import com.coursesync.scrape.model.ScrapeOutcome;
import com.coursesync.scrape.model.ScrapePriority;
import com.coursesync.scrape.model.ScrapeResult;
import com.coursesync.scrape.model.ScraperStatsResponse;
import com.coursesync.scrape.model.SessionStatus;
import com.coursesync.scrape.model.SubjectSchedule;
import com.coursesync.scrape.model.TargetType;
import com.coursesync.scrape.persistence.AuditRepository;
import com.coursesync.scrape.persistence.ScrapeJobRepository;
import com.coursesync.scrape.persistence.ScrapeResultRepository;
import com.coursesync.scrape.persistence.SubjectScheduleRepository;
import com.coursesync.scrape.session.SessionKeeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class ScrapeAdminService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeAdminService.class);
    private static final int ERROR_SAMPLE_LIMIT = 5;
    private static final int MAX_LIMIT = 500;

    private final ScrapeJobRepository jobRepository;
    private final SubjectScheduleRepository scheduleRepository;
    private final ScrapeResultRepository resultRepository;
    private final AuditRepository auditRepository;
    private final ScrapeJobRunner jobRunner;
    private final ScrapeWorkerPool workerPool;
    private final ScrapeScheduler scheduler;
    private final ScraperSettingsService settings;
    private final SessionKeeper sessionKeeper;
    private final CostWeightedRateLimiter rateLimiter;
    private final ScrapeEventPublisher eventPublisher;
    private final ScraperProperties properties;
    private final Clock clock;

    public ScrapeAdminService(
        ScrapeJobRepository jobRepository,
        SubjectScheduleRepository scheduleRepository,
        ScrapeResultRepository resultRepository,
        AuditRepository auditRepository,
        ScrapeJobRunner jobRunner,
        ScrapeWorkerPool workerPool,
        ScrapeScheduler scheduler,
        ScraperSettingsService settings,
        SessionKeeper sessionKeeper,
        CostWeightedRateLimiter rateLimiter,
        ScrapeEventPublisher eventPublisher,
        ScraperProperties properties,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.scheduleRepository = scheduleRepository;
        this.resultRepository = resultRepository;
        this.auditRepository = auditRepository;
        this.jobRunner = jobRunner;
        this.workerPool = workerPool;
        this.scheduler = scheduler;
        this.settings = settings;
        this.sessionKeeper = sessionKeeper;
        this.rateLimiter = rateLimiter;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    public QueueStatusResponse queueStatus() {
        QueueStats stats;
        try {
            stats = jobRepository.fetchQueueStats(clock.instant(), properties.getWorker().lockExpiry(), ERROR_SAMPLE_LIMIT);
        } catch (Exception e) {
            log.warn("Failed to load scrape queue stats", e);
            stats = new QueueStats(0, 0, 0, 0, 0, 0, null, List.of());
        }
        return new QueueStatusResponse(
            workerPool.isRunning(),
            workerPool.getActiveWorkerCount(),
            scheduler.isRunning(),
            stats
        );
    }

    public List<ScrapeJob> jobs(String status, int limit) {
        return jobRepository.listJobs(parseStatus(status), clampLimit(limit));
    }

    public List<ScrapeResult> results(String subject, int limit) {
        return resultRepository.findRecent(normalizeSubject(subject), clampLimit(limit));
    }

    public ScraperStatsResponse stats(int hours) {
        int safeHours = Math.max(1, Math.min(hours, 24 * 30));
        return resultRepository.stats(clock.instant().minus(Duration.ofHours(safeHours)), safeHours);
    }

    public List<SubjectSchedule> subjects() {
        return scheduleRepository.findAll();
    }

    public SubjectSchedule subject(String subject) {
        String code = normalizeSubject(subject);
        return scheduleRepository.find(code).orElseThrow(() -> new SubjectNotFoundException(code));
    }

    public List<AuditEntry> audits(String subject, int limit) {
        return auditRepository.findRecent(normalizeSubject(subject), clampLimit(limit));
    }

    public SubjectSchedule pause(String subject) {
        SubjectSchedule schedule = subject(subject);
        Instant now = clock.instant();
        SubjectSchedule paused = schedule.withState(ScheduleState.PAUSED, PausedReason.ADMIN, now);
        scheduleRepository.save(paused);
        log.info("Subject {} paused by admin", schedule.subject());
        return paused;
    }

    public SubjectSchedule resume(String subject) {
        SubjectSchedule schedule = subject(subject);
        if (!schedule.isPaused()) {
            return schedule;
        }
        SubjectSchedule resumed = schedule.resumed(clock.instant());
        scheduleRepository.save(resumed);
        log.info("Subject {} resumed (was paused for {})", schedule.subject(), schedule.pausedReason());
        return resumed;
    }

    /**
     * Scrapes a subject right now on the foreground lane. Reuses the subject's queued job when there is one so
     * the queue never holds two active jobs for the same subject.
     */
    public ScrapeOutcome scrapeNow(String subject) {
        SubjectSchedule schedule = subject(subject);
        Instant now = clock.instant();
        Instant lastScraped = schedule.lastScrapedAt();
        if (lastScraped != null) {
            Instant allowedAt = lastScraped.plus(settings.minSpacing());
            if (now.isBefore(allowedAt)) {
                throw new ScrapeTooSoonException(schedule.subject(), allowedAt);
            }
        }

        long jobId;
        Optional<ScrapeJob> active = jobRepository.findActiveForTarget(TargetType.SUBJECT, schedule.subject());
        if (active.isPresent()) {
            ScrapeJob existing = active.get();
            if (existing.status() == JobStatus.LOCKED && !existing.isLockExpired(now, properties.getWorker().lockExpiry())) {
                throw new ActiveScrapeException(
                    "Subject " + schedule.subject() + " is already being scraped by " + existing.lockedBy(),
                    existing.id()
                );
            }
            jobRepository.promote(existing.id(), ScrapePriority.URGENT, now);
            jobId = existing.id();
            eventPublisher.publish(new ScrapeJobEvent(
                ScrapeJobEvent.Type.PROMOTED, jobId, schedule.subject(), ScrapePriority.URGENT, null, "interactive", now));
        } else {
            jobId = jobRepository.enqueue(
                TargetType.SUBJECT,
                schedule.subject(),
                ScrapePriority.URGENT,
                now,
                properties.getWorker().getMaxRetries(),
                now
            ).orElseThrow(() -> new ActiveScrapeException(
                "Subject " + schedule.subject() + " was queued concurrently",
                jobRepository.findActiveForTarget(TargetType.SUBJECT, schedule.subject()).map(ScrapeJob::id).orElse(null)
            ));
            eventPublisher.publish(new ScrapeJobEvent(
                ScrapeJobEvent.Type.ENQUEUED, jobId, schedule.subject(), ScrapePriority.URGENT, null, "interactive", now));
        }

        String owner = "interactive-" + UUID.randomUUID();
        ScrapeJob job = jobRepository.claimById(jobId, owner, now, properties.getWorker().lockExpiry())
            .orElseThrow(() -> new ActiveScrapeException(
                "Subject " + schedule.subject() + " was claimed by a worker first", jobId));
        eventPublisher.publish(new ScrapeJobEvent(
            ScrapeJobEvent.Type.CLAIMED, job.id(), job.targetKey(), job.priority(), owner, "interactive", now));

        ScrapeOutcome outcome;
        try {
            outcome = jobRunner.run(job, owner, RequestLane.FOREGROUND);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scraping " + schedule.subject(), e);
        }
        if (outcome == null) {
            throw new ActiveScrapeException("Lost the lock on job " + job.id() + " while scraping", job.id());
        }
        return outcome;
    }

    public SessionStatus sessionStatus() {
        return sessionKeeper.status();
    }

    public RateLimitStatus rateLimitStatus() {
        return rateLimiter.status();
    }

    private static JobStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job status " + status);
        }
    }

    private static String normalizeSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            return null;
        }
        return subject.trim().toUpperCase(Locale.ROOT);
    }

    private static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
