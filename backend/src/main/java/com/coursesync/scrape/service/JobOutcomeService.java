package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.diff.CourseDiffEngine;
import com.coursesync.scrape.model.AuditEntry;
import com.coursesync.scrape.model.AuditLogEvent;
import com.coursesync.scrape.model.CourseSnapshot;
import com.coursesync.scrape.model.FailureKind;
import com.coursesync.scrape.model.JobStatus;
import com.coursesync.scrape.model.PausedReason;
import com.coursesync.scrape.model.RequestLane;
import com.coursesync.scrape.model.ScheduleState;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapeJobEvent;
import com.coursesync.scrape.model.ScrapeOutcome;
import com.coursesync.scrape.model.ScrapeResult;
import com.coursesync.scrape.model.ScrapeResultEvent;
import com.coursesync.scrape.model.SubjectFetch;
import com.coursesync.scrape.model.SubjectSchedule;
import com.coursesync.scrape.persistence.AuditRepository;
import com.coursesync.scrape.persistence.CourseRepository;
import com.coursesync.scrape.persistence.ScrapeJobRepository;
import com.coursesync.scrape.persistence.ScrapeResultRepository;
import com.coursesync.scrape.persistence.SubjectScheduleRepository;
import com.coursesync.scrape.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Writes the outcome of one job attempt. Each method is a single transaction: the job transition, the
 * result row, the course mirror, the audit trail and the subject schedule either all land or none do.
 */
@Service
public class JobOutcomeService {
    private static final Logger log = LoggerFactory.getLogger(JobOutcomeService.class);

    private final ScrapeJobRepository jobRepository;
    private final ScrapeResultRepository resultRepository;
    private final CourseRepository courseRepository;
    private final AuditRepository auditRepository;
    private final SubjectScheduleRepository scheduleRepository;
    private final CourseDiffEngine diffEngine;
    private final IntervalPolicy intervalPolicy;
    private final ScraperSettingsService settings;
    private final TermService termService;
    private final ScrapeEventPublisher eventPublisher;
    private final ScraperProperties properties;
    private final Clock clock;

    public JobOutcomeService(
        ScrapeJobRepository jobRepository,
        ScrapeResultRepository resultRepository,
        CourseRepository courseRepository,
        AuditRepository auditRepository,
        SubjectScheduleRepository scheduleRepository,
        CourseDiffEngine diffEngine,
        IntervalPolicy intervalPolicy,
        ScraperSettingsService settings,
        TermService termService,
        ScrapeEventPublisher eventPublisher,
        ScraperProperties properties,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.resultRepository = resultRepository;
        this.courseRepository = courseRepository;
        this.auditRepository = auditRepository;
        this.scheduleRepository = scheduleRepository;
        this.diffEngine = diffEngine;
        this.intervalPolicy = intervalPolicy;
        this.settings = settings;
        this.termService = termService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public ScrapeOutcome recordSuccess(
        ScrapeJob job,
        String owner,
        RequestLane lane,
        Instant startedAt,
        SubjectFetch fetch
    ) {
        Instant now = clock.instant();
        if (!jobRepository.complete(job.id(), owner, now)) {
            throw new LostJobLockException(job.id(), owner);
        }

        Map<String, CourseSnapshot> previous = courseRepository.findBySubject(fetch.termCode(), fetch.subject());
        CourseDiffEngine.SubjectDiff diff = diffEngine.diffSubject(previous, fetch.courses(), now);
        for (CourseSnapshot course : fetch.courses()) {
            courseRepository.upsert(course, now);
        }
        List<AuditEntry> audits = new ArrayList<>(diff.entries().size());
        for (AuditEntry entry : diff.entries()) {
            audits.add(entry.withJobId(job.id()));
        }
        auditRepository.insertAll(audits);

        ScrapeResult result = resultRepository.insert(new ScrapeResult(
            null,
            job.id(),
            job.targetType(),
            job.targetKey(),
            job.priority(),
            lane,
            startedAt,
            now,
            Duration.between(startedAt, now).toMillis(),
            true,
            null,
            null,
            job.retryCount(),
            diff.coursesFetched(),
            diff.coursesChanged(),
            diff.coursesUnchanged(),
            audits.size()
        ));

        SubjectSchedule schedule = scheduleAfterSuccess(job.targetKey(), fetch.termCode(), diff, now);
        scheduleRepository.save(schedule);

        log.info(
            "Scraped {} ({} lane): {} courses, {} changed, {} audits, next eligible {}",
            job.targetKey(),
            lane,
            diff.coursesFetched(),
            diff.coursesChanged(),
            audits.size(),
            schedule.nextEligibleAt()
        );
        eventPublisher.publish(jobEvent(ScrapeJobEvent.Type.COMPLETED, job, owner, null, now));
        eventPublisher.publish(new ScrapeResultEvent(result));
        if (!audits.isEmpty()) {
            eventPublisher.publish(new AuditLogEvent(job.targetKey(), fetch.termCode(), job.id(), audits));
        }
        return new ScrapeOutcome(result, JobStatus.COMPLETED);
    }

    @Transactional
    public ScrapeOutcome recordFailure(
        ScrapeJob job,
        String owner,
        RequestLane lane,
        Instant startedAt,
        FailureKind kind,
        String errorMessage
    ) {
        Instant now = clock.instant();
        String error = FailureClassifier.truncate(errorMessage == null ? kind.name() : errorMessage);
        boolean retry = kind.isRetryable() && job.retryCount() < job.maxRetries();
        JobStatus status;
        if (retry) {
            Instant nextAttempt = now.plus(retryBackoff(job.retryCount()));
            if (!jobRepository.scheduleRetry(job.id(), owner, nextAttempt, error)) {
                throw new LostJobLockException(job.id(), owner);
            }
            status = JobStatus.PENDING;
        } else {
            if (!jobRepository.markFailed(job.id(), owner, error, now)) {
                throw new LostJobLockException(job.id(), owner);
            }
            status = JobStatus.FAILED;
        }

        ScrapeResult result = resultRepository.insert(new ScrapeResult(
            null,
            job.id(),
            job.targetType(),
            job.targetKey(),
            job.priority(),
            lane,
            startedAt,
            now,
            Duration.between(startedAt, now).toMillis(),
            false,
            kind,
            error,
            job.retryCount() + 1,
            0,
            0,
            0,
            0
        ));

        scheduleRepository.find(job.targetKey())
            .map(schedule -> scheduleAfterFailure(schedule, status == JobStatus.FAILED, now))
            .ifPresent(scheduleRepository::save);

        if (retry) {
            log.warn("Scrape of {} failed ({}), retry {} of {}: {}",
                job.targetKey(), kind, job.retryCount() + 1, job.maxRetries(), error);
        } else {
            log.warn("Scrape of {} failed permanently ({}) after {} attempts: {}",
                job.targetKey(), kind, job.retryCount() + 1, error);
        }
        eventPublisher.publish(jobEvent(
            retry ? ScrapeJobEvent.Type.RETRY_SCHEDULED : ScrapeJobEvent.Type.FAILED,
            job,
            owner,
            error,
            now
        ));
        eventPublisher.publish(new ScrapeResultEvent(result));
        return new ScrapeOutcome(result, status);
    }

    /**
     * Returns the job to the queue without counting an attempt.
     */
    @Transactional
    public boolean release(ScrapeJob job, String owner, String reason) {
        boolean released = jobRepository.release(job.id(), owner, reason);
        if (released) {
            eventPublisher.publish(jobEvent(ScrapeJobEvent.Type.RELEASED, job, owner, reason, clock.instant()));
        }
        return released;
    }

    SubjectSchedule scheduleAfterSuccess(String subject, String termCode, CourseDiffEngine.SubjectDiff diff, Instant now) {
        ScraperProperties.Scheduler config = properties.getScheduler();
        SubjectSchedule previous = scheduleRepository.find(subject)
            .orElseGet(() -> SubjectSchedule.fresh(subject, termCode, settings.minInterval(), now));

        int fetched = diff.coursesFetched();
        double ratio = fetched == 0 ? 0.0 : (double) diff.coursesChanged() / fetched;
        double alpha = config.getChangeRatioSmoothing();
        double avgChangeRatio = previous.recentRuns() == 0
            ? ratio
            : alpha * ratio + (1.0 - alpha) * previous.avgChangeRatio();
        int zeroChanges = fetched > 0 && diff.coursesChanged() == 0 ? previous.consecutiveZeroChanges() + 1 : 0;
        int emptyFetches = fetched == 0 ? previous.consecutiveEmptyFetches() + 1 : 0;
        boolean archived = termService.isArchived(termCode);

        Duration interval = intervalPolicy.computeInterval(new IntervalPolicy.Inputs(
            fetched,
            settings.isPrioritySubject(subject),
            archived,
            zeroChanges,
            avgChangeRatio
        ));

        ScheduleState state;
        PausedReason pausedReason = null;
        Instant nextEligibleAt = now.plus(interval);
        if (previous.isAdminPaused()) {
            state = ScheduleState.PAUSED;
            pausedReason = PausedReason.ADMIN;
        } else if (emptyFetches >= config.getPauseAfterEmptyFetches()) {
            if (previous.pausedReason() != PausedReason.EMPTY_FETCHES) {
                log.warn("Pausing {} after {} consecutive empty fetches", subject, emptyFetches);
            }
            state = ScheduleState.PAUSED;
            pausedReason = PausedReason.EMPTY_FETCHES;
            nextEligibleAt = now.plus(Duration.ofHours(config.getPauseProbeHours()));
        } else {
            state = archived ? ScheduleState.READ_ONLY : ScheduleState.COOLDOWN;
        }

        int window = config.getRecentRunWindow();
        return new SubjectSchedule(
            subject,
            termCode,
            fetched,
            interval,
            now,
            now,
            avgChangeRatio,
            zeroChanges,
            emptyFetches,
            0,
            Math.min(window, previous.recentRuns() + 1),
            decayedFailures(previous, window),
            state,
            pausedReason,
            nextEligibleAt,
            now
        );
    }

    SubjectSchedule scheduleAfterFailure(SubjectSchedule previous, boolean terminal, Instant now) {
        ScraperProperties.Scheduler config = properties.getScheduler();
        int failures = previous.consecutiveFailures() + 1;
        int window = config.getRecentRunWindow();
        ScheduleState state = previous.state();
        PausedReason pausedReason = previous.pausedReason();
        Instant nextEligibleAt = previous.nextEligibleAt();

        if (terminal) {
            nextEligibleAt = now.plus(intervalPolicy.failureBackoff(failures));
        }
        if (!previous.isAdminPaused() && failures >= config.getPauseAfterFailures()) {
            if (state != ScheduleState.PAUSED) {
                log.warn("Pausing {} after {} consecutive failed attempts", previous.subject(), failures);
            }
            state = ScheduleState.PAUSED;
            pausedReason = PausedReason.FAILURES;
        }

        return new SubjectSchedule(
            previous.subject(),
            previous.termCode(),
            previous.courseCount(),
            previous.currentInterval(),
            previous.lastScrapedAt(),
            now,
            previous.avgChangeRatio(),
            previous.consecutiveZeroChanges(),
            previous.consecutiveEmptyFetches(),
            failures,
            Math.min(window, previous.recentRuns() + 1),
            Math.min(window, decayedFailures(previous, window) + 1),
            state,
            pausedReason,
            nextEligibleAt,
            now
        );
    }

    private static int decayedFailures(SubjectSchedule previous, int window) {
        if (previous.recentRuns() < window) {
            return previous.recentFailures();
        }
        return (int) Math.round(previous.recentFailures() * (window - 1) / (double) window);
    }

    private Duration retryBackoff(int retryCount) {
        List<Integer> steps = properties.getWorker().getRetryBackoffSeconds();
        int index = Math.min(Math.max(0, retryCount), steps.size() - 1);
        long seconds = Math.max(1, steps.get(index));
        long jitterSeconds = ThreadLocalRandom.current().nextLong(Math.max(1L, seconds / 5 + 1));
        return Duration.ofSeconds(seconds + jitterSeconds);
    }

    private static ScrapeJobEvent jobEvent(ScrapeJobEvent.Type type, ScrapeJob job, String owner, String detail, Instant at) {
        return new ScrapeJobEvent(type, job.id(), job.targetKey(), job.priority(), owner, detail, at);
    }
}
