package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.http.RequestLaneContext;
import com.coursesync.scrape.model.FailureKind;
import com.coursesync.scrape.model.RequestLane;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapeOutcome;
import com.coursesync.scrape.model.SubjectFetch;
import com.coursesync.scrape.model.SubjectSchedule;
import com.coursesync.scrape.persistence.SubjectScheduleRepository;
import com.coursesync.scrape.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one claimed job under the job timeout and records its outcome. Shared by the worker pool and the
 * interactive scrape path.
 */
@Service
public class ScrapeJobRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobRunner.class);

    private final SubjectScrapeService subjectScrapeService;
    private final JobOutcomeService outcomeService;
    private final SubjectScheduleRepository scheduleRepository;
    private final TermService termService;
    private final ExecutorService jobExecutor;
    private final ScraperProperties properties;
    private final Clock clock;

    public ScrapeJobRunner(
        SubjectScrapeService subjectScrapeService,
        JobOutcomeService outcomeService,
        SubjectScheduleRepository scheduleRepository,
        TermService termService,
        @Qualifier("scrapeJobExecutor") ExecutorService jobExecutor,
        ScraperProperties properties,
        Clock clock
    ) {
        this.subjectScrapeService = subjectScrapeService;
        this.outcomeService = outcomeService;
        this.scheduleRepository = scheduleRepository;
        this.termService = termService;
        this.jobExecutor = jobExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return the recorded outcome, or null when the job's lock was lost before the outcome could be written
     * @throws InterruptedException when the calling thread is interrupted while waiting; the job is released
     */
    public ScrapeOutcome run(ScrapeJob job, String owner, RequestLane lane) throws InterruptedException {
        Instant startedAt = clock.instant();
        SubjectSchedule schedule = scheduleRepository.find(job.targetKey()).orElse(null);
        String termCode = schedule != null && schedule.termCode() != null
            ? schedule.termCode()
            : termService.currentTerm();
        if (termCode == null) {
            return recordFailure(job, owner, lane, startedAt, FailureKind.TRANSIENT, "No current term known");
        }
        int expected = schedule == null ? 0 : schedule.courseCount();

        Future<SubjectFetch> future = jobExecutor.submit(() -> {
            try (RequestLaneContext.Scope ignored = RequestLaneContext.activate(lane)) {
                return subjectScrapeService.fetchSubject(job.targetKey(), termCode, expected);
            }
        });

        SubjectFetch fetch;
        try {
            fetch = future.get(properties.getWorker().getJobTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return recordFailure(job, owner, lane, startedAt, FailureKind.TIMEOUT,
                "Timed out after " + properties.getWorker().getJobTimeoutSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            FailureKind kind = FailureClassifier.classify(cause);
            log.debug("Scrape of {} failed with {}", job.targetKey(), kind, cause);
            return recordFailure(job, owner, lane, startedAt, kind, FailureClassifier.describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            releaseQuietly(job, owner, "interrupted");
            throw e;
        }

        try {
            return outcomeService.recordSuccess(job, owner, lane, startedAt, fetch);
        } catch (LostJobLockException e) {
            log.warn("Discarding results for job {}: {}", job.id(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            if (FailureClassifier.isStoreUnavailable(e)) {
                throw e;
            }
            // The outcome transaction rolled back, so the job is still locked by this owner.
            FailureKind kind = FailureClassifier.classify(e);
            log.warn("Failed to record results for job {} ({})", job.id(), job.targetKey(), e);
            return recordFailure(job, owner, lane, startedAt, kind,
                "Result write failed: " + FailureClassifier.describe(e));
        }
    }

    private ScrapeOutcome recordFailure(
        ScrapeJob job,
        String owner,
        RequestLane lane,
        Instant startedAt,
        FailureKind kind,
        String message
    ) {
        try {
            return outcomeService.recordFailure(job, owner, lane, startedAt, kind, message);
        } catch (LostJobLockException e) {
            log.warn("Discarding failure for job {}: {}", job.id(), e.getMessage());
            return null;
        }
    }

    private void releaseQuietly(ScrapeJob job, String owner, String reason) {
        try {
            outcomeService.release(job, owner, reason);
        } catch (RuntimeException e) {
            log.warn("Failed to release job {} after interruption", job.id(), e);
        }
    }
}
