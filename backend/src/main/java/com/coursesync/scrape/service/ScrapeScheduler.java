package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.CodeDescription;
import com.coursesync.scrape.model.ScheduleDecision;
import com.coursesync.scrape.model.ScheduleState;
import com.coursesync.scrape.model.ScrapeJobEvent;
import com.coursesync.scrape.model.SubjectSchedule;
import com.coursesync.scrape.model.TargetType;
import com.coursesync.scrape.model.TickSummary;
import com.coursesync.scrape.persistence.ReferenceDataRepository;
import com.coursesync.scrape.persistence.ScrapeJobRepository;
import com.coursesync.scrape.persistence.SubjectScheduleRepository;
import com.coursesync.scrape.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-tick scheduler. Each tick refreshes the catalog and reference data when they are due, evaluates every
 * subject schedule and enqueues a job for each subject that is due and not already queued.
 */
@Service
public class ScrapeScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScrapeScheduler.class);

    private final SubjectScheduleRepository scheduleRepository;
    private final ScrapeJobRepository jobRepository;
    private final StalenessAnalyzer stalenessAnalyzer;
    private final ReferenceDataService referenceDataService;
    private final TermService termService;
    private final ScraperSettingsService settings;
    private final ScrapeEventPublisher eventPublisher;
    private final ObjectProvider<RatingDataRefresher> ratingDataRefresher;
    private final ScraperProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final Object tickLock = new Object();

    private ScheduledExecutorService executor;
    private Instant lastReferenceRefresh;
    private Instant lastCatalogRefresh;
    private Instant lastRatingRefresh;
    private boolean storeDown;

    public ScrapeScheduler(
        SubjectScheduleRepository scheduleRepository,
        ScrapeJobRepository jobRepository,
        StalenessAnalyzer stalenessAnalyzer,
        ReferenceDataService referenceDataService,
        TermService termService,
        ScraperSettingsService settings,
        ScrapeEventPublisher eventPublisher,
        ObjectProvider<RatingDataRefresher> ratingDataRefresher,
        ScraperProperties properties,
        Clock clock
    ) {
        this.scheduleRepository = scheduleRepository;
        this.jobRepository = jobRepository;
        this.stalenessAnalyzer = stalenessAnalyzer;
        this.referenceDataService = referenceDataService;
        this.termService = termService;
        this.settings = settings;
        this.eventPublisher = eventPublisher;
        this.ratingDataRefresher = ratingDataRefresher;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int tickSeconds = properties.getScheduler().getTickSeconds();
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("scrape-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.scheduleWithFixedDelay(this::safeTick, 0, tickSeconds, TimeUnit.SECONDS);
            log.info("Scrape scheduler started, ticking every {}s", tickSeconds);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(properties.getWorker().getShutdownTimeoutSeconds(), TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Scrape scheduler stopped");
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            if (FailureClassifier.isStoreUnavailable(e)) {
                storeDown = true;
                log.error("Scheduler tick aborted, job store unavailable", e);
            } else {
                log.warn("Scheduler tick failed", e);
            }
        }
    }

    public TickSummary tick() {
        synchronized (tickLock) {
            Instant now = clock.instant();
            if (storeDown) {
                if (!jobRepository.isStoreReachable()) {
                    return new TickSummary(now, null, false, false, false, 0, 0, 0);
                }
                storeDown = false;
                log.info("Job store reachable again, resuming scheduling");
            }
            settings.reload();

            boolean referenceRefreshed = false;
            if (isDue(referenceRefreshedAt(), Duration.ofMinutes(properties.getScheduler().getReferenceDataMinutes()), now)) {
                referenceRefreshed = refreshReferenceData(now);
            }

            String term = termService.currentTerm();
            boolean catalogRefreshed = false;
            if (term != null
                && (referenceRefreshed
                    || isDue(lastCatalogRefresh, Duration.ofMinutes(properties.getScheduler().getCatalogRefreshMinutes()), now))) {
                catalogRefreshed = refreshCatalog(term, referenceRefreshed, now);
            }

            boolean ratingsRefreshed = false;
            if (isDue(lastRatingRefresh, Duration.ofMinutes(properties.getScheduler().getRatingDataMinutes()), now)) {
                ratingsRefreshed = refreshRatings(now);
            }

            List<SubjectSchedule> schedules = scheduleRepository.findAll();
            Set<String> active = jobRepository.findActiveTargetKeys(TargetType.SUBJECT);
            int transitions = 0;
            int enqueued = 0;
            Map<String, Integer> byPriority = new HashMap<>();
            for (SubjectSchedule schedule : schedules) {
                ScheduleDecision decision = stalenessAnalyzer.evaluate(schedule, now);
                if (decision.transitioned()) {
                    scheduleRepository.save(decision.schedule());
                    transitions++;
                }
                if (!decision.enqueue() || active.contains(schedule.subject())) {
                    continue;
                }
                Optional<Long> created = jobRepository.enqueue(
                    TargetType.SUBJECT,
                    schedule.subject(),
                    decision.priority(),
                    now,
                    properties.getWorker().getMaxRetries(),
                    now
                );
                active.add(schedule.subject());
                if (created.isEmpty()) {
                    log.debug("Skipping {}: an active job was queued concurrently", schedule.subject());
                    continue;
                }
                long jobId = created.get();
                enqueued++;
                byPriority.merge(decision.priority().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
                eventPublisher.publish(new ScrapeJobEvent(
                    ScrapeJobEvent.Type.ENQUEUED,
                    jobId,
                    schedule.subject(),
                    decision.priority(),
                    null,
                    decision.reason(),
                    now
                ));
            }
            if (enqueued > 0 || transitions > 0) {
                log.info("Scheduler tick: {} subjects, {} transitions, {} enqueued {}",
                    schedules.size(), transitions, enqueued, byPriority);
            } else {
                log.debug("Scheduler tick: {} subjects, nothing due", schedules.size());
            }
            return new TickSummary(
                now,
                term,
                referenceRefreshed,
                catalogRefreshed,
                ratingsRefreshed,
                schedules.size(),
                transitions,
                enqueued
            );
        }
    }

    private boolean refreshReferenceData(Instant now) {
        try {
            referenceDataService.refreshAll();
            lastReferenceRefresh = now;
            return true;
        } catch (RuntimeException e) {
            if (FailureClassifier.isStoreUnavailable(e)) {
                throw e;
            }
            log.warn("Reference data refresh failed: {}", FailureClassifier.describe(e));
            return false;
        }
    }

    private boolean refreshCatalog(String term, boolean subjectsFresh, Instant now) {
        List<CodeDescription> subjects;
        try {
            subjects = subjectsFresh
                ? referenceDataService.currentSubjects()
                : referenceDataService.refreshSubjects(term);
        } catch (RuntimeException e) {
            if (FailureClassifier.isStoreUnavailable(e)) {
                throw e;
            }
            log.warn("Subject catalog refresh failed for term {}: {}", term, FailureClassifier.describe(e));
            return false;
        }
        boolean archived = termService.isArchived(term);
        int created = 0;
        int moved = 0;
        for (CodeDescription subject : subjects) {
            String code = subject.code().toUpperCase(Locale.ROOT);
            SubjectSchedule fresh = SubjectSchedule.fresh(code, term, settings.minInterval(), now);
            if (archived) {
                fresh = fresh.withState(ScheduleState.READ_ONLY, null, now);
            }
            if (scheduleRepository.insertIfAbsent(fresh)) {
                created++;
            }
        }
        for (SubjectSchedule schedule : scheduleRepository.findAll()) {
            if (term.equals(schedule.termCode())) {
                continue;
            }
            SubjectSchedule relocated = schedule.withTerm(term, now).withNextEligibleAt(now, now);
            if (!schedule.isPaused()) {
                relocated = relocated.withState(archived ? ScheduleState.READ_ONLY : ScheduleState.ELIGIBLE, null, now);
            }
            scheduleRepository.save(relocated);
            moved++;
        }
        lastCatalogRefresh = now;
        log.info("Subject catalog for term {}: {} subjects, {} new schedules, {} moved to this term",
            term, subjects.size(), created, moved);
        return true;
    }

    private boolean refreshRatings(Instant now) {
        RatingDataRefresher refresher = ratingDataRefresher.getIfAvailable();
        lastRatingRefresh = now;
        if (refresher == null) {
            return false;
        }
        try {
            refresher.refresh();
            return true;
        } catch (RuntimeException e) {
            log.warn("Rating data refresh failed: {}", FailureClassifier.describe(e));
            return false;
        }
    }

    private Instant referenceRefreshedAt() {
        if (lastReferenceRefresh == null) {
            lastReferenceRefresh = referenceDataService.lastRefreshed(ReferenceDataRepository.TERMS);
        }
        return lastReferenceRefresh;
    }

    private static boolean isDue(Instant last, Duration interval, Instant now) {
        return last == null || !now.isBefore(last.plus(interval));
    }
}
