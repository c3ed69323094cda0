package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.RequestLane;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapeJobEvent;
import com.coursesync.scrape.persistence.ScrapeJobRepository;
import com.coursesync.scrape.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class ScrapeWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(ScrapeWorkerPool.class);

    private final ScrapeJobRepository jobRepository;
    private final ScrapeJobRunner jobRunner;
    private final ScrapeEventPublisher eventPublisher;
    private final ScraperProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;
    private volatile int activeWorkerCount;

    public ScrapeWorkerPool(
        ScrapeJobRepository jobRepository,
        ScrapeJobRunner jobRunner,
        ScrapeEventPublisher eventPublisher,
        ScraperProperties properties,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.jobRunner = jobRunner;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.instanceId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
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

    public int getActiveWorkerCount() {
        return activeWorkerCount;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getWorker().getWorkerCount();
            int pollIntervalMs = properties.getWorker().getPollIntervalMs();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("scrape-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollIntervalMs));
            }
            log.info("Started {} scrape workers as {}", workerCount, instanceId);
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
                    if (!executor.awaitTermination(properties.getWorker().getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                        log.warn("Scrape workers did not stop within {}s", properties.getWorker().getShutdownTimeoutSeconds());
                    }
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            releaseHeldLocks();
        }
    }

    String ownerFor(int workerIndex) {
        return instanceId + "-w" + workerIndex;
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        Thread.currentThread().setName("scrape-worker-" + workerIndex);
        String owner = ownerFor(workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Optional<ScrapeJob> claimed;
            try {
                claimed = jobRepository.claimNext(owner, clock.instant(), properties.getWorker().lockExpiry());
            } catch (Exception e) {
                if (FailureClassifier.isStoreUnavailable(e)) {
                    awaitStore(workerIndex, pollIntervalMs, e);
                } else {
                    log.warn("Scrape worker {} failed to claim a job", workerIndex, e);
                    sleep(pollIntervalMs);
                }
                continue;
            }

            if (claimed.isEmpty()) {
                sleep(pollIntervalMs);
                continue;
            }

            ScrapeJob job = claimed.get();
            eventPublisher.publish(new ScrapeJobEvent(
                ScrapeJobEvent.Type.CLAIMED,
                job.id(),
                job.targetKey(),
                job.priority(),
                owner,
                null,
                clock.instant()
            ));
            try {
                jobRunner.run(job, owner, RequestLane.BACKGROUND);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                if (FailureClassifier.isStoreUnavailable(e)) {
                    awaitStore(workerIndex, pollIntervalMs, e);
                } else {
                    log.warn("Scrape worker {} failed while running job {} ({})", workerIndex, job.id(), job.targetKey(), e);
                }
            }
        }
    }

    /**
     * Halts this worker until the store answers again. Jobs left locked meanwhile become claimable once their
     * lock expires.
     */
    private void awaitStore(int workerIndex, int pollIntervalMs, Exception cause) {
        log.error("Scrape worker {} lost the job store, pausing until it is reachable", workerIndex, cause);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            sleep(pollIntervalMs);
            try {
                if (jobRepository.isStoreReachable()) {
                    log.info("Scrape worker {} reconnected to the job store", workerIndex);
                    return;
                }
            } catch (Exception e) {
                log.debug("Job store still unreachable: {}", e.getMessage());
            }
        }
    }

    private void releaseHeldLocks() {
        try {
            int released = jobRepository.releaseAllHeldBy(instanceId + "-w");
            if (released > 0) {
                log.info("Released {} job locks held by {}", released, instanceId);
            }
        } catch (Exception e) {
            log.warn("Failed to release job locks held by {}", instanceId, e);
        }
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(100, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
