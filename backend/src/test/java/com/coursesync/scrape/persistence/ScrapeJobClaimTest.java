package com.coursesync.scrape.persistence;

import com.coursesync.scrape.ScrapeTables;
import com.coursesync.scrape.model.JobStatus;
import com.coursesync.scrape.model.QueueStats;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapePriority;
import com.coursesync.scrape.model.TargetType;
import com.coursesync.scrape.upstream.UpstreamClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ScrapeJobClaimTest {
    private static final Duration LOCK_EXPIRY = Duration.ofMinutes(10);

    @MockBean
    private UpstreamClient upstreamClient;

    @Autowired
    private ScrapeJobRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Instant now;

    @BeforeEach
    void setUp() {
        ScrapeTables.clear(jdbcTemplate);
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @Test
    void concurrentWorkersClaimAJobExactlyOnce() throws Exception {
        long jobId = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.NORMAL, now.minusSeconds(1), 3, now).orElseThrow();
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<ScrapeJob>>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String owner = "worker-test-w" + i;
                Callable<Optional<ScrapeJob>> claim = () -> {
                    start.await();
                    return repository.claimNext(owner, now, LOCK_EXPIRY);
                };
                futures.add(pool.submit(claim));
            }
            start.countDown();

            List<ScrapeJob> claimed = new ArrayList<>();
            for (Future<Optional<ScrapeJob>> future : futures) {
                future.get(30, TimeUnit.SECONDS).ifPresent(claimed::add);
            }
            assertThat(claimed).hasSize(1);
            assertThat(claimed.get(0).id()).isEqualTo(jobId);
            assertThat(claimed.get(0).status()).isEqualTo(JobStatus.LOCKED);
            assertThat(repository.findById(jobId).orElseThrow().lockedBy()).isEqualTo(claimed.get(0).lockedBy());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void claimsFollowPriorityThenExecuteAt() {
        long low = repository.enqueue(TargetType.SUBJECT, "ART", ScrapePriority.LOW, now.minusSeconds(300), 3, now).orElseThrow();
        long normalLater = repository.enqueue(TargetType.SUBJECT, "BIO", ScrapePriority.NORMAL, now.minusSeconds(10), 3, now).orElseThrow();
        long normalEarlier = repository.enqueue(TargetType.SUBJECT, "CHE", ScrapePriority.NORMAL, now.minusSeconds(60), 3, now).orElseThrow();
        long urgent = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.URGENT, now.minusSeconds(1), 3, now).orElseThrow();
        repository.enqueue(TargetType.SUBJECT, "MAT", ScrapePriority.URGENT, now.plusSeconds(600), 3, now);

        List<Long> order = new ArrayList<>();
        Optional<ScrapeJob> next = repository.claimNext("worker-test-w0", now, LOCK_EXPIRY);
        while (next.isPresent()) {
            order.add(next.get().id());
            next = repository.claimNext("worker-test-w0", now, LOCK_EXPIRY);
        }

        assertThat(order).containsExactly(urgent, normalEarlier, normalLater, low);
    }

    @Test
    void expiredLockCanBeReclaimedAndOldOwnerLosesIt() {
        long jobId = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.NORMAL, now.minusSeconds(3600), 3, now).orElseThrow();
        Instant longAgo = now.minus(Duration.ofMinutes(20));
        assertThat(repository.claimNext("worker-a-w0", longAgo, LOCK_EXPIRY)).isPresent();

        assertThat(repository.claimNext("worker-b-w0", longAgo.plusSeconds(60), LOCK_EXPIRY)).isEmpty();

        ScrapeJob reclaimed = repository.claimNext("worker-b-w0", now, LOCK_EXPIRY).orElseThrow();
        assertThat(reclaimed.id()).isEqualTo(jobId);
        assertThat(reclaimed.lockedBy()).isEqualTo("worker-b-w0");

        assertThat(repository.complete(jobId, "worker-a-w0", now)).isFalse();
        assertThat(repository.scheduleRetry(jobId, "worker-a-w0", now, "late")).isFalse();
        assertThat(repository.complete(jobId, "worker-b-w0", now)).isTrue();

        ScrapeJob done = repository.findById(jobId).orElseThrow();
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.lockedBy()).isNull();
        assertThat(done.finishedAt()).isNotNull();
    }

    @Test
    void retryAndFailureCountAttempts() {
        long jobId = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.NORMAL, now, 1, now).orElseThrow();
        repository.claimNext("worker-test-w0", now, LOCK_EXPIRY).orElseThrow();
        assertThat(repository.scheduleRetry(jobId, "worker-test-w0", now.plusSeconds(30), "HTTP 503")).isTrue();

        ScrapeJob retried = repository.findById(jobId).orElseThrow();
        assertThat(retried.status()).isEqualTo(JobStatus.PENDING);
        assertThat(retried.retryCount()).isEqualTo(1);
        assertThat(retried.lastError()).isEqualTo("HTTP 503");
        assertThat(repository.claimNext("worker-test-w0", now, LOCK_EXPIRY)).isEmpty();

        Instant later = now.plusSeconds(31);
        repository.claimNext("worker-test-w0", later, LOCK_EXPIRY).orElseThrow();
        assertThat(repository.markFailed(jobId, "worker-test-w0", "HTTP 503 again", later)).isTrue();

        ScrapeJob failed = repository.findById(jobId).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.retryCount()).isEqualTo(2);
        assertThat(repository.claimNext("worker-test-w0", later.plusSeconds(3600), LOCK_EXPIRY)).isEmpty();
    }

    @Test
    void releaseAllHeldByReturnsOnlyThatInstancesJobs() {
        repository.enqueue(TargetType.SUBJECT, "ART", ScrapePriority.NORMAL, now, 3, now);
        repository.enqueue(TargetType.SUBJECT, "BIO", ScrapePriority.NORMAL, now, 3, now);
        repository.enqueue(TargetType.SUBJECT, "CHE", ScrapePriority.NORMAL, now, 3, now);
        repository.claimNext("worker-1_a-w0", now, LOCK_EXPIRY).orElseThrow();
        repository.claimNext("worker-1_a-w1", now, LOCK_EXPIRY).orElseThrow();
        ScrapeJob other = repository.claimNext("worker-1xa-w0", now, LOCK_EXPIRY).orElseThrow();

        int released = repository.releaseAllHeldBy("worker-1_a-w");

        assertThat(released).isEqualTo(2);
        assertThat(repository.findById(other.id()).orElseThrow().status()).isEqualTo(JobStatus.LOCKED);
        assertThat(repository.listJobs(JobStatus.PENDING, 10)).hasSize(2);
    }

    @Test
    void promoteOnlyRaisesPriorityAndPullsForward() {
        long jobId = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.HIGH, now.plusSeconds(600), 3, now).orElseThrow();

        assertThat(repository.promote(jobId, ScrapePriority.LOW, now.plusSeconds(1200))).isTrue();
        ScrapeJob unchanged = repository.findById(jobId).orElseThrow();
        assertThat(unchanged.priority()).isEqualTo(ScrapePriority.HIGH);
        assertThat(unchanged.executeAt()).isEqualTo(now.plusSeconds(600));

        repository.promote(jobId, ScrapePriority.URGENT, now);
        ScrapeJob promoted = repository.findById(jobId).orElseThrow();
        assertThat(promoted.priority()).isEqualTo(ScrapePriority.URGENT);
        assertThat(promoted.executeAt()).isEqualTo(now);
    }

    @Test
    void claimByIdIgnoresExecuteAtButRespectsLiveLocks() {
        long jobId = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.LOW, now.plusSeconds(3600), 3, now).orElseThrow();

        assertThat(repository.claimById(jobId, "interactive-1", now, LOCK_EXPIRY)).isPresent();
        assertThat(repository.claimById(jobId, "interactive-2", now, LOCK_EXPIRY)).isEmpty();
        assertThat(repository.findActiveForTarget(TargetType.SUBJECT, "CS")).isPresent();
        assertThat(repository.findActiveTargetKeys(TargetType.SUBJECT)).containsExactly("CS");
    }

    @Test
    void enqueueRefusesASecondActiveJobForTheSameTarget() {
        long first = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.NORMAL, now, 3, now).orElseThrow();

        assertThat(repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.URGENT, now, 3, now)).isEmpty();
        assertThat(repository.enqueue(TargetType.SUBJECT, "MAT", ScrapePriority.NORMAL, now, 3, now)).isPresent();

        repository.claimById(first, "worker-test-w0", now, LOCK_EXPIRY).orElseThrow();
        assertThat(repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.NORMAL, now, 3, now)).isEmpty();

        assertThat(repository.complete(first, "worker-test-w0", now)).isTrue();
        assertThat(repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.NORMAL, now, 3, now)).isPresent();
        assertThat(repository.listJobs(JobStatus.PENDING, 10))
            .extracting(ScrapeJob::targetKey)
            .containsExactlyInAnyOrder("CS", "MAT");
    }

    @Test
    void ownerIsComparedInTheSameFormItWasClaimedWith() {
        long jobId = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.NORMAL, now, 3, now).orElseThrow();

        ScrapeJob claimed = repository.claimNext("  worker-test-w0 ", now, LOCK_EXPIRY).orElseThrow();

        assertThat(claimed.lockedBy()).isEqualTo("worker-test-w0");
        assertThat(repository.complete(jobId, "  worker-test-w0 ", now)).isTrue();
        assertThat(repository.findById(jobId).orElseThrow().status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void queueStatsSeparateLiveAndExpiredLocks() {
        repository.enqueue(TargetType.SUBJECT, "ART", ScrapePriority.NORMAL, now, 3, now);
        repository.enqueue(TargetType.SUBJECT, "BIO", ScrapePriority.NORMAL, now.plusSeconds(600), 3, now);
        long stale = repository.enqueue(TargetType.SUBJECT, "CHE", ScrapePriority.URGENT, now.minusSeconds(7200), 3, now).orElseThrow();
        repository.claimById(stale, "worker-gone-w0", now.minus(Duration.ofMinutes(30)), LOCK_EXPIRY).orElseThrow();
        long live = repository.enqueue(TargetType.SUBJECT, "CS", ScrapePriority.URGENT, now, 3, now).orElseThrow();
        repository.claimById(live, "worker-here-w0", now, LOCK_EXPIRY).orElseThrow();

        QueueStats stats = repository.fetchQueueStats(now, LOCK_EXPIRY, 5);

        assertThat(stats.pendingCount()).isEqualTo(2);
        assertThat(stats.dueCount()).isEqualTo(2);
        assertThat(stats.lockedCount()).isEqualTo(1);
        assertThat(stats.expiredLockCount()).isEqualTo(1);
        assertThat(stats.nextDueAt()).isEqualTo(now);
    }
}
