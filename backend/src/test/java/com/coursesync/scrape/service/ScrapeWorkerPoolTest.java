package com.coursesync.scrape.service;

import com.coursesync.scrape.ScrapeTables;
import com.coursesync.scrape.model.CourseSearchPage;
import com.coursesync.scrape.model.JobStatus;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapePriority;
import com.coursesync.scrape.model.SubjectSchedule;
import com.coursesync.scrape.model.TargetType;
import com.coursesync.scrape.persistence.ScrapeJobRepository;
import com.coursesync.scrape.persistence.SubjectScheduleRepository;
import com.coursesync.scrape.upstream.UpstreamClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class ScrapeWorkerPoolTest {

    @MockBean
    private UpstreamClient upstreamClient;

    @Autowired
    private ScrapeWorkerPool workerPool;

    @Autowired
    private ScrapeJobRepository jobRepository;

    @Autowired
    private SubjectScheduleRepository scheduleRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        ScrapeTables.clear(jdbcTemplate);
    }

    @AfterEach
    void tearDown() {
        workerPool.stop();
    }

    @Test
    void workersDrainDueJobs() throws Exception {
        when(upstreamClient.searchCourses(anyString(), anyString(), anyInt(), anyInt(), anyInt()))
            .thenReturn(new CourseSearchPage(0, List.of()));
        List<Long> jobIds = List.of(seed("ART"), seed("BIO"), seed("CHE"));

        workerPool.start();
        assertThat(workerPool.isRunning()).isTrue();
        assertThat(workerPool.getActiveWorkerCount()).isEqualTo(2);

        awaitStatus(jobIds, JobStatus.COMPLETED, Duration.ofSeconds(20));
        SubjectSchedule art = scheduleRepository.find("ART").orElseThrow();
        assertThat(art.consecutiveEmptyFetches()).isEqualTo(1);
        assertThat(art.currentInterval()).isEqualTo(Duration.ofHours(12));
    }

    @Test
    void stoppingReturnsInFlightJobToTheQueue() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        when(upstreamClient.searchCourses(anyString(), anyString(), anyInt(), anyInt(), anyInt()))
            .thenAnswer(invocation -> {
                started.countDown();
                never.await();
                return new CourseSearchPage(0, List.of());
            });
        long jobId = seed("ART");

        workerPool.start();
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(jobRepository.findById(jobId).orElseThrow().status()).isEqualTo(JobStatus.LOCKED);

        workerPool.stop();

        ScrapeJob job = jobRepository.findById(jobId).orElseThrow();
        assertThat(workerPool.isRunning()).isFalse();
        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.lockedBy()).isNull();
        assertThat(job.retryCount()).isZero();
    }

    private long seed(String subject) {
        Instant now = Instant.now();
        scheduleRepository.save(SubjectSchedule.fresh(subject, "202610", Duration.ofHours(1), now));
        return jobRepository.enqueue(TargetType.SUBJECT, subject, ScrapePriority.NORMAL, now, 3, now).orElseThrow();
    }

    private void awaitStatus(List<Long> jobIds, JobStatus status, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            boolean done = jobIds.stream()
                .allMatch(id -> jobRepository.findById(id).map(job -> job.status() == status).orElse(false));
            if (done) {
                return;
            }
            TimeUnit.MILLISECONDS.sleep(50);
        }
        assertThat(jobIds).allSatisfy(id ->
            assertThat(jobRepository.findById(id).orElseThrow().status()).isEqualTo(status));
    }
}
