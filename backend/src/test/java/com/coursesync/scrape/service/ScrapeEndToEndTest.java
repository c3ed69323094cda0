package com.coursesync.scrape.service;

import com.coursesync.scrape.ScrapeTables;
import com.coursesync.scrape.model.AuditEntry;
import com.coursesync.scrape.model.CodeDescription;
import com.coursesync.scrape.model.CourseSearchPage;
import com.coursesync.scrape.model.CourseSnapshot;
import com.coursesync.scrape.model.FailureKind;
import com.coursesync.scrape.model.JobStatus;
import com.coursesync.scrape.model.PausedReason;
import com.coursesync.scrape.model.RequestLane;
import com.coursesync.scrape.model.ScheduleState;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapeOutcome;
import com.coursesync.scrape.model.ScrapePriority;
import com.coursesync.scrape.model.StreamEvent;
import com.coursesync.scrape.model.SubjectSchedule;
import com.coursesync.scrape.model.TargetType;
import com.coursesync.scrape.model.TickSummary;
import com.coursesync.scrape.persistence.AuditRepository;
import com.coursesync.scrape.persistence.CourseRepository;
import com.coursesync.scrape.persistence.ScrapeJobRepository;
import com.coursesync.scrape.persistence.SubjectScheduleRepository;
import com.coursesync.scrape.upstream.UpstreamClient;
import com.coursesync.scrape.upstream.UpstreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class ScrapeEndToEndTest {
    private static final String TERM = "202610";
    private static final Duration LOCK_EXPIRY = Duration.ofMinutes(10);

    @MockBean
    private UpstreamClient upstreamClient;

    @Autowired
    private ScrapeScheduler scheduler;

    @Autowired
    private ScrapeJobRunner jobRunner;

    @Autowired
    private ScrapeJobRepository jobRepository;

    @Autowired
    private SubjectScheduleRepository scheduleRepository;

    @Autowired
    private CourseRepository courseRepository;

    @Autowired
    private AuditRepository auditRepository;

    @Autowired
    private ScrapeEventBuffer eventBuffer;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        ScrapeTables.clear(jdbcTemplate);
        when(upstreamClient.getTerms()).thenReturn(List.of(new CodeDescription(TERM, "Spring 2026")));
        when(upstreamClient.getSubjects(anyString())).thenReturn(List.of(new CodeDescription("MAT", "Mathematics")));
    }

    @Test
    void dueSubjectIsEnqueuedScrapedDiffedAndRescheduled() throws Exception {
        Instant now = Instant.now();
        Instant lastScraped = now.minus(Duration.ofHours(6));
        scheduleRepository.save(new SubjectSchedule(
            "MAT", TERM, 120, Duration.ofHours(4), lastScraped, lastScraped, 0.0, 0, 0, 0, 10, 0,
            ScheduleState.COOLDOWN, null, lastScraped.plus(Duration.ofHours(4)), lastScraped
        ));
        List<CourseSnapshot> previous = courses(120, -1);
        for (CourseSnapshot course : previous) {
            courseRepository.upsert(course, lastScraped);
        }
        List<CourseSnapshot> fetched = courses(120, 3);
        when(upstreamClient.searchCourses(eq(TERM), eq("MAT"), anyInt(), anyInt(), anyInt()))
            .thenReturn(new CourseSearchPage(120, fetched));

        TickSummary first = scheduler.tick();
        TickSummary second = scheduler.tick();

        assertThat(first.jobsEnqueued()).isEqualTo(1);
        assertThat(first.stateTransitions()).isEqualTo(1);
        assertThat(second.jobsEnqueued()).isZero();
        assertThat(jobRepository.listJobs(JobStatus.PENDING, 10)).hasSize(1);

        ScrapeJob job = jobRepository.claimNext("worker-e2e-w0", Instant.now(), LOCK_EXPIRY).orElseThrow();
        assertThat(job.targetKey()).isEqualTo("MAT");
        assertThat(job.priority()).isEqualTo(ScrapePriority.NORMAL);

        ScrapeOutcome outcome = jobRunner.run(job, "worker-e2e-w0", RequestLane.BACKGROUND);

        assertThat(outcome.jobStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(outcome.result().success()).isTrue();
        assertThat(outcome.result().coursesFetched()).isEqualTo(120);
        assertThat(outcome.result().coursesChanged()).isEqualTo(3);
        assertThat(outcome.result().coursesUnchanged()).isEqualTo(117);
        assertThat(outcome.result().auditsGenerated()).isEqualTo(3);

        List<AuditEntry> audits = auditRepository.findByJob(job.id());
        assertThat(audits).hasSize(3);
        assertThat(audits).extracting(AuditEntry::fieldChanged).containsOnly("enrollment");
        assertThat(audits).extracting(AuditEntry::oldValue).containsOnly("20");
        assertThat(audits).extracting(AuditEntry::newValue).containsOnly("21");

        SubjectSchedule after = scheduleRepository.find("MAT").orElseThrow();
        assertThat(after.state()).isEqualTo(ScheduleState.COOLDOWN);
        assertThat(after.consecutiveFailures()).isZero();
        assertThat(after.lastScrapedAt()).isAfter(lastScraped);
        assertThat(after.nextEligibleAt()).isEqualTo(after.lastScrapedAt().plus(after.currentInterval()));
        assertThat(after.avgChangeRatio()).isGreaterThan(0.0);

        assertThat(courseRepository.findBySubject(TERM, "MAT").get("40000").enrollment()).isEqualTo(21);
        assertThat(jobRepository.findById(job.id()).orElseThrow().status()).isEqualTo(JobStatus.COMPLETED);

        List<StreamEvent> events = eventBuffer.recent(50);
        assertThat(events).extracting(StreamEvent::type).contains("job.enqueued", "job.completed", "result", "audit");
    }

    @Test
    void permanentUpstreamFailureFailsTheJobWithoutRetry() throws Exception {
        Instant now = Instant.now();
        scheduleRepository.save(SubjectSchedule.fresh("MAT", TERM, Duration.ofHours(1), now));
        when(upstreamClient.searchCourses(eq(TERM), eq("MAT"), anyInt(), anyInt(), anyInt()))
            .thenThrow(new UpstreamException(FailureKind.PERMANENT, "Search for MAT marked unsuccessful"));

        scheduler.tick();
        ScrapeJob job = jobRepository.claimNext("worker-e2e-w0", Instant.now(), LOCK_EXPIRY).orElseThrow();
        ScrapeOutcome outcome = jobRunner.run(job, "worker-e2e-w0", RequestLane.BACKGROUND);

        assertThat(outcome.jobStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(outcome.result().failureKind()).isEqualTo(FailureKind.PERMANENT);
        assertThat(outcome.result().errorMessage()).contains("marked unsuccessful");
        assertThat(scheduleRepository.find("MAT").orElseThrow().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void pausedSubjectIsNeverEnqueued() {
        Instant now = Instant.now();
        scheduleRepository.save(SubjectSchedule.fresh("MAT", TERM, Duration.ofHours(1), now.minus(Duration.ofDays(1)))
            .withState(ScheduleState.PAUSED, PausedReason.ADMIN, now));

        TickSummary summary = scheduler.tick();

        assertThat(summary.jobsEnqueued()).isZero();
        assertThat(jobRepository.findActiveTargetKeys(TargetType.SUBJECT)).isEmpty();
    }

    private static List<CourseSnapshot> courses(int count, int changed) {
        List<CourseSnapshot> courses = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int enrollment = i < changed ? 21 : 20;
            courses.add(new CourseSnapshot(
                TERM,
                String.valueOf(40000 + i),
                "MAT",
                String.valueOf(1000 + i),
                "Mathematics " + i,
                enrollment,
                30,
                0,
                5,
                30 - enrollment,
                true,
                "Staff",
                List.of()
            ));
        }
        return courses;
    }
}
