package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.PausedReason;
import com.coursesync.scrape.model.ScheduleDecision;
import com.coursesync.scrape.model.ScheduleState;
import com.coursesync.scrape.model.ScrapePriority;
import com.coursesync.scrape.model.SubjectSchedule;
import com.coursesync.scrape.persistence.ScraperSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class StalenessAnalyzerTest {
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private StalenessAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.getScheduler().setPrioritySubjects(List.of("CS"));
        properties.getScheduler().setMinSpacingMinutes(5);
        ScraperSettingsRepository repository = Mockito.mock(ScraperSettingsRepository.class);
        when(repository.findAll()).thenReturn(Map.of());
        ScraperSettingsService settings = new ScraperSettingsService(properties, repository, Clock.systemUTC());
        analyzer = new StalenessAnalyzer(properties, settings);
    }

    @Test
    void cooledDownSubjectPastIntervalIsEnqueuedAtNormalPriority() {
        SubjectSchedule schedule = schedule("MAT", ScheduleState.COOLDOWN, null, Duration.ofHours(4), NOW.minus(Duration.ofHours(6)));

        ScheduleDecision decision = analyzer.evaluate(schedule, NOW);

        assertThat(decision.enqueue()).isTrue();
        assertThat(decision.transitioned()).isTrue();
        assertThat(decision.schedule().state()).isEqualTo(ScheduleState.ELIGIBLE);
        assertThat(decision.priority()).isEqualTo(ScrapePriority.NORMAL);
    }

    @Test
    void cooldownNotYetExpiredIsSkipped() {
        SubjectSchedule schedule = schedule("MAT", ScheduleState.COOLDOWN, null, Duration.ofHours(4), NOW.minus(Duration.ofHours(1)));

        ScheduleDecision decision = analyzer.evaluate(schedule, NOW);

        assertThat(decision.enqueue()).isFalse();
        assertThat(decision.transitioned()).isFalse();
    }

    @Test
    void subjectOverTwiceItsIntervalIsHighPriority() {
        SubjectSchedule schedule = schedule("MAT", ScheduleState.COOLDOWN, null, Duration.ofHours(2), NOW.minus(Duration.ofHours(5)));

        assertThat(analyzer.evaluate(schedule, NOW).priority()).isEqualTo(ScrapePriority.HIGH);
    }

    @Test
    void prioritySubjectIsUrgent() {
        SubjectSchedule schedule = schedule("CS", ScheduleState.COOLDOWN, null, Duration.ofHours(2), NOW.minus(Duration.ofHours(3)));

        assertThat(analyzer.evaluate(schedule, NOW).priority()).isEqualTo(ScrapePriority.URGENT);
    }

    @Test
    void readOnlySubjectIsLowPriority() {
        SubjectSchedule schedule = schedule("HIS", ScheduleState.READ_ONLY, null, Duration.ofHours(20), NOW.minus(Duration.ofHours(21)));

        ScheduleDecision decision = analyzer.evaluate(schedule, NOW);

        assertThat(decision.enqueue()).isTrue();
        assertThat(decision.transitioned()).isFalse();
        assertThat(decision.priority()).isEqualTo(ScrapePriority.LOW);
    }

    @Test
    void adminPauseIsNeverOverridden() {
        SubjectSchedule schedule = schedule("MAT", ScheduleState.PAUSED, PausedReason.ADMIN, Duration.ofHours(1), NOW.minus(Duration.ofDays(10)));

        ScheduleDecision decision = analyzer.evaluate(schedule, NOW);

        assertThat(decision.enqueue()).isFalse();
        assertThat(decision.schedule().state()).isEqualTo(ScheduleState.PAUSED);
    }

    @Test
    void failurePauseIsProbedAfterSixHours() {
        SubjectSchedule recent = schedule("MAT", ScheduleState.PAUSED, PausedReason.FAILURES, Duration.ofHours(1), NOW.minus(Duration.ofHours(2)));
        assertThat(analyzer.evaluate(recent, NOW).enqueue()).isFalse();

        SubjectSchedule old = schedule("MAT", ScheduleState.PAUSED, PausedReason.FAILURES, Duration.ofHours(1), NOW.minus(Duration.ofHours(7)));
        ScheduleDecision decision = analyzer.evaluate(old, NOW);
        assertThat(decision.enqueue()).isTrue();
        assertThat(decision.transitioned()).isTrue();
        assertThat(decision.schedule().state()).isEqualTo(ScheduleState.ELIGIBLE);
        assertThat(decision.schedule().pausedReason()).isNull();
    }

    @Test
    void minimumSpacingHoldsBackRecentlyTouchedSubject() {
        SubjectSchedule base = schedule("MAT", ScheduleState.ELIGIBLE, null, Duration.ofHours(1), NOW.minus(Duration.ofHours(3)));
        SubjectSchedule attemptedJustNow = new SubjectSchedule(
            base.subject(), base.termCode(), base.courseCount(), base.currentInterval(), base.lastScrapedAt(),
            NOW.minus(Duration.ofMinutes(2)), 0.0, 0, 0, 1, 1, 1, ScheduleState.ELIGIBLE, null,
            NOW.minus(Duration.ofMinutes(1)), NOW
        );

        ScheduleDecision decision = analyzer.evaluate(attemptedJustNow, NOW);

        assertThat(decision.enqueue()).isFalse();
        assertThat(decision.reason()).contains("spacing");
    }

    @Test
    void readOnlySubjectStaysLowEvenWhenStale() {
        SubjectSchedule schedule = schedule("HIS", ScheduleState.READ_ONLY, null, Duration.ofHours(25), NOW.minus(Duration.ofHours(60)));

        ScheduleDecision decision = analyzer.evaluate(schedule, NOW);

        assertThat(analyzer.isStale(schedule, NOW)).isTrue();
        assertThat(decision.enqueue()).isTrue();
        assertThat(decision.priority()).isEqualTo(ScrapePriority.LOW);
    }

    @Test
    void emptyFetchPauseIsRetriedAfterThePauseInterval() {
        SubjectSchedule recent = schedule("MAT", ScheduleState.PAUSED, PausedReason.EMPTY_FETCHES, Duration.ofHours(1), NOW.minus(Duration.ofHours(3)));
        SubjectSchedule old = schedule("MAT", ScheduleState.PAUSED, PausedReason.EMPTY_FETCHES, Duration.ofHours(1), NOW.minus(Duration.ofHours(7)));

        assertThat(analyzer.evaluate(recent, NOW).enqueue()).isFalse();
        ScheduleDecision resumed = analyzer.evaluate(old, NOW);
        assertThat(resumed.enqueue()).isTrue();
        assertThat(resumed.transitioned()).isTrue();
        assertThat(resumed.schedule().state()).isEqualTo(ScheduleState.ELIGIBLE);
        assertThat(resumed.schedule().pausedReason()).isNull();
    }

    @Test
    void freshSubjectIsDueImmediately() {
        SubjectSchedule schedule = SubjectSchedule.fresh("ART", "202610", Duration.ofHours(1), NOW);

        ScheduleDecision decision = analyzer.evaluate(schedule, NOW);

        assertThat(decision.enqueue()).isTrue();
        assertThat(decision.priority()).isEqualTo(ScrapePriority.NORMAL);
    }

    private static SubjectSchedule schedule(
        String subject,
        ScheduleState state,
        PausedReason reason,
        Duration interval,
        Instant lastScrapedAt
    ) {
        return new SubjectSchedule(
            subject,
            "202610",
            200,
            interval,
            lastScrapedAt,
            lastScrapedAt,
            0.0,
            0,
            0,
            0,
            5,
            0,
            state,
            reason,
            lastScrapedAt.plus(interval),
            lastScrapedAt
        );
    }
}
