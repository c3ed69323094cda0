package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.persistence.ScraperSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.Mockito.when;

class IntervalPolicyTest {
    private static final double NO_JITTER = 0.5;

    private IntervalPolicy policy;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.getScheduler().setMinIntervalMinutes(60);
        properties.getScheduler().setMaxIntervalHours(48);
        properties.getScheduler().setFailureBackoffMinutes(List.of(15, 60, 240));
        ScraperSettingsRepository repository = Mockito.mock(ScraperSettingsRepository.class);
        when(repository.findAll()).thenReturn(Map.of());
        ScraperSettingsService settings = new ScraperSettingsService(properties, repository, Clock.systemUTC());
        policy = new IntervalPolicy(properties, settings);
    }

    @Test
    void baseIntervalScalesWithSubjectSize() {
        assertThat(policy.baseInterval(500)).isEqualTo(Duration.ofHours(5));
        assertThat(policy.baseInterval(50)).isEqualTo(Duration.ofMinutes(30));
        assertThat(policy.baseInterval(1)).isEqualTo(Duration.ofHours(12));
        assertThat(policy.baseInterval(49)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void largeSubjectWithoutFeedbackRestsFiveHours() {
        Duration interval = policy.computeInterval(inputs(500, false, false, 0, 0.0), NO_JITTER, 0.0);
        assertThat(interval).isEqualTo(Duration.ofHours(5));
    }

    @Test
    void prioritySubjectIsScrapedThreeTimesAsOften() {
        Duration interval = policy.computeInterval(inputs(500, true, false, 0, 0.0), NO_JITTER, 0.0);
        assertThat(interval).isEqualTo(Duration.ofMinutes(100));
    }

    @Test
    void intervalBelowMinimumIsFlooredWithExtension() {
        Duration interval = policy.computeInterval(inputs(60, false, false, 0, 0.0), NO_JITTER, 0.5);
        assertThat(interval).isEqualTo(Duration.ofMinutes(67).plusSeconds(30));

        Duration noExtension = policy.computeInterval(inputs(60, false, false, 0, 0.0), NO_JITTER, 0.0);
        assertThat(noExtension).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void archivedTermIsClampedToMaximum() {
        Duration interval = policy.computeInterval(inputs(2000, false, true, 0, 0.0), NO_JITTER, 0.0);
        assertThat(interval).isEqualTo(Duration.ofHours(48));
    }

    @Test
    void emptyFetchWaitsTwelveHours() {
        Duration interval = policy.computeInterval(inputs(0, true, false, 0, 0.0), 0.0, 0.0);
        assertThat(interval).isEqualTo(Duration.ofHours(12));
    }

    @Test
    void jitterStaysWithinFifteenPercent() {
        Duration low = policy.computeInterval(inputs(500, false, false, 0, 0.0), 0.0, 0.0);
        Duration high = policy.computeInterval(inputs(500, false, false, 0, 0.0), 0.999999, 0.0);
        assertThat(low).isEqualTo(Duration.ofMinutes(255));
        assertThat(high).isLessThanOrEqualTo(Duration.ofMinutes(345));
        assertThat(high).isGreaterThan(Duration.ofMinutes(344));

        for (int i = 0; i < 50; i++) {
            Duration random = policy.computeInterval(inputs(500, false, false, 0, 0.0));
            assertThat(random).isBetween(Duration.ofMinutes(255), Duration.ofMinutes(345));
        }
    }

    @Test
    void feedbackStretchesQuietSubjectsAndShrinksBusyOnes() {
        assertThat(policy.feedbackFactor(0, 0.0)).isEqualTo(1.0);
        assertThat(policy.feedbackFactor(3, 0.0)).isCloseTo(1.3, offset(1e-9));
        assertThat(policy.feedbackFactor(50, 0.0)).isCloseTo(2.0, offset(1e-9));
        assertThat(policy.feedbackFactor(0, 0.2)).isEqualTo(0.5);
        assertThat(policy.feedbackFactor(0, 0.07)).isEqualTo(0.75);

        Duration busy = policy.computeInterval(inputs(500, false, false, 0, 0.5), NO_JITTER, 0.0);
        assertThat(busy).isEqualTo(Duration.ofMinutes(150));
    }

    @Test
    void failureBackoffWalksTheConfiguredSteps() {
        assertThat(policy.failureBackoff(1)).isEqualTo(Duration.ofMinutes(15));
        assertThat(policy.failureBackoff(2)).isEqualTo(Duration.ofMinutes(60));
        assertThat(policy.failureBackoff(3)).isEqualTo(Duration.ofMinutes(240));
        assertThat(policy.failureBackoff(9)).isEqualTo(Duration.ofMinutes(240));
    }

    private static IntervalPolicy.Inputs inputs(
        int courses,
        boolean priority,
        boolean archived,
        int zeroRuns,
        double changeRatio
    ) {
        return new IntervalPolicy.Inputs(courses, priority, archived, zeroRuns, changeRatio);
    }
}
