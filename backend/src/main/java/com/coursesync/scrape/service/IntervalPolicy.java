package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Computes how long a subject rests after a successful scrape. Larger subjects change more in absolute terms
 * but each record is worth less, so the interval grows with size; feedback from recent runs stretches or
 * shrinks it, and jitter keeps subjects from synchronizing.
 */
@Component
public class IntervalPolicy {
    private final ScraperProperties.Scheduler config;
    private final ScraperSettingsService settings;

    public IntervalPolicy(ScraperProperties properties, ScraperSettingsService settings) {
        this.config = properties.getScheduler();
        this.settings = settings;
    }

    public record Inputs(
        int courseCount,
        boolean prioritySubject,
        boolean archived,
        int consecutiveZeroChanges,
        double avgChangeRatio
    ) {
    }

    public Duration computeInterval(Inputs inputs) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return computeInterval(inputs, random.nextDouble(), random.nextDouble());
    }

    /**
     * @param jitterUnit uniform draw in [0, 1) mapped onto the symmetric jitter range
     * @param floorUnit uniform draw in [0, 1) for the floor extension
     */
    Duration computeInterval(Inputs inputs, double jitterUnit, double floorUnit) {
        Duration min = settings.minInterval();
        Duration max = settings.maxInterval();
        if (inputs.courseCount() <= 0) {
            return clamp(Duration.ofHours(config.getEmptyFetchHours()), min, max);
        }

        double seconds = baseInterval(inputs.courseCount()).getSeconds();
        if (inputs.prioritySubject()) {
            seconds /= config.getPriorityDivisor();
        }
        if (inputs.archived()) {
            seconds *= config.getArchivedMultiplier();
        }
        seconds *= feedbackFactor(inputs.consecutiveZeroChanges(), inputs.avgChangeRatio());
        seconds *= 1.0 + config.getJitterFraction() * (2.0 * jitterUnit - 1.0);

        Duration interval = Duration.ofSeconds(Math.round(seconds));
        if (interval.compareTo(min) < 0) {
            long extension = Math.round(Duration.ofMinutes(config.getFloorExtensionMinutes()).getSeconds() * floorUnit);
            interval = min.plusSeconds(extension);
        }
        return clamp(interval, min, max);
    }

    /**
     * Size-only interval: count / 100 hours from 50 courses up, linear from 12h at 1 course to 1h at 49.
     */
    public Duration baseInterval(int courseCount) {
        if (courseCount <= 0) {
            return Duration.ofHours(config.getEmptyFetchHours());
        }
        double hours;
        if (courseCount >= 50) {
            hours = courseCount / 100.0;
        } else {
            hours = 12.0 - (courseCount - 1) * (11.0 / 48.0);
        }
        return Duration.ofSeconds(Math.round(hours * 3600.0));
    }

    double feedbackFactor(int consecutiveZeroChanges, double avgChangeRatio) {
        int zeroRuns = Math.min(Math.max(0, consecutiveZeroChanges), config.getZeroChangeCap());
        double factor = 1.0 + config.getZeroChangeGrowth() * zeroRuns;
        if (avgChangeRatio >= config.getHighChangeThreshold()) {
            factor *= config.getHighChangeFactor();
        } else if (avgChangeRatio >= config.getModerateChangeThreshold()) {
            factor *= config.getModerateChangeFactor();
        }
        return factor;
    }

    public Duration failureBackoff(int consecutiveFailures) {
        List<Integer> steps = config.getFailureBackoffMinutes();
        int index = Math.min(Math.max(0, consecutiveFailures - 1), steps.size() - 1);
        return Duration.ofMinutes(Math.max(1, steps.get(index)));
    }

    private static Duration clamp(Duration value, Duration min, Duration max) {
        if (value.compareTo(min) < 0) {
            return min;
        }
        if (value.compareTo(max) > 0) {
            return max;
        }
        return value;
    }
}
