package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.ScraperSettingsView;
import com.coursesync.scrape.persistence.ScraperSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Effective scheduler settings: configured defaults overlaid with the overrides stored in
 * {@code scraper_settings}. Overrides live only in the store so every process converges on the same values.
 */
@Service
public class ScraperSettingsService {
    private static final Logger log = LoggerFactory.getLogger(ScraperSettingsService.class);

    static final String PRIORITY_SUBJECTS = "priority_subjects";
    static final String MIN_INTERVAL_MINUTES = "min_interval_minutes";
    static final String MAX_INTERVAL_HOURS = "max_interval_hours";
    static final String MIN_SPACING_MINUTES = "min_spacing_minutes";

    private final ScraperProperties.Scheduler defaults;
    private final ScraperSettingsRepository repository;
    private final Clock clock;
    private volatile ScraperSettingsView current;

    public ScraperSettingsService(ScraperProperties properties, ScraperSettingsRepository repository, Clock clock) {
        this.defaults = properties.getScheduler();
        this.repository = repository;
        this.clock = clock;
    }

    public ScraperSettingsView current() {
        ScraperSettingsView view = current;
        if (view == null) {
            view = reload();
        }
        return view;
    }

    public ScraperSettingsView reload() {
        Map<String, String> overrides = repository.findAll();
        List<String> prioritySubjects = defaults.getPrioritySubjects();
        if (overrides.containsKey(PRIORITY_SUBJECTS)) {
            prioritySubjects = parseSubjects(overrides.get(PRIORITY_SUBJECTS));
        }
        int minInterval = intOverride(overrides, MIN_INTERVAL_MINUTES, defaults.getMinIntervalMinutes());
        int maxInterval = intOverride(overrides, MAX_INTERVAL_HOURS, defaults.getMaxIntervalHours());
        int minSpacing = intOverride(overrides, MIN_SPACING_MINUTES, defaults.getMinSpacingMinutes());
        ScraperSettingsView view = new ScraperSettingsView(
            prioritySubjects,
            Math.max(1, minInterval),
            Math.max((int) Math.ceil(Math.max(1, minInterval) / 60.0), maxInterval),
            Math.max(0, minSpacing)
        );
        current = view;
        return view;
    }

    public ScraperSettingsView updatePrioritySubjects(List<String> subjects) {
        if (subjects == null) {
            throw new IllegalArgumentException("subjects is required");
        }
        List<String> normalized = ScraperProperties.normalizeSubjects(subjects);
        repository.put(PRIORITY_SUBJECTS, String.join(",", normalized), clock.instant());
        log.info("Priority subjects set to {}", normalized);
        return reload();
    }

    public ScraperSettingsView updateIntervals(Integer minIntervalMinutes, Integer maxIntervalHours, Integer minSpacingMinutes) {
        ScraperSettingsView view = current();
        int min = minIntervalMinutes == null ? view.minIntervalMinutes() : minIntervalMinutes;
        int max = maxIntervalHours == null ? view.maxIntervalHours() : maxIntervalHours;
        int spacing = minSpacingMinutes == null ? view.minSpacingMinutes() : minSpacingMinutes;
        if (min < 1) {
            throw new IllegalArgumentException("minIntervalMinutes must be at least 1");
        }
        if (spacing < 0) {
            throw new IllegalArgumentException("minSpacingMinutes must not be negative");
        }
        if ((long) max * 60 < min) {
            throw new IllegalArgumentException("maxIntervalHours must not be below minIntervalMinutes");
        }
        Instant now = clock.instant();
        repository.put(MIN_INTERVAL_MINUTES, String.valueOf(min), now);
        repository.put(MAX_INTERVAL_HOURS, String.valueOf(max), now);
        repository.put(MIN_SPACING_MINUTES, String.valueOf(spacing), now);
        log.info("Interval bounds set to [{}m, {}h], min spacing {}m", min, max, spacing);
        return reload();
    }

    public boolean isPrioritySubject(String subject) {
        return subject != null && current().prioritySubjects().contains(subject);
    }

    public Duration minInterval() {
        return Duration.ofMinutes(current().minIntervalMinutes());
    }

    public Duration maxInterval() {
        return Duration.ofHours(current().maxIntervalHours());
    }

    public Duration minSpacing() {
        return Duration.ofMinutes(current().minSpacingMinutes());
    }

    private static List<String> parseSubjects(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return ScraperProperties.normalizeSubjects(Arrays.asList(value.split(",")));
    }

    private static int intOverride(Map<String, String> overrides, String key, int fallback) {
        String value = overrides.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unreadable scraper setting {}={}", key, value);
            return fallback;
        }
    }
}
