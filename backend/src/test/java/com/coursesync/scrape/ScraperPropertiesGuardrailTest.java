package com.coursesync.scrape;

import com.coursesync.config.ScraperProperties;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScraperPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        ScraperProperties properties = new ScraperProperties();
        properties.getUpstream().setUserAgent("   ");
        assertTrue(properties.getUpstream().getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void baseUrlLosesTrailingSlashes() {
        ScraperProperties properties = new ScraperProperties();
        properties.getUpstream().setBaseUrl(" https://banner.example.edu/ssb// ");
        assertEquals("https://banner.example.edu/ssb", properties.getUpstream().getBaseUrl());
    }

    @Test
    void workerSettingsAreClamped() {
        ScraperProperties properties = new ScraperProperties();
        properties.getWorker().setWorkerCount(0);
        properties.getWorker().setPollIntervalMs(5);
        properties.getWorker().setShutdownTimeoutSeconds(60);
        properties.getWorker().setMaxRetries(-2);
        properties.getWorker().setRetryBackoffSeconds(List.of());
        assertEquals(1, properties.getWorker().getWorkerCount());
        assertEquals(100, properties.getWorker().getPollIntervalMs());
        assertEquals(7, properties.getWorker().getShutdownTimeoutSeconds());
        assertEquals(0, properties.getWorker().getMaxRetries());
        assertEquals(List.of(30), properties.getWorker().getRetryBackoffSeconds());
    }

    @Test
    void maxIntervalNeverDropsBelowMinInterval() {
        ScraperProperties properties = new ScraperProperties();
        properties.getScheduler().setMinIntervalMinutes(150);
        properties.getScheduler().setMaxIntervalHours(1);
        assertEquals(3, properties.getScheduler().getMaxIntervalHours());
    }

    @Test
    void prioritySubjectsAreNormalized() {
        ScraperProperties properties = new ScraperProperties();
        properties.getScheduler().setPrioritySubjects(Arrays.asList(" cs", "MAT", null, "", "CS"));
        assertEquals(List.of("CS", "MAT"), properties.getScheduler().getPrioritySubjects());
    }

    @Test
    void blankCurrentTermMeansDiscover() {
        ScraperProperties properties = new ScraperProperties();
        properties.getTerm().setCurrent("  ");
        assertNull(properties.getTerm().getCurrent());
    }
}
