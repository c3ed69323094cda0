package com.coursesync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/113.0.0.0 Safari/537.36";

    private Upstream upstream = new Upstream();
    private Session session = new Session();
    private RateLimit rateLimit = new RateLimit();
    private Scheduler scheduler = new Scheduler();
    private Worker worker = new Worker();
    private Term term = new Term();

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Term getTerm() {
        return term;
    }

    public void setTerm(Term term) {
        this.term = term;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static List<String> normalizeSubjects(List<String> subjects) {
        List<String> normalized = new ArrayList<>();
        if (subjects == null) {
            return normalized;
        }
        for (String subject : subjects) {
            if (subject == null || subject.isBlank()) {
                continue;
            }
            String code = subject.trim().toUpperCase(Locale.ROOT);
            if (!normalized.contains(code)) {
                normalized.add(code);
            }
        }
        return normalized;
    }

    public static class Upstream {
        private String baseUrl = "https://ssbprod.utsa.edu/StudentRegistrationSsb/ssb";
        private String userAgent;
        private int requestTimeoutSeconds = 30;
        private int requestMaxRetries = 2;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 5000;
        private int pageSize = 500;
        private boolean fetchMissingMeetingTimes = false;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            String value = baseUrl == null ? "" : baseUrl.trim();
            while (value.endsWith("/")) {
                value = value.substring(0, value.length() - 1);
            }
            this.baseUrl = value;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getRequestMaxRetries() {
            return Math.max(0, requestMaxRetries);
        }

        public void setRequestMaxRetries(int requestMaxRetries) {
            this.requestMaxRetries = requestMaxRetries;
        }

        public int getRequestRetryBaseDelayMs() {
            return requestRetryBaseDelayMs;
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
        }

        public int getRequestRetryMaxDelayMs() {
            return requestRetryMaxDelayMs;
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
        }

        public int getPageSize() {
            return Math.max(1, Math.min(pageSize, 500));
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public boolean isFetchMissingMeetingTimes() {
            return fetchMissingMeetingTimes;
        }

        public void setFetchMissingMeetingTimes(boolean fetchMissingMeetingTimes) {
            this.fetchMissingMeetingTimes = fetchMissingMeetingTimes;
        }
    }

    public static class Session {
        private int validityMinutes = 25;
        private int tokenPrefixLength = 5;

        public Duration validity() {
            return Duration.ofMinutes(getValidityMinutes());
        }

        public int getValidityMinutes() {
            return Math.max(1, validityMinutes);
        }

        public void setValidityMinutes(int validityMinutes) {
            this.validityMinutes = validityMinutes;
        }

        public int getTokenPrefixLength() {
            return Math.max(1, tokenPrefixLength);
        }

        public void setTokenPrefixLength(int tokenPrefixLength) {
            this.tokenPrefixLength = tokenPrefixLength;
        }
    }

    public static class RateLimit {
        private double bucketCapacity = 20;
        private double refillPerMinute = 30;
        private double burstCapacity = 5;
        private double burstRefillPerMinute = 5;
        private double searchCostPerRecord = 0.0125;
        private double defaultCost = 1.0;
        private Map<String, Double> costs = new LinkedHashMap<>();

        public double getBucketCapacity() {
            return Math.max(1.0, bucketCapacity);
        }

        public void setBucketCapacity(double bucketCapacity) {
            this.bucketCapacity = bucketCapacity;
        }

        public double getRefillPerMinute() {
            return Math.max(0.01, refillPerMinute);
        }

        public void setRefillPerMinute(double refillPerMinute) {
            this.refillPerMinute = refillPerMinute;
        }

        public double getBurstCapacity() {
            return Math.max(0.0, burstCapacity);
        }

        public void setBurstCapacity(double burstCapacity) {
            this.burstCapacity = burstCapacity;
        }

        public double getBurstRefillPerMinute() {
            return Math.max(0.0, burstRefillPerMinute);
        }

        public void setBurstRefillPerMinute(double burstRefillPerMinute) {
            this.burstRefillPerMinute = burstRefillPerMinute;
        }

        public double getSearchCostPerRecord() {
            return Math.max(0.0, searchCostPerRecord);
        }

        public void setSearchCostPerRecord(double searchCostPerRecord) {
            this.searchCostPerRecord = searchCostPerRecord;
        }

        public double getDefaultCost() {
            return Math.max(0.0, defaultCost);
        }

        public void setDefaultCost(double defaultCost) {
            this.defaultCost = defaultCost;
        }

        public Map<String, Double> getCosts() {
            return costs;
        }

        public void setCosts(Map<String, Double> costs) {
            this.costs = costs == null ? new LinkedHashMap<>() : costs;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int tickSeconds = 60;
        private List<String> prioritySubjects = new ArrayList<>();
        private int minSpacingMinutes = 5;
        private int catalogRefreshMinutes = 240;
        private int referenceDataMinutes = 360;
        private int ratingDataMinutes = 1440;
        private int minIntervalMinutes = 60;
        private int maxIntervalHours = 48;
        private int floorExtensionMinutes = 15;
        private double jitterFraction = 0.15;
        private double priorityDivisor = 3;
        private double archivedMultiplier = 5;
        private int emptyFetchHours = 12;
        private double staleFactor = 2.0;
        private double zeroChangeGrowth = 0.1;
        private int zeroChangeCap = 10;
        private double highChangeThreshold = 0.10;
        private double highChangeFactor = 0.5;
        private double moderateChangeThreshold = 0.05;
        private double moderateChangeFactor = 0.75;
        private double changeRatioSmoothing = 0.3;
        private int recentRunWindow = 20;
        private List<Integer> failureBackoffMinutes = new ArrayList<>(List.of(15, 60, 240));
        private int pauseAfterFailures = 5;
        private int pauseAfterEmptyFetches = 3;
        private int pauseProbeHours = 6;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTickSeconds() {
            return Math.max(1, tickSeconds);
        }

        public void setTickSeconds(int tickSeconds) {
            this.tickSeconds = tickSeconds;
        }

        public List<String> getPrioritySubjects() {
            return normalizeSubjects(prioritySubjects);
        }

        public void setPrioritySubjects(List<String> prioritySubjects) {
            this.prioritySubjects = normalizeSubjects(prioritySubjects);
        }

        public int getMinSpacingMinutes() {
            return Math.max(0, minSpacingMinutes);
        }

        public void setMinSpacingMinutes(int minSpacingMinutes) {
            this.minSpacingMinutes = minSpacingMinutes;
        }

        public int getCatalogRefreshMinutes() {
            return Math.max(1, catalogRefreshMinutes);
        }

        public void setCatalogRefreshMinutes(int catalogRefreshMinutes) {
            this.catalogRefreshMinutes = catalogRefreshMinutes;
        }

        public int getReferenceDataMinutes() {
            return Math.max(1, referenceDataMinutes);
        }

        public void setReferenceDataMinutes(int referenceDataMinutes) {
            this.referenceDataMinutes = referenceDataMinutes;
        }

        public int getRatingDataMinutes() {
            return Math.max(1, ratingDataMinutes);
        }

        public void setRatingDataMinutes(int ratingDataMinutes) {
            this.ratingDataMinutes = ratingDataMinutes;
        }

        public int getMinIntervalMinutes() {
            return Math.max(1, minIntervalMinutes);
        }

        public void setMinIntervalMinutes(int minIntervalMinutes) {
            this.minIntervalMinutes = minIntervalMinutes;
        }

        public int getMaxIntervalHours() {
            int floorHours = (int) Math.ceil(getMinIntervalMinutes() / 60.0);
            return Math.max(floorHours, maxIntervalHours);
        }

        public void setMaxIntervalHours(int maxIntervalHours) {
            this.maxIntervalHours = maxIntervalHours;
        }

        public int getFloorExtensionMinutes() {
            return Math.max(0, floorExtensionMinutes);
        }

        public void setFloorExtensionMinutes(int floorExtensionMinutes) {
            this.floorExtensionMinutes = floorExtensionMinutes;
        }

        public double getJitterFraction() {
            return Math.max(0.0, Math.min(jitterFraction, 0.5));
        }

        public void setJitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
        }

        public double getPriorityDivisor() {
            return Math.max(1.0, priorityDivisor);
        }

        public void setPriorityDivisor(double priorityDivisor) {
            this.priorityDivisor = priorityDivisor;
        }

        public double getArchivedMultiplier() {
            return Math.max(1.0, archivedMultiplier);
        }

        public void setArchivedMultiplier(double archivedMultiplier) {
            this.archivedMultiplier = archivedMultiplier;
        }

        public int getEmptyFetchHours() {
            return Math.max(1, emptyFetchHours);
        }

        public void setEmptyFetchHours(int emptyFetchHours) {
            this.emptyFetchHours = emptyFetchHours;
        }

        public double getStaleFactor() {
            return Math.max(1.0, staleFactor);
        }

        public void setStaleFactor(double staleFactor) {
            this.staleFactor = staleFactor;
        }

        public double getZeroChangeGrowth() {
            return Math.max(0.0, zeroChangeGrowth);
        }

        public void setZeroChangeGrowth(double zeroChangeGrowth) {
            this.zeroChangeGrowth = zeroChangeGrowth;
        }

        public int getZeroChangeCap() {
            return Math.max(0, zeroChangeCap);
        }

        public void setZeroChangeCap(int zeroChangeCap) {
            this.zeroChangeCap = zeroChangeCap;
        }

        public double getHighChangeThreshold() {
            return highChangeThreshold;
        }

        public void setHighChangeThreshold(double highChangeThreshold) {
            this.highChangeThreshold = highChangeThreshold;
        }

        public double getHighChangeFactor() {
            return clampFactor(highChangeFactor);
        }

        public void setHighChangeFactor(double highChangeFactor) {
            this.highChangeFactor = highChangeFactor;
        }

        public double getModerateChangeThreshold() {
            return moderateChangeThreshold;
        }

        public void setModerateChangeThreshold(double moderateChangeThreshold) {
            this.moderateChangeThreshold = moderateChangeThreshold;
        }

        public double getModerateChangeFactor() {
            return clampFactor(moderateChangeFactor);
        }

        public void setModerateChangeFactor(double moderateChangeFactor) {
            this.moderateChangeFactor = moderateChangeFactor;
        }

        public double getChangeRatioSmoothing() {
            return Math.max(0.01, Math.min(changeRatioSmoothing, 1.0));
        }

        public void setChangeRatioSmoothing(double changeRatioSmoothing) {
            this.changeRatioSmoothing = changeRatioSmoothing;
        }

        public int getRecentRunWindow() {
            return Math.max(1, recentRunWindow);
        }

        public void setRecentRunWindow(int recentRunWindow) {
            this.recentRunWindow = recentRunWindow;
        }

        public List<Integer> getFailureBackoffMinutes() {
            if (failureBackoffMinutes == null || failureBackoffMinutes.isEmpty()) {
                return List.of(15);
            }
            return failureBackoffMinutes;
        }

        public void setFailureBackoffMinutes(List<Integer> failureBackoffMinutes) {
            this.failureBackoffMinutes = failureBackoffMinutes;
        }

        public int getPauseAfterFailures() {
            return Math.max(1, pauseAfterFailures);
        }

        public void setPauseAfterFailures(int pauseAfterFailures) {
            this.pauseAfterFailures = pauseAfterFailures;
        }

        public int getPauseAfterEmptyFetches() {
            return Math.max(1, pauseAfterEmptyFetches);
        }

        public void setPauseAfterEmptyFetches(int pauseAfterEmptyFetches) {
            this.pauseAfterEmptyFetches = pauseAfterEmptyFetches;
        }

        public int getPauseProbeHours() {
            return Math.max(1, pauseProbeHours);
        }

        public void setPauseProbeHours(int pauseProbeHours) {
            this.pauseProbeHours = pauseProbeHours;
        }

        private static double clampFactor(double factor) {
            return Math.max(0.05, Math.min(factor, 1.0));
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int workerCount = 4;
        private int pollIntervalMs = 5000;
        private int lockExpiryMinutes = 10;
        private int jobTimeoutSeconds = 300;
        private int maxRetries = 3;
        private List<Integer> retryBackoffSeconds = new ArrayList<>(List.of(30, 120, 600));
        private int shutdownTimeoutSeconds = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Duration lockExpiry() {
            return Duration.ofMinutes(getLockExpiryMinutes());
        }

        public int getLockExpiryMinutes() {
            return Math.max(1, lockExpiryMinutes);
        }

        public void setLockExpiryMinutes(int lockExpiryMinutes) {
            this.lockExpiryMinutes = lockExpiryMinutes;
        }

        public int getJobTimeoutSeconds() {
            return Math.max(1, jobTimeoutSeconds);
        }

        public void setJobTimeoutSeconds(int jobTimeoutSeconds) {
            this.jobTimeoutSeconds = jobTimeoutSeconds;
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public List<Integer> getRetryBackoffSeconds() {
            if (retryBackoffSeconds == null || retryBackoffSeconds.isEmpty()) {
                return List.of(30);
            }
            return retryBackoffSeconds;
        }

        public void setRetryBackoffSeconds(List<Integer> retryBackoffSeconds) {
            this.retryBackoffSeconds = retryBackoffSeconds;
        }

        public int getShutdownTimeoutSeconds() {
            return Math.max(1, Math.min(shutdownTimeoutSeconds, 7));
        }

        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
            this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        }
    }

    public static class Term {
        private String current;
        private List<String> archived = new ArrayList<>();

        public String getCurrent() {
            return current == null || current.isBlank() ? null : current.trim();
        }

        public void setCurrent(String current) {
            this.current = current;
        }

        public List<String> getArchived() {
            return archived;
        }

        public void setArchived(List<String> archived) {
            this.archived = archived == null ? new ArrayList<>() : archived;
        }
    }
}
