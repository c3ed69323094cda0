package com.coursesync.scrape.upstream;

import com.coursesync.scrape.http.UpstreamCostTable;
import com.coursesync.scrape.http.UpstreamHttpClient;
import com.coursesync.scrape.model.CodeDescription;
import com.coursesync.scrape.model.CourseSearchPage;
import com.coursesync.scrape.model.CourseSnapshot;
import com.coursesync.scrape.model.FailureKind;
import com.coursesync.scrape.model.HttpFetchResult;
import com.coursesync.scrape.model.MeetingTime;
import com.coursesync.scrape.model.UpstreamEndpoint;
import com.coursesync.scrape.session.SessionKeeper;
import com.coursesync.scrape.util.FailureClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Service
public class BannerUpstreamClient implements UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(BannerUpstreamClient.class);
    private static final String JSON_ACCEPT = "application/json, text/javascript, */*; q=0.01";
    private static final int LOOKUP_PAGE_SIZE = 500;

    private final UpstreamHttpClient http;
    private final SessionKeeper sessionKeeper;
    private final UpstreamCostTable costTable;
    private final BannerCourseMapper courseMapper;
    private final ObjectMapper objectMapper;
    private final Object setupLock = new Object();
    private String preparedToken;

    public BannerUpstreamClient(
        UpstreamHttpClient http,
        SessionKeeper sessionKeeper,
        UpstreamCostTable costTable,
        BannerCourseMapper courseMapper,
        ObjectMapper objectMapper
    ) {
        this.http = http;
        this.sessionKeeper = sessionKeeper;
        this.costTable = costTable;
        this.courseMapper = courseMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CodeDescription> getTerms() {
        return withSession(token -> {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("searchTerm", "");
            query.put("offset", "1");
            query.put("max", String.valueOf(LOOKUP_PAGE_SIZE));
            query.put("_", nonce());
            return codeDescriptions(fetchJson(UpstreamEndpoint.TERMS, http.url("/classSearch/getTerms", query)));
        });
    }

    @Override
    public List<CodeDescription> getSubjects(String term) {
        return lookup(UpstreamEndpoint.SUBJECTS, "/classSearch/get_subject", term);
    }

    @Override
    public List<CodeDescription> getCampuses(String term) {
        return lookup(UpstreamEndpoint.CAMPUSES, "/classSearch/get_campus", term);
    }

    @Override
    public List<CodeDescription> getInstructionalMethods(String term) {
        return lookup(UpstreamEndpoint.INSTRUCTIONAL_METHODS, "/classSearch/get_instructionalMethod", term);
    }

    @Override
    public CourseSearchPage searchCourses(String term, String subject, int offset, int pageSize, int expectedRecords) {
        return withSession(token -> {
            ensureTermSelected(token, term);
            resetDataForm();

            Map<String, String> query = new LinkedHashMap<>();
            query.put("txt_subject", subject);
            query.put("txt_term", term);
            query.put("startDatepicker", "");
            query.put("endDatepicker", "");
            query.put("uniqueSessionId", token);
            query.put("pageOffset", String.valueOf(Math.max(0, offset)));
            query.put("pageMaxSize", String.valueOf(Math.max(1, pageSize)));
            query.put("sortColumn", "subjectDescription");
            query.put("sortDirection", "asc");
            HttpFetchResult result = http.get(
                http.url("/searchResults/searchResults", query),
                JSON_ACCEPT,
                costTable.searchCost(expectedRecords)
            );
            JsonNode root = parseJson(result);
            if (!root.path("success").asBoolean(false)) {
                throw new UpstreamException(FailureKind.PERMANENT, "Search for " + subject + " marked unsuccessful");
            }
            JsonNode data = root.get("data");
            if (data == null || data.isNull()) {
                throw new UpstreamException(
                    FailureKind.SESSION_EXPIRED,
                    "Search for " + subject + " returned no data, session not bound to term"
                );
            }
            List<CourseSnapshot> courses = new ArrayList<>();
            for (JsonNode node : data) {
                try {
                    courses.add(courseMapper.toSnapshot(node, term));
                } catch (IllegalArgumentException e) {
                    throw new UpstreamException(FailureKind.PERMANENT, e.getMessage(), 0, e);
                }
            }
            return new CourseSearchPage(root.path("totalCount").asInt(courses.size()), courses);
        });
    }

    @Override
    public List<MeetingTime> getMeetingTimes(String term, String crn) {
        return withSession(token -> {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("term", term);
            query.put("courseReferenceNumber", crn);
            JsonNode root = fetchJson(
                UpstreamEndpoint.MEETING_TIMES,
                http.url("/searchResults/getFacultyMeetingTimes", query)
            );
            return courseMapper.meetingTimes(root.path("fmt"));
        });
    }

    private List<CodeDescription> lookup(UpstreamEndpoint endpoint, String path, String term) {
        return withSession(token -> {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("searchTerm", "");
            query.put("term", term);
            query.put("offset", "1");
            query.put("max", String.valueOf(LOOKUP_PAGE_SIZE));
            query.put("uniqueSessionId", token);
            query.put("_", nonce());
            return codeDescriptions(fetchJson(endpoint, http.url(path, query)));
        });
    }

    /**
     * Runs a call with the current session. When the upstream says the session is gone the session is rotated
     * and the call retried once; a second rejection is reported as transient.
     */
    private <T> T withSession(Function<String, T> call) {
        String token = prepare(sessionKeeper.ensureSession());
        try {
            T value = call.apply(token);
            sessionKeeper.notifyActivity(token);
            return value;
        } catch (UpstreamException e) {
            if (e.kind() != FailureKind.SESSION_EXPIRED) {
                throw e;
            }
            log.info("Upstream session expired mid-call ({}), rotating", e.getMessage());
        }
        String rotated = prepare(sessionKeeper.invalidate(token));
        try {
            T value = call.apply(rotated);
            sessionKeeper.notifyActivity(rotated);
            return value;
        } catch (UpstreamException e) {
            if (e.kind() == FailureKind.SESSION_EXPIRED) {
                throw new UpstreamException(
                    FailureKind.TRANSIENT,
                    "Session rejected again after rotation: " + e.getMessage(),
                    e.statusCode(),
                    e
                );
            }
            throw e;
        }
    }

    private String prepare(String token) {
        synchronized (setupLock) {
            if (token.equals(preparedToken)) {
                return token;
            }
            http.clearCookies();
            double cost = costTable.costOf(UpstreamEndpoint.SESSION_SETUP) / 2.0;
            for (String path : List.of("/registration/registration", "/selfServiceMenu/data")) {
                HttpFetchResult result = http.get(http.url(path, Map.of("_", nonce())), "*/*", cost);
                if (!result.isSuccessful()) {
                    FailureKind kind = result.errorCode() == null && result.statusCode() < 500
                        ? FailureKind.PERMANENT
                        : FailureKind.TRANSIENT;
                    throw new UpstreamException(
                        kind,
                        "Session setup failed: " + FailureClassifier.summarize(result),
                        result.statusCode(),
                        null
                    );
                }
            }
            preparedToken = token;
            log.debug("Upstream session prepared");
            return token;
        }
    }

    private void ensureTermSelected(String token, String term) {
        if (!sessionKeeper.needsTermSelection(token, term)) {
            return;
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("term", term);
        form.put("studyPath", "");
        form.put("studyPathText", "");
        form.put("startDatepicker", "");
        form.put("endDatepicker", "");
        form.put("uniqueSessionId", token);
        HttpFetchResult result = http.postForm(
            http.url("/term/search", Map.of("mode", "search")),
            form,
            JSON_ACCEPT,
            costTable.costOf(UpstreamEndpoint.SELECT_TERM)
        );
        JsonNode root = parseJson(result);
        String forwardUrl = root.path("fwdUrl").asText(null);
        if (forwardUrl != null && !forwardUrl.isBlank()) {
            String target = forwardUrl.startsWith("http") ? forwardUrl : http.url(forwardUrl, Map.of());
            HttpFetchResult redirect = http.get(target, "*/*", 0.0);
            FailureKind kind = FailureClassifier.classify(redirect);
            if (!redirect.isSuccessful() || kind == FailureKind.SESSION_EXPIRED) {
                throw new UpstreamException(
                    kind == null ? FailureKind.TRANSIENT : kind,
                    "Term selection redirect failed: " + FailureClassifier.summarize(redirect),
                    redirect.statusCode(),
                    null
                );
            }
        }
        sessionKeeper.markTermSelected(token, term);
        log.debug("Selected term {} for upstream session", term);
    }

    private void resetDataForm() {
        HttpFetchResult result = http.postForm(
            http.url("/classSearch/resetDataForm", Map.of()),
            Map.of(),
            "*/*",
            costTable.costOf(UpstreamEndpoint.RESET_FORM)
        );
        if (!result.isSuccessful()) {
            FailureKind kind = FailureClassifier.classify(result);
            throw new UpstreamException(
                kind == null ? FailureKind.TRANSIENT : kind,
                "Search form reset failed: " + FailureClassifier.summarize(result),
                result.statusCode(),
                null
            );
        }
    }

    private JsonNode fetchJson(UpstreamEndpoint endpoint, String url) {
        return parseJson(http.get(url, JSON_ACCEPT, costTable.costOf(endpoint)));
    }

    private JsonNode parseJson(HttpFetchResult result) {
        FailureKind kind = FailureClassifier.classify(result);
        if (kind != null) {
            throw new UpstreamException(kind, FailureClassifier.summarize(result), result.statusCode(), null);
        }
        try {
            return objectMapper.readTree(result.body() == null ? "" : result.body());
        } catch (JsonProcessingException e) {
            throw new UpstreamException(
                FailureKind.PERMANENT,
                "Malformed JSON from " + result.requestedUrl() + ": " + e.getOriginalMessage(),
                result.statusCode(),
                e
            );
        }
    }

    private static List<CodeDescription> codeDescriptions(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new UpstreamException(FailureKind.PERMANENT, "Expected a JSON array of code/description pairs");
        }
        List<CodeDescription> values = new ArrayList<>();
        for (JsonNode node : root) {
            String code = node.path("code").asText(null);
            if (code == null || code.isBlank()) {
                continue;
            }
            values.add(new CodeDescription(code.trim(), node.path("description").asText(null)));
        }
        return values;
    }

    private static String nonce() {
        return String.valueOf(System.currentTimeMillis());
    }
}
