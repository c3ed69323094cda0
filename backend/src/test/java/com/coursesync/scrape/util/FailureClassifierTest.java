package com.coursesync.scrape.util;

import com.coursesync.scrape.model.FailureKind;
import com.coursesync.scrape.model.HttpFetchResult;
import com.coursesync.scrape.upstream.UpstreamException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.net.URI;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @Test
    void jsonResponseIsUsable() {
        assertThat(FailureClassifier.classify(response(200, "application/json", "{}", null))).isNull();
    }

    @Test
    void authStatusesMeanSessionExpired() {
        assertThat(FailureClassifier.classify(response(401, null, "", null))).isEqualTo(FailureKind.SESSION_EXPIRED);
        assertThat(FailureClassifier.classify(response(403, null, "", null))).isEqualTo(FailureKind.SESSION_EXPIRED);
    }

    @Test
    void throttlingAndServerErrorsAreTransient() {
        assertThat(FailureClassifier.classify(response(429, null, "", null))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(response(502, null, "", null))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(response(0, null, null, "io_error"))).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void badRequestAndNonJsonArePermanent() {
        assertThat(FailureClassifier.classify(response(400, null, "", null))).isEqualTo(FailureKind.PERMANENT);
        assertThat(FailureClassifier.classify(response(200, "text/plain", "hello", null))).isEqualTo(FailureKind.PERMANENT);
        assertThat(FailureClassifier.classify(response(0, null, null, "invalid_url"))).isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    void loginPageMeansSessionExpired() {
        HttpFetchResult login = response(
            200,
            "text/html;charset=UTF-8",
            "<html><head><title>Banner</title></head><body><form><input type='password' name='pw'></form></body></html>",
            null
        );
        assertThat(FailureClassifier.classify(login)).isEqualTo(FailureKind.SESSION_EXPIRED);

        HttpFetchResult menu = response(200, "text/html", "<html><head><title>Registration</title></head></html>", null);
        assertThat(FailureClassifier.classify(menu)).isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    void exceptionsMapToFailureKinds() {
        assertThat(FailureClassifier.classify(new ExecutionException(new UpstreamException(FailureKind.PERMANENT, "bad"))))
            .isEqualTo(FailureKind.PERMANENT);
        assertThat(FailureClassifier.classify(new UpstreamException(FailureKind.SESSION_EXPIRED, "gone")))
            .isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.classify(new TimeoutException("slow"))).isEqualTo(FailureKind.TIMEOUT);
        assertThat(FailureClassifier.classify(new IllegalStateException("boom"))).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void rowsTheStoreRejectsArePermanent() {
        assertThat(FailureClassifier.classify(new DataIntegrityViolationException("value too long for crn")))
            .isEqualTo(FailureKind.PERMANENT);
        assertThat(FailureClassifier.classify(new UncategorizedSQLException(
            "insert audits", "INSERT", new SQLException("current transaction is aborted", "25P02"))))
            .isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureClassifier.isStoreUnavailable(new DataIntegrityViolationException("constraint"))).isFalse();
    }

    @Test
    void storeOutagesAreRecognizedThroughCauses() {
        assertThat(FailureClassifier.isStoreUnavailable(
            new IllegalStateException(new CannotGetJdbcConnectionException("down", new SQLException("refused")))
        )).isTrue();
        assertThat(FailureClassifier.isStoreUnavailable(new DataAccessResourceFailureException("down"))).isTrue();
        assertThat(FailureClassifier.isStoreUnavailable(new IllegalArgumentException("nope"))).isFalse();
    }

    @Test
    void longErrorsAreTruncated() {
        String longMessage = "x".repeat(5000);
        assertThat(FailureClassifier.truncate(longMessage)).hasSize(1000);
        assertThat(FailureClassifier.describe(new IllegalStateException("short"))).isEqualTo("IllegalStateException: short");
    }

    private static HttpFetchResult response(int status, String contentType, String body, String errorCode) {
        return new HttpFetchResult(
            "https://banner.example.edu/ssb/searchResults/searchResults",
            errorCode == null ? URI.create("https://banner.example.edu/ssb/searchResults/searchResults") : null,
            status,
            body,
            contentType,
            Instant.now(),
            Duration.ofMillis(10),
            errorCode,
            errorCode == null ? null : "failed"
        );
    }
}
