package com.coursesync.scrape.util;

import com.coursesync.scrape.model.FailureKind;
import com.coursesync.scrape.model.HttpFetchResult;
import com.coursesync.scrape.upstream.UpstreamException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

public final class FailureClassifier {
    private static final int MAX_ERROR_LENGTH = 1000;

    private FailureClassifier() {
    }

    /**
     * @return the failure kind for an unusable response, or null when the response can be parsed as JSON
     */
    public static FailureKind classify(HttpFetchResult result) {
        if (result == null) {
            return FailureKind.TRANSIENT;
        }
        String errorCode = result.errorCode();
        if (errorCode != null) {
            return "invalid_url".equals(errorCode) ? FailureKind.PERMANENT : FailureKind.TRANSIENT;
        }
        int status = result.statusCode();
        if (status == 401 || status == 403) {
            return FailureKind.SESSION_EXPIRED;
        }
        if (status == 408 || status == 429 || status >= 500) {
            return FailureKind.TRANSIENT;
        }
        if (status < 200 || status >= 300) {
            return FailureKind.PERMANENT;
        }
        if (looksLikeLoginPage(result)) {
            return FailureKind.SESSION_EXPIRED;
        }
        if (!result.isJson()) {
            return FailureKind.PERMANENT;
        }
        return null;
    }

    public static FailureKind classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UpstreamException upstream) {
                return upstream.kind() == FailureKind.SESSION_EXPIRED ? FailureKind.TRANSIENT : upstream.kind();
            }
            if (current instanceof TimeoutException) {
                return FailureKind.TIMEOUT;
            }
            if (current instanceof DataIntegrityViolationException) {
                return FailureKind.PERMANENT;
            }
            current = current.getCause();
        }
        return FailureKind.TRANSIENT;
    }

    public static boolean isStoreUnavailable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof DataAccessResourceFailureException
                || current instanceof TransientDataAccessResourceException
                || current instanceof CannotGetJdbcConnectionException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    static boolean looksLikeLoginPage(HttpFetchResult result) {
        String contentType = result.contentType() == null ? "" : result.contentType().toLowerCase(Locale.ROOT);
        String body = result.body();
        if (!contentType.contains("text/html") || body == null || body.isBlank()) {
            return false;
        }
        String finalUrl = result.finalUrlOrRequested().toLowerCase(Locale.ROOT);
        if (finalUrl.contains("/login") || finalUrl.contains("/cas/") || finalUrl.contains("saml")) {
            return true;
        }
        Document document = Jsoup.parse(body);
        if (!document.select("input[type=password]").isEmpty()) {
            return true;
        }
        String title = document.title().toLowerCase(Locale.ROOT);
        return title.contains("login") || title.contains("log in") || title.contains("sign in");
    }

    public static String summarize(HttpFetchResult result) {
        if (result == null) {
            return "no response";
        }
        if (result.errorCode() != null) {
            return truncate(result.errorCode() + ": " + result.errorMessage());
        }
        return truncate("HTTP " + result.statusCode() + " from " + result.requestedUrl()
            + (result.contentType() == null ? "" : " (" + result.contentType() + ")"));
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        String value = error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
        return truncate(value);
    }

    public static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
