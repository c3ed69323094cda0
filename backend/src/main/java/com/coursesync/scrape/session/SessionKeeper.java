package com.coursesync.scrape.session;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Owns the single upstream session token. The token is idle-expiring: it stays valid while it keeps being
 * used, and once it has been idle past the validity window it is replaced, never revived.
 */
@Component
public class SessionKeeper {
    private static final Logger log = LoggerFactory.getLogger(SessionKeeper.class);
    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final Clock clock;
    private final Duration validity;
    private final int prefixLength;
    private final SecureRandom random = new SecureRandom();

    private UpstreamSession current;
    private long rotations;

    public SessionKeeper(ScraperProperties properties, Clock clock) {
        this.clock = clock;
        this.validity = properties.getSession().validity();
        this.prefixLength = properties.getSession().getTokenPrefixLength();
    }

    public synchronized String ensureSession() {
        Instant now = clock.instant();
        if (current != null && current.isValidAt(now, validity)) {
            return current.token();
        }
        if (current != null) {
            log.info("Upstream session idle since {}, minting a new one", current.lastActivityAt());
        }
        current = mint(now);
        return current.token();
    }

    public synchronized void notifyActivity() {
        Instant now = clock.instant();
        if (current != null && current.isValidAt(now, validity)) {
            current = current.touch(now);
        }
    }

    public synchronized void notifyActivity(String token) {
        if (current == null || !Objects.equals(current.token(), token)) {
            return;
        }
        notifyActivity();
    }

    /**
     * Drops the session after the upstream rejected it. A token that was already rotated away is ignored so
     * that concurrent callers seeing the same expiry rotate only once.
     *
     * @return the token callers should use next
     */
    public synchronized String invalidate(String token) {
        Instant now = clock.instant();
        if (current != null && Objects.equals(current.token(), token)) {
            log.info("Upstream rejected session created at {}, rotating", current.createdAt());
            current = mint(now);
            return current.token();
        }
        return ensureSession();
    }

    public synchronized boolean needsTermSelection(String token, String term) {
        if (current == null || !Objects.equals(current.token(), token)) {
            return true;
        }
        return !Objects.equals(current.selectedTerm(), term);
    }

    public synchronized void markTermSelected(String token, String term) {
        if (current != null && Objects.equals(current.token(), token)) {
            current = current.withSelectedTerm(term);
        }
    }

    public synchronized SessionStatus status() {
        Instant now = clock.instant();
        if (current == null) {
            return new SessionStatus(false, false, null, null, null, null, rotations);
        }
        return new SessionStatus(
            true,
            current.isValidAt(now, validity),
            current.createdAt(),
            current.lastActivityAt(),
            current.expiresAt(validity),
            current.selectedTerm(),
            rotations
        );
    }

    private UpstreamSession mint(Instant now) {
        StringBuilder token = new StringBuilder(prefixLength + 13);
        for (int i = 0; i < prefixLength; i++) {
            token.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
        }
        token.append(now.toEpochMilli());
        rotations++;
        log.debug("Minted upstream session #{}", rotations);
        return new UpstreamSession(token.toString(), now, now, null);
    }
}
