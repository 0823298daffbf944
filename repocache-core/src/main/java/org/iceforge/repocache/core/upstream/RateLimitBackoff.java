package org.iceforge.repocache.core.upstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Local rate-limit state machine (ACTIVE / IN_BACKOFF) driven by the
 * {@code x-ratelimit-remaining} and {@code x-ratelimit-reset} response headers.
 * <p>
 * There is no timer: an expired backoff is only cleared when the next call checks in.
 * Guarded by its own lock so a backoff check never contends with cache reads.
 */
public final class RateLimitBackoff {
    private static final Logger log = LoggerFactory.getLogger(RateLimitBackoff.class);

    public static final String REMAINING_HEADER = "x-ratelimit-remaining";
    public static final String RESET_HEADER = "x-ratelimit-reset";

    /** Point-in-time view of the backoff state. */
    public record State(boolean active, Instant resetAt) {}

    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean inBackoff;
    private Instant resetAt;

    public RateLimitBackoff(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.resetAt = clock.instant();
    }

    /**
     * Call before every outbound request.
     *
     * @throws UpstreamRateLimitedException if still inside the backoff window
     */
    public void checkBeforeCall() {
        Instant until;
        lock.readLock().lock();
        try {
            if (!inBackoff) return;
            until = resetAt;
        } finally {
            lock.readLock().unlock();
        }

        if (clock.instant().isBefore(until)) {
            throw new UpstreamRateLimitedException(until);
        }

        lock.writeLock().lock();
        try {
            // another response may have pushed the window out since the read above
            if (inBackoff && !clock.instant().isBefore(resetAt)) {
                inBackoff = false;
                log.info("Rate limit backoff over (reset at {}), resuming upstream calls", resetAt);
            } else if (inBackoff) {
                throw new UpstreamRateLimitedException(resetAt);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Inspect the rate-limit headers of a response. Missing headers leave the state alone;
     * unparsable ones are logged and ignored.
     */
    public void observe(String remainingHeader, String resetHeader) {
        if (remainingHeader == null || remainingHeader.isBlank()) return;

        long remaining;
        try {
            remaining = Long.parseLong(remainingHeader.trim());
        } catch (NumberFormatException e) {
            log.warn("Error parsing {} header: '{}'", REMAINING_HEADER, remainingHeader);
            return;
        }
        if (remaining != 0) return;

        long resetEpochSeconds;
        try {
            resetEpochSeconds = Long.parseLong(resetHeader == null ? "" : resetHeader.trim());
        } catch (NumberFormatException e) {
            log.warn("Error parsing {} header: '{}'", RESET_HEADER, resetHeader);
            return;
        }
        enterBackoff(Instant.ofEpochSecond(resetEpochSeconds));
    }

    void enterBackoff(Instant until) {
        lock.writeLock().lock();
        try {
            // while active the window only ever moves forward
            if (inBackoff && until.isBefore(resetAt)) return;
            inBackoff = true;
            resetAt = until;
        } finally {
            lock.writeLock().unlock();
        }
        log.warn("Rate limited by upstream API, entering backoff until {}", until);
    }

    public State state() {
        lock.readLock().lock();
        try {
            return new State(inBackoff, resetAt);
        } finally {
            lock.readLock().unlock();
        }
    }
}
