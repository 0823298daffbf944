package org.iceforge.repocache.core.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link CacheEngine}.
 *
 * @param organization      organization whose repositories are ranked; prefixes every ranked name
 * @param ttl               interval between scheduled hydrations
 * @param startupAttempts   hydration attempts made when the sync loop starts
 * @param startupRetryDelay pause between failed startup attempts
 * @param shutdownTimeout   how long {@link CacheEngine#close()} waits for an in-flight hydration
 */
public record CacheSettings(
        String organization,
        Duration ttl,
        int startupAttempts,
        Duration startupRetryDelay,
        Duration shutdownTimeout
) {
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    public static final int DEFAULT_STARTUP_ATTEMPTS = 5;
    public static final Duration DEFAULT_STARTUP_RETRY_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    public CacheSettings {
        Objects.requireNonNull(organization, "organization");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(startupRetryDelay, "startupRetryDelay");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (organization.isBlank()) throw new IllegalArgumentException("organization must not be blank");
        if (ttl.isZero() || ttl.isNegative()) throw new IllegalArgumentException("ttl must be positive: " + ttl);
        if (startupAttempts < 1) throw new IllegalArgumentException("startupAttempts must be >= 1: " + startupAttempts);
        if (startupRetryDelay.isNegative()) throw new IllegalArgumentException("startupRetryDelay must not be negative");
        if (shutdownTimeout.isNegative()) throw new IllegalArgumentException("shutdownTimeout must not be negative");
    }

    public static CacheSettings defaults(String organization) {
        return new CacheSettings(organization, DEFAULT_TTL, DEFAULT_STARTUP_ATTEMPTS,
                DEFAULT_STARTUP_RETRY_DELAY, DEFAULT_SHUTDOWN_TIMEOUT);
    }
}
