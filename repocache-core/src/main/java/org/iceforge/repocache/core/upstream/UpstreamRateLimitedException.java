package org.iceforge.repocache.core.upstream;

import java.time.Instant;

/** Raised locally, without a network call, while the client is backing off. */
public class UpstreamRateLimitedException extends UpstreamException {
    public static final int STATUS = 429;

    private final Instant resetAt;

    public UpstreamRateLimitedException(Instant resetAt) {
        super("Rate limited, in backoff until " + resetAt + ", try again later", STATUS, null);
        this.resetAt = resetAt;
    }

    public Instant resetAt() { return resetAt; }
}
