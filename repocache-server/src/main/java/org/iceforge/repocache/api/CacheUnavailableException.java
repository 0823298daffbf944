package org.iceforge.repocache.api;

import org.iceforge.repocache.core.upstream.UpstreamException;

/** The cache was empty and the hydration forced by the read failed. */
public class CacheUnavailableException extends RuntimeException {
    private final int syncStatusCode;

    public CacheUnavailableException(UpstreamException cause) {
        super("Previous data sync failed with status code: " + cause.statusCode(), cause);
        this.syncStatusCode = cause.statusCode();
    }

    public int syncStatusCode() {
        return syncStatusCode;
    }
}
