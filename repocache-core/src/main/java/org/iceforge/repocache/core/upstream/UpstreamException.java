package org.iceforge.repocache.core.upstream;

/**
 * Base of every failure raised while talking to the upstream API. Each failure carries the
 * HTTP status that was observed, or one synthesized for failures that never got a response.
 */
public abstract class UpstreamException extends RuntimeException {
    private final int statusCode;

    protected UpstreamException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }
}
