package org.iceforge.repocache.core.upstream;

/** A payload was malformed or lacked a field the cache needs. */
public class UpstreamDecodeException extends UpstreamException {
    public static final int STATUS = 500;

    public UpstreamDecodeException(String message) {
        super(message, STATUS, null);
    }

    public UpstreamDecodeException(String message, Throwable cause) {
        super(message, STATUS, cause);
    }
}
