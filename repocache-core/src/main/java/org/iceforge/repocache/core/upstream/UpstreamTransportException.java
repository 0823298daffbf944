package org.iceforge.repocache.core.upstream;

/** Connection, timeout or other network failure. No response was received. */
public class UpstreamTransportException extends UpstreamException {
    public static final int STATUS = 502;

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, STATUS, cause);
    }
}
