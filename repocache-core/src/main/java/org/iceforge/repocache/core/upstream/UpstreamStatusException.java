package org.iceforge.repocache.core.upstream;

/** The upstream answered with a non-200 status. */
public class UpstreamStatusException extends UpstreamException {
    public UpstreamStatusException(String resource, int statusCode) {
        super("Upstream request for " + resource + " failed with status " + statusCode, statusCode, null);
    }
}
