package org.iceforge.repocache.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The upstream resources the cache mirrors. Implementations decide how payloads are
 * fetched and decoded; the cache only sees the resulting JSON records.
 * <p>
 * Every method honours the local rate-limit backoff and fails with an
 * {@link UpstreamException} subtype carrying the observed (or synthesized) status.
 */
public interface UpstreamClient {

    JsonNode fetchOrganization();

    /** All public members, every page concatenated. */
    List<JsonNode> fetchMembers();

    /** All public repositories, every page concatenated. */
    List<JsonNode> fetchRepos();

    /** Pass a request through unchanged apart from the authorization header. */
    UpstreamModels.ForwardResponse forward(UpstreamModels.ForwardRequest request);

    RateLimitBackoff.State backoffState();
}
