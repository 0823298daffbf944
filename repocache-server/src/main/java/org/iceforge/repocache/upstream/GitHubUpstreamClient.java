package org.iceforge.repocache.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.repocache.config.RepoCacheProperties;
import org.iceforge.repocache.core.upstream.Paginator;
import org.iceforge.repocache.core.upstream.RateLimitBackoff;
import org.iceforge.repocache.core.upstream.UpstreamClient;
import org.iceforge.repocache.core.upstream.UpstreamDecodeException;
import org.iceforge.repocache.core.upstream.UpstreamModels;
import org.iceforge.repocache.core.upstream.UpstreamStatusException;
import org.iceforge.repocache.core.upstream.UpstreamTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * {@link UpstreamClient} for the GitHub REST API, over a blocking use of {@link WebClient}.
 * <p>
 * Every outbound call first consults the {@link RateLimitBackoff}, and every response's
 * rate-limit headers are fed back into it, whatever the status.
 */
public class GitHubUpstreamClient implements UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubUpstreamClient.class);

    static final String GITHUB_JSON = "application/vnd.github+json";

    private static final Set<String> NON_FORWARDED_REQUEST_HEADERS = Set.of("host", "content-length", "connection");

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final RateLimitBackoff backoff;
    private final String organization;
    private final String apiBaseUrl;
    private final String apiToken;
    private final Duration requestTimeout;

    public GitHubUpstreamClient(WebClient webClient, ObjectMapper mapper, RateLimitBackoff backoff, RepoCacheProperties props) {
        this.webClient = Objects.requireNonNull(webClient);
        this.mapper = Objects.requireNonNull(mapper);
        this.backoff = Objects.requireNonNull(backoff);
        this.organization = Objects.requireNonNull(props.getOrg(), "org");
        this.apiBaseUrl = stripTrailingSlash(Objects.requireNonNull(props.getApiBaseUrl(), "apiBaseUrl"));
        this.apiToken = props.hasApiToken() ? props.getApiToken().trim() : null;
        this.requestTimeout = Objects.requireNonNull(props.getRequestTimeout(), "requestTimeout");
    }

    @Override
    public JsonNode fetchOrganization() {
        JsonNode org = getJson("organization " + organization,
                b -> b.path("/orgs/{org}").build(organization));
        if (!org.isObject()) {
            throw new UpstreamDecodeException("Organization payload for " + organization + " is not a JSON object");
        }
        return org;
    }

    @Override
    public List<JsonNode> fetchMembers() {
        return Paginator.flatten((page, perPage) -> getPage("public members page " + page,
                b -> b.path("/orgs/{org}/public_members")
                        .queryParam("per_page", perPage)
                        .queryParam("page", page)
                        .build(organization)));
    }

    @Override
    public List<JsonNode> fetchRepos() {
        return Paginator.flatten((page, perPage) -> getPage("public repos page " + page,
                b -> b.path("/orgs/{org}/repos")
                        .queryParam("type", "public")
                        .queryParam("per_page", perPage)
                        .queryParam("page", page)
                        .build(organization)));
    }

    @Override
    public UpstreamModels.ForwardResponse forward(UpstreamModels.ForwardRequest request) {
        backoff.checkBeforeCall();

        String query = request.query() == null || request.query().isBlank() ? "" : "?" + request.query();
        URI target = URI.create(apiBaseUrl + request.path() + query);

        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.method().toUpperCase(Locale.ROOT)))
                .uri(target)
                .headers(h -> {
                    request.headers().forEach((name, values) -> {
                        if (!NON_FORWARDED_REQUEST_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                            h.addAll(name, values);
                        }
                    });
                    authorize(h);
                });
        WebClient.RequestHeadersSpec<?> ready = request.body().length > 0 ? spec.bodyValue(request.body()) : spec;

        ResponseEntity<byte[]> resp = exchange(request.method() + " " + request.path(), ready);
        Map<String, List<String>> headers = new LinkedHashMap<>(resp.getHeaders());
        return new UpstreamModels.ForwardResponse(resp.getStatusCode().value(), headers, resp.getBody());
    }

    @Override
    public RateLimitBackoff.State backoffState() {
        return backoff.state();
    }

    private List<JsonNode> getPage(String resource, Function<UriBuilder, URI> uri) {
        JsonNode page = getJson(resource, uri);
        if (!page.isArray()) {
            throw new UpstreamDecodeException("Payload for " + resource + " is not a JSON array");
        }
        List<JsonNode> items = new ArrayList<>(page.size());
        page.forEach(items::add);
        return items;
    }

    private JsonNode getJson(String resource, Function<UriBuilder, URI> uri) {
        backoff.checkBeforeCall();

        ResponseEntity<byte[]> resp = exchange(resource, webClient.get()
                .uri(uri)
                .headers(h -> {
                    h.set(HttpHeaders.ACCEPT, GITHUB_JSON);
                    authorize(h);
                }));

        int status = resp.getStatusCode().value();
        if (status != 200) {
            throw new UpstreamStatusException(resource, status);
        }
        byte[] body = resp.getBody();
        if (body == null || body.length == 0) {
            throw new UpstreamDecodeException("Empty response body for " + resource);
        }
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamDecodeException("Malformed JSON for " + resource + ": " + e.getMessage(), e);
        }
    }

    /** Runs the request, records rate-limit headers and returns the raw response whatever its status. */
    private ResponseEntity<byte[]> exchange(String resource, WebClient.RequestHeadersSpec<?> request) {
        ResponseEntity<byte[]> resp;
        try {
            resp = request.exchangeToMono(r -> r.toEntity(byte[].class))
                    .timeout(requestTimeout)
                    .block();
        } catch (RuntimeException e) {
            log.debug("Upstream call for {} failed", resource, e);
            throw new UpstreamTransportException("Request for " + resource + " failed: " + e.getMessage(), e);
        }
        if (resp == null) {
            throw new UpstreamTransportException("No response for " + resource, null);
        }

        HttpHeaders h = resp.getHeaders();
        backoff.observe(h.getFirst(RateLimitBackoff.REMAINING_HEADER), h.getFirst(RateLimitBackoff.RESET_HEADER));
        return resp;
    }

    private void authorize(HttpHeaders headers) {
        if (apiToken != null) {
            headers.setBearerAuth(apiToken);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
