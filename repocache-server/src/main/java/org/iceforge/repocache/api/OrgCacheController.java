package org.iceforge.repocache.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.servlet.http.HttpServletRequest;
import org.iceforge.repocache.core.cache.CacheEngine;
import org.iceforge.repocache.core.model.RankEntry;
import org.iceforge.repocache.core.model.ViewKind;
import org.iceforge.repocache.core.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Serves the configured organization, its public members and repositories, and the bottom-N
 * rankings from the in-memory cache. Requests for any other organization are forwarded.
 */
@RestController
public class OrgCacheController {
    private static final Logger log = LoggerFactory.getLogger(OrgCacheController.class);

    private final CacheEngine engine;
    private final UpstreamForwarder forwarder;
    private final String organization;

    public OrgCacheController(CacheEngine engine, UpstreamForwarder forwarder) {
        this.engine = Objects.requireNonNull(engine);
        this.forwarder = Objects.requireNonNull(forwarder);
        this.organization = engine.settings().organization();
    }

    @GetMapping("/orgs/{org}")
    public ResponseEntity<?> organization(@PathVariable String org, HttpServletRequest request) throws IOException {
        if (!isCachedOrg(org)) return forwarder.forward(request);
        return ResponseEntity.ok(read(engine::getOrganization));
    }

    @GetMapping("/orgs/{org}/members")
    public ResponseEntity<?> members(@PathVariable String org, HttpServletRequest request) throws IOException {
        if (!isCachedOrg(org)) return forwarder.forward(request);
        return ResponseEntity.ok(read(engine::getMembers));
    }

    @GetMapping("/orgs/{org}/repos")
    public ResponseEntity<?> repos(@PathVariable String org, HttpServletRequest request) throws IOException {
        if (!isCachedOrg(org)) return forwarder.forward(request);
        return ResponseEntity.ok(read(engine::getRepos));
    }

    /**
     * The {@code n} lowest-ranked repositories for a view, as {@code [name, metric]} pairs.
     * {@code n} larger than the number of repositories returns all of them.
     */
    @GetMapping("/view/bottom/{n}/{kind}")
    public List<RankEntry> bottom(@PathVariable("n") String rawN, @PathVariable String kind) {
        int n = parseCount(rawN);
        ViewKind view = ViewKind.fromPathSegment(kind).orElseThrow(() -> new UnknownViewException(kind));
        return read(() -> engine.getBottomN(view, n));
    }

    private boolean isCachedOrg(String org) {
        return organization.equalsIgnoreCase(org);
    }

    private <T> T read(Supplier<Optional<T>> reader) {
        Optional<T> cached = reader.get();
        if (cached.isPresent()) return cached.get();

        log.info("Cache empty on read, forcing hydration");
        try {
            engine.hydrateIfEmpty();
        } catch (UpstreamException e) {
            log.warn("Forced hydration failed with status {}: {}", e.statusCode(), e.getMessage());
            throw new CacheUnavailableException(e);
        }
        return reader.get().orElseThrow(() -> new IllegalStateException("Cache still empty after hydration"));
    }

    private static int parseCount(String raw) {
        int n;
        try {
            n = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("n must be a positive integer, got '" + raw + "'");
        }
        if (n <= 0) {
            throw new IllegalArgumentException("n must be a positive integer, got " + n);
        }
        return n;
    }
}
