package org.iceforge.repocache.api;

import org.iceforge.repocache.core.cache.CacheEngine;
import org.iceforge.repocache.core.cache.SyncStatus;
import org.iceforge.repocache.core.model.Snapshot;
import org.iceforge.repocache.core.upstream.RateLimitBackoff;
import org.iceforge.repocache.core.upstream.UpstreamClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@RestController
@RequestMapping("/api")
public class CacheStatusController {

    private final CacheEngine engine;
    private final UpstreamClient upstream;

    public CacheStatusController(CacheEngine engine, UpstreamClient upstream) {
        this.engine = Objects.requireNonNull(engine);
        this.upstream = Objects.requireNonNull(upstream);
    }

    @GetMapping("/cache/status")
    public Map<String, Object> status() {
        SyncStatus last = engine.lastSyncStatus();
        Optional<Snapshot> snap = engine.snapshot();
        RateLimitBackoff.State backoff = upstream.backoffState();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("org", engine.settings().organization());
        out.put("state", engine.state().name());
        out.put("ttl", engine.settings().ttl().toString());

        out.put("lastStatusCode", last.statusCode());
        out.put("lastSyncOk", last.isSuccess());
        out.put("lastError", last.error());
        out.put("lastSyncAt", last.at() == null ? null : last.at().toString());

        out.put("hydrated", snap.isPresent());
        out.put("hydratedAt", snap.map(s -> s.hydratedAt().toString()).orElse(null));
        out.put("memberCount", snap.map(s -> s.members().size()).orElse(0));
        out.put("repoCount", snap.map(s -> s.repos().size()).orElse(0));

        out.put("inBackoff", backoff.active());
        out.put("backoffUntil", backoff.active() ? backoff.resetAt().toString() : null);
        return out;
    }
}
