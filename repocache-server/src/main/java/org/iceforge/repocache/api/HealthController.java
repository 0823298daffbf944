package org.iceforge.repocache.api;

import org.iceforge.repocache.core.cache.CacheEngine;
import org.iceforge.repocache.core.cache.SyncStatus;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Liveness for load balancers ({@code /healthcheck}, always 200 while the process serves)
 * and the aggregated actuator status plus a cache sync summary under {@code /api/health}.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final CacheEngine engine;

    public HealthController(HealthEndpoint healthEndpoint, CacheEngine engine) {
        this.healthEndpoint = Objects.requireNonNull(healthEndpoint);
        this.engine = Objects.requireNonNull(engine);
    }

    @GetMapping("/healthcheck")
    public ResponseEntity<Void> healthcheck() {
        return ResponseEntity.ok().build();
    }

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        HealthComponent hc = healthEndpoint.health();
        SyncStatus last = engine.lastSyncStatus();

        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("org", engine.settings().organization());
        cache.put("hydrated", engine.isHydrated());
        cache.put("syncState", engine.state().name());
        cache.put("lastStatusCode", last.statusCode());
        cache.put("lastSyncAt", last.at() == null ? null : last.at().toString());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", hc.getStatus().getCode());
        out.put("cache", cache);
        return out;
    }
}
