package org.iceforge.repocache.sync;

import org.iceforge.repocache.core.cache.CacheEngine;
import org.iceforge.repocache.core.cache.SyncStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Reports UP once a snapshot is installed and the most recent hydration succeeded.
 * Stale data is still served while this is DOWN.
 */
@Component("cacheSync")
public class CacheSyncHealthIndicator implements HealthIndicator {

    private final CacheEngine engine;

    public CacheSyncHealthIndicator(CacheEngine engine) {
        this.engine = Objects.requireNonNull(engine);
    }

    @Override
    public Health health() {
        SyncStatus last = engine.lastSyncStatus();
        boolean hydrated = engine.isHydrated();

        Health.Builder builder = hydrated && last.isSuccess() ? Health.up() : Health.down();
        builder.withDetail("state", engine.state().name())
                .withDetail("hydrated", hydrated)
                .withDetail("lastStatusCode", last.statusCode());
        if (last.at() != null) {
            builder.withDetail("lastSyncAt", last.at().toString());
        }
        if (last.error() != null) {
            builder.withDetail("lastError", last.error());
        }
        return builder.build();
    }
}
