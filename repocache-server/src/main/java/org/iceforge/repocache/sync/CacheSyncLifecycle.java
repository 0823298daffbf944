package org.iceforge.repocache.sync;

import org.iceforge.repocache.config.RepoCacheProperties;
import org.iceforge.repocache.core.cache.CacheEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Starts the {@link CacheEngine} sync loop with the application context and stops it on shutdown.
 * Starting returns immediately; the startup hydration attempts run on the engine's own thread.
 */
@Component
public class CacheSyncLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CacheSyncLifecycle.class);

    private final CacheEngine engine;
    private final RepoCacheProperties props;
    private volatile boolean running;

    public CacheSyncLifecycle(CacheEngine engine, RepoCacheProperties props) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public void start() {
        if (!props.isSyncEnabled()) {
            log.info("Cache sync loop disabled; the cache hydrates on first read");
            return;
        }
        log.info("Starting cache sync loop for org {} (ttl {})", props.getOrg(), props.getCacheTtl());
        engine.startSyncLoop();
        this.running = true;
    }

    @Override
    public void stop() {
        this.running = false;
        engine.close();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
