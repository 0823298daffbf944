package org.iceforge.repocache.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.repocache.config.RepoCacheProperties;
import org.iceforge.repocache.core.cache.CacheEngine;
import org.iceforge.repocache.core.cache.SyncState;
import org.iceforge.repocache.core.upstream.UpstreamClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CacheSyncLifecycleTest {

    private UpstreamClient upstream;
    private RepoCacheProperties props;
    private CacheEngine engine;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        upstream = mock(UpstreamClient.class);
        when(upstream.fetchOrganization()).thenReturn(mapper.createObjectNode().put("login", "Netflix"));
        when(upstream.fetchMembers()).thenReturn(List.of());
        when(upstream.fetchRepos()).thenReturn(List.of());

        props = new RepoCacheProperties();
        props.setStartupAttempts(1);
        props.setRequestTimeout(Duration.ofSeconds(2));
        engine = new CacheEngine(upstream, props.toCacheSettings(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void disabled_leavesEngineIdle() {
        props.setSyncEnabled(false);
        CacheSyncLifecycle lifecycle = new CacheSyncLifecycle(engine, props);

        lifecycle.start();

        assertFalse(lifecycle.isRunning());
        assertEquals(SyncState.NEW, engine.state());
        verifyNoInteractions(upstream);
    }

    @Test
    void start_hydratesInBackground_andStopEndsTheLoop() {
        CacheSyncLifecycle lifecycle = new CacheSyncLifecycle(engine, props);

        lifecycle.start();
        assertTrue(lifecycle.isRunning());
        verify(upstream, timeout(5_000)).fetchOrganization();

        lifecycle.stop();
        assertFalse(lifecycle.isRunning());
        assertEquals(SyncState.STOPPED, engine.state());
    }
}
