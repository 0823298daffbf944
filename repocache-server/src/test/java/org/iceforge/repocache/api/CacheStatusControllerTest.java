package org.iceforge.repocache.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.repocache.core.cache.CacheEngine;
import org.iceforge.repocache.core.cache.CacheSettings;
import org.iceforge.repocache.core.upstream.RateLimitBackoff;
import org.iceforge.repocache.core.upstream.UpstreamClient;
import org.iceforge.repocache.core.upstream.UpstreamTransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class CacheStatusControllerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private UpstreamClient upstream;
    private CacheEngine engine;
    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        ObjectMapper mapper = new ObjectMapper();
        upstream = mock(UpstreamClient.class);
        when(upstream.fetchOrganization()).thenReturn(mapper.createObjectNode().put("login", "Netflix"));
        when(upstream.fetchMembers()).thenReturn(List.of(mapper.createObjectNode().put("login", "alice")));
        when(upstream.fetchRepos()).thenReturn(List.of());
        when(upstream.backoffState()).thenReturn(new RateLimitBackoff.State(false, NOW));

        engine = new CacheEngine(upstream, CacheSettings.defaults("Netflix"), Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(new CacheStatusController(engine, upstream)).build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void beforeAnySync_reportsNotHydrated() throws Exception {
        mockMvc.perform(get("/api/cache/status"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.org").value("Netflix"))
                .andExpect(jsonPath("$.state").value("NEW"))
                .andExpect(jsonPath("$.ttl").value("PT10M"))
                .andExpect(jsonPath("$.lastStatusCode").value(0))
                .andExpect(jsonPath("$.hydrated").value(false))
                .andExpect(jsonPath("$.repoCount").value(0))
                .andExpect(jsonPath("$.inBackoff").value(false));
    }

    @Test
    void afterSync_reportsCountsAndTimes() throws Exception {
        engine.hydrateNow();

        mockMvc.perform(get("/api/cache/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastStatusCode").value(200))
                .andExpect(jsonPath("$.lastSyncOk").value(true))
                .andExpect(jsonPath("$.lastSyncAt").value("2024-06-01T00:00:00Z"))
                .andExpect(jsonPath("$.hydrated").value(true))
                .andExpect(jsonPath("$.hydratedAt").value("2024-06-01T00:00:00Z"))
                .andExpect(jsonPath("$.memberCount").value(1))
                .andExpect(jsonPath("$.repoCount").value(0));
    }

    @Test
    void failedSync_andBackoff_areVisible() throws Exception {
        when(upstream.fetchMembers()).thenThrow(new UpstreamTransportException("connect timed out", null));
        when(upstream.backoffState()).thenReturn(new RateLimitBackoff.State(true, NOW.plusSeconds(90)));
        assertThrows(UpstreamTransportException.class, engine::hydrateNow);

        mockMvc.perform(get("/api/cache/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastStatusCode").value(502))
                .andExpect(jsonPath("$.lastSyncOk").value(false))
                .andExpect(jsonPath("$.lastError").value("connect timed out"))
                .andExpect(jsonPath("$.hydrated").value(false))
                .andExpect(jsonPath("$.inBackoff").value(true))
                .andExpect(jsonPath("$.backoffUntil").value("2024-06-01T00:01:30Z"));
    }
}
