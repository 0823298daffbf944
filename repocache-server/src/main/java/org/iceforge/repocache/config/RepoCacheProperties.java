package org.iceforge.repocache.config;

import org.iceforge.repocache.core.cache.CacheSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Configuration for the organization read cache and its upstream client.
 * <p>
 * Defaults match the public GitHub API and are safe for local dev without a token.
 */
@ConfigurationProperties(prefix = "repocache")
public class RepoCacheProperties {

    /** Organization whose org record, public members and public repositories are cached. */
    private String org = "Netflix";

    /** Upstream REST API base URL. */
    private String apiBaseUrl = "https://api.github.com";

    /**
     * Optional bearer token. Blank means unauthenticated access, which the upstream
     * rate-limits much harder.
     */
    private String apiToken = "";

    /** Interval between scheduled hydrations. */
    private Duration cacheTtl = CacheSettings.DEFAULT_TTL;

    /** Hydration attempts made when the sync loop starts. */
    private int startupAttempts = CacheSettings.DEFAULT_STARTUP_ATTEMPTS;

    /** Pause between failed startup attempts. */
    private Duration startupRetryDelay = CacheSettings.DEFAULT_STARTUP_RETRY_DELAY;

    /** Per-request upstream timeout; also bounds how long shutdown waits for a hydration. */
    private Duration requestTimeout = Duration.ofSeconds(10);

    /** Largest upstream response body buffered in memory (one page of 100 repos is ~600KB). */
    private DataSize maxResponseSize = DataSize.ofMegabytes(16);

    /** Start the background sync loop with the application context. */
    private boolean syncEnabled = true;

    public CacheSettings toCacheSettings() {
        return new CacheSettings(org, cacheTtl, startupAttempts, startupRetryDelay, requestTimeout);
    }

    public boolean hasApiToken() {
        return apiToken != null && !apiToken.isBlank();
    }

    public String getOrg() {
        return org;
    }

    public void setOrg(String org) {
        this.org = org;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public int getStartupAttempts() {
        return startupAttempts;
    }

    public void setStartupAttempts(int startupAttempts) {
        this.startupAttempts = startupAttempts;
    }

    public Duration getStartupRetryDelay() {
        return startupRetryDelay;
    }

    public void setStartupRetryDelay(Duration startupRetryDelay) {
        this.startupRetryDelay = startupRetryDelay;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public DataSize getMaxResponseSize() {
        return maxResponseSize;
    }

    public void setMaxResponseSize(DataSize maxResponseSize) {
        this.maxResponseSize = maxResponseSize;
    }

    public boolean isSyncEnabled() {
        return syncEnabled;
    }

    public void setSyncEnabled(boolean syncEnabled) {
        this.syncEnabled = syncEnabled;
    }
}
