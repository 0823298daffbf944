package org.iceforge.repocache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import org.iceforge.repocache.core.cache.CacheEngine;
import org.iceforge.repocache.core.upstream.RateLimitBackoff;
import org.iceforge.repocache.core.upstream.UpstreamClient;
import org.iceforge.repocache.upstream.GitHubUpstreamClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Configuration
public class RepoCacheConfig {
    private static final Logger log = LoggerFactory.getLogger(RepoCacheConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimitBackoff rateLimitBackoff(Clock clock) {
        return new RateLimitBackoff(clock);
    }

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder builder, RepoCacheProperties props) {
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .responseTimeout(props.getRequestTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.getRequestTimeout().toMillis());
        int maxBytes = (int) Math.min(Integer.MAX_VALUE, props.getMaxResponseSize().toBytes());
        return builder
                .baseUrl(props.getApiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxBytes))
                .build();
    }

    @Bean
    public UpstreamClient upstreamClient(WebClient upstreamWebClient,
                                         ObjectMapper objectMapper,
                                         RateLimitBackoff rateLimitBackoff,
                                         RepoCacheProperties props) {
        if (!props.hasApiToken()) {
            log.warn("No repocache.api-token (GITHUB_API_TOKEN) configured, upstream calls may be subject to stricter rate limits");
        }
        return new GitHubUpstreamClient(upstreamWebClient, objectMapper, rateLimitBackoff, props);
    }

    @Bean
    public CacheEngine cacheEngine(UpstreamClient upstreamClient, RepoCacheProperties props, Clock clock) {
        return new CacheEngine(upstreamClient, props.toCacheSettings(), clock);
    }
}
