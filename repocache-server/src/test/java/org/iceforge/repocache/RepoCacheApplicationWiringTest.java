package org.iceforge.repocache;

import org.iceforge.repocache.core.cache.CacheEngine;
import org.iceforge.repocache.core.cache.SyncState;
import org.iceforge.repocache.core.upstream.UpstreamClient;
import org.iceforge.repocache.sync.CacheSyncLifecycle;
import org.iceforge.repocache.upstream.GitHubUpstreamClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        properties = {
                "repocache.org=google",
                "repocache.api-base-url=http://localhost:1",
                "repocache.cache-ttl=1m",
                "repocache.sync-enabled=false"
        }
)
class RepoCacheApplicationWiringTest {

    @Test
    void contextWiresEngineAgainstGitHubClient(ApplicationContext ctx) {
        assertThat(ctx.getBean(UpstreamClient.class)).isInstanceOf(GitHubUpstreamClient.class);

        CacheEngine engine = ctx.getBean(CacheEngine.class);
        assertThat(engine.settings().organization()).isEqualTo("google");
        assertThat(engine.settings().ttl()).isEqualTo(Duration.ofMinutes(1));
        assertThat(engine.state()).isEqualTo(SyncState.NEW);

        assertThat(ctx.getBean(CacheSyncLifecycle.class).isRunning()).isFalse();
        assertThat(ctx.containsBean("cacheSync")).isTrue();
    }
}
