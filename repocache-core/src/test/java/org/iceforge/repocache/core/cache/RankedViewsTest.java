package org.iceforge.repocache.core.cache;

import org.iceforge.repocache.core.model.ForkCount;
import org.iceforge.repocache.core.model.LastUpdated;
import org.iceforge.repocache.core.model.RankEntry;
import org.iceforge.repocache.core.model.RankedList;
import org.iceforge.repocache.core.model.RepoMetrics;
import org.iceforge.repocache.core.model.ViewKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RankedViewsTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static RepoMetrics repo(String name, long forks, long issues, long stars, Instant updated) {
        return new RepoMetrics("Netflix/" + name, forks, issues, stars, updated);
    }

    @Test
    void forks_sortAscendingWithNameTieBreak() {
        List<RepoMetrics> repos = List.of(
                repo("a", 5, 0, 0, T0),
                repo("b", 5, 0, 0, T0),
                repo("c", 2, 0, 0, T0)
        );

        RankedList forks = RankedViews.rank(ViewKind.FORKS, repos);

        assertThat(forks.entries()).containsExactly(
                new ForkCount("Netflix/c", 2),
                new ForkCount("Netflix/a", 5),
                new ForkCount("Netflix/b", 5)
        );
    }

    @Test
    void ties_resolveByNameRegardlessOfInputOrder() {
        List<RepoMetrics> repos = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            repos.add(repo("r" + (char) ('a' + i), i % 3, i % 2, 7, T0.plusSeconds(i % 4)));
        }
        Map<ViewKind, RankedList> expected = RankedViews.build(repos);

        Random rnd = new Random(42);
        for (int round = 0; round < 10; round++) {
            List<RepoMetrics> shuffled = new ArrayList<>(repos);
            Collections.shuffle(shuffled, rnd);
            assertThat(RankedViews.build(shuffled)).isEqualTo(expected);
        }

        List<String> starNames = expected.get(ViewKind.STARS).entries().stream().map(RankEntry::name).toList();
        assertThat(starNames).isSorted();
    }

    @Test
    void lastUpdated_sortsChronologicallyThenByName() {
        List<RepoMetrics> repos = List.of(
                repo("late", 0, 0, 0, T0.plusSeconds(60)),
                repo("zeta", 0, 0, 0, T0),
                repo("alpha", 0, 0, 0, T0)
        );

        RankedList view = RankedViews.rank(ViewKind.LAST_UPDATED, repos);

        assertThat(view.entries()).containsExactly(
                new LastUpdated("Netflix/alpha", T0),
                new LastUpdated("Netflix/zeta", T0),
                new LastUpdated("Netflix/late", T0.plusSeconds(60))
        );
    }

    @Test
    void build_producesEveryViewWithOneEntryPerRepo() {
        List<RepoMetrics> repos = List.of(
                repo("a", 1, 2, 3, T0),
                repo("b", 3, 2, 1, T0.plusSeconds(1))
        );

        Map<ViewKind, RankedList> views = RankedViews.build(repos);

        assertThat(views).containsOnlyKeys(ViewKind.values());
        views.values().forEach(v -> assertThat(v.size()).isEqualTo(2));
        assertThat(views.get(ViewKind.STARS).entries().get(0).name()).isEqualTo("Netflix/b");
        assertThat(views.get(ViewKind.FORKS).entries().get(0).name()).isEqualTo("Netflix/a");
    }

    @Test
    void build_emptyRepos_yieldsEmptyViews() {
        Map<ViewKind, RankedList> views = RankedViews.build(List.of());
        assertThat(views.values()).allSatisfy(v -> assertThat(v.entries()).isEmpty());
    }
}
