package org.iceforge.repocache.core.cache;

import org.iceforge.repocache.core.model.RankEntry;
import org.iceforge.repocache.core.model.RankedList;
import org.iceforge.repocache.core.model.RepoMetrics;
import org.iceforge.repocache.core.model.ViewKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Builds the four rankings for one hydration. */
public final class RankedViews {
    private RankedViews() {}

    public static Map<ViewKind, RankedList> build(List<RepoMetrics> repos) {
        Map<ViewKind, RankedList> views = new EnumMap<>(ViewKind.class);
        for (ViewKind kind : ViewKind.values()) {
            views.put(kind, rank(kind, repos));
        }
        return views;
    }

    public static RankedList rank(ViewKind kind, List<RepoMetrics> repos) {
        List<RankEntry> entries = repos.stream()
                .sorted(kind.order())
                .map(kind::entryOf)
                .toList();
        return new RankedList(kind, entries);
    }
}
