package org.iceforge.repocache.core.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * The four fixed rankings computed over an organization's repositories.
 * <p>
 * Each kind knows how to project a {@link RepoMetrics} into its typed {@link RankEntry}
 * and how repositories are ordered for it: ascending by metric, ties broken by name.
 */
public enum ViewKind {
    FORKS("forks"),
    OPEN_ISSUES("open_issues"),
    STARS("stars"),
    LAST_UPDATED("last_updated");

    private final String pathSegment;

    ViewKind(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /** Segment used in {@code /view/bottom/{n}/{kind}}. */
    public String pathSegment() {
        return pathSegment;
    }

    public RankEntry entryOf(RepoMetrics repo) {
        return switch (this) {
            case FORKS -> new ForkCount(repo.name(), repo.forks());
            case OPEN_ISSUES -> new OpenIssueCount(repo.name(), repo.openIssues());
            case STARS -> new StarCount(repo.name(), repo.stars());
            case LAST_UPDATED -> new LastUpdated(repo.name(), repo.updatedAt());
        };
    }

    /** Ranking order over the source metrics: metric ascending, then name ascending. */
    public Comparator<RepoMetrics> order() {
        Comparator<RepoMetrics> byMetric = switch (this) {
            case FORKS -> Comparator.comparingLong(RepoMetrics::forks);
            case OPEN_ISSUES -> Comparator.comparingLong(RepoMetrics::openIssues);
            case STARS -> Comparator.comparingLong(RepoMetrics::stars);
            case LAST_UPDATED -> Comparator.comparing(RepoMetrics::updatedAt);
        };
        return byMetric.thenComparing(RepoMetrics::name);
    }

    public static Optional<ViewKind> fromPathSegment(String segment) {
        if (segment == null) return Optional.empty();
        String s = segment.trim().toLowerCase(Locale.ROOT);
        for (ViewKind k : values()) {
            if (k.pathSegment.equals(s)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
