package org.iceforge.repocache.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The normalized per-repository fields the rankings are built from. The cache engine only
 * ever ranks these, never the upstream payload itself.
 */
public record RepoMetrics(String name, long forks, long openIssues, long stars, Instant updatedAt) {
    public RepoMetrics {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
