package org.iceforge.repocache.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An immutable ranking, ascending by metric with ties broken by name.
 */
public record RankedList(ViewKind kind, List<RankEntry> entries) {

    public RankedList {
        Objects.requireNonNull(kind, "kind");
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    /**
     * The {@code n} lowest-ranked entries, in ranking order. {@code n} larger than the list
     * is clamped to the list size.
     *
     * @throws IllegalArgumentException if {@code n} is not positive
     */
    public List<RankEntry> bottom(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be a positive integer, got " + n);
        }
        return entries.subList(0, Math.min(n, entries.size()));
    }
}
