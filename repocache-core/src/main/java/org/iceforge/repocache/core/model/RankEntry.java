package org.iceforge.repocache.core.model;

/**
 * One row of a {@link RankedList}. Every {@link ViewKind} has its own record type so the
 * metric keeps its real type (a count or a timestamp).
 */
public interface RankEntry {

    /** Qualified repository name, {@code <org>/<repo>}. */
    String name();
}
