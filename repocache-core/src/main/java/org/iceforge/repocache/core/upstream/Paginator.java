package org.iceforge.repocache.core.upstream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flattens a page-numbered collection: asks for pages 1, 2, 3... of {@link #PAGE_SIZE}
 * items and stops at the first empty page. A failing page aborts the whole walk.
 */
public final class Paginator {

    public static final int PAGE_SIZE = 100;

    @FunctionalInterface
    public interface PageFetcher<T> {
        List<T> fetch(int page, int perPage);
    }

    private Paginator() {}

    public static <T> List<T> flatten(PageFetcher<T> fetcher) {
        Objects.requireNonNull(fetcher, "fetcher");
        List<T> all = new ArrayList<>();
        int page = 1;
        while (true) {
            List<T> items = fetcher.fetch(page, PAGE_SIZE);
            if (items == null || items.isEmpty()) {
                break;
            }
            all.addAll(items);
            page++;
        }
        return all;
    }
}
