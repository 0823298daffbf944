package org.iceforge.repocache.core.upstream;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PaginatorTest {

    private static List<Integer> page(int from, int size) {
        return IntStream.range(from, from + size).boxed().toList();
    }

    @Test
    void flatten_concatenatesUntilEmptyPage() {
        List<Integer> requestedPages = new ArrayList<>();
        List<List<Integer>> pages = List.of(page(0, 100), page(100, 100), page(200, 37), List.of());

        List<Integer> all = Paginator.flatten((p, perPage) -> {
            requestedPages.add(p);
            assertThat(perPage).isEqualTo(Paginator.PAGE_SIZE);
            return pages.get(p - 1);
        });

        assertThat(all).hasSize(237).isEqualTo(page(0, 237));
        assertThat(requestedPages).containsExactly(1, 2, 3, 4);
    }

    @Test
    void flatten_emptyFirstPage_returnsEmptyList() {
        List<Integer> requestedPages = new ArrayList<>();

        List<Integer> all = Paginator.flatten((p, perPage) -> {
            requestedPages.add(p);
            return Collections.emptyList();
        });

        assertThat(all).isEmpty();
        assertThat(requestedPages).containsExactly(1);
    }

    @Test
    void flatten_failingPage_abortsWithoutPartialResult() {
        List<Integer> requestedPages = new ArrayList<>();

        UpstreamStatusException e = assertThrows(UpstreamStatusException.class, () -> Paginator.<Integer>flatten((p, perPage) -> {
            requestedPages.add(p);
            if (p == 2) throw new UpstreamStatusException("members page 2", 503);
            return page(0, 100);
        }));

        assertThat(e.statusCode()).isEqualTo(503);
        assertThat(requestedPages).containsExactly(1, 2);
    }
}
