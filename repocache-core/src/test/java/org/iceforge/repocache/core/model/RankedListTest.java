package org.iceforge.repocache.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RankedListTest {

    private final RankedList stars = new RankedList(ViewKind.STARS, List.of(
            new StarCount("o/a", 1),
            new StarCount("o/b", 2),
            new StarCount("o/c", 3)
    ));

    @Test
    void bottom_returnsAscendingPrefix() {
        assertThat(stars.bottom(2)).containsExactly(new StarCount("o/a", 1), new StarCount("o/b", 2));
    }

    @Test
    void bottom_clampsToLength() {
        assertThat(stars.bottom(1000)).hasSize(3).isEqualTo(stars.entries());
    }

    @Test
    void bottom_rejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> stars.bottom(0));
        assertThrows(IllegalArgumentException.class, () -> stars.bottom(-3));
    }

    @Test
    void entries_areImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> stars.entries().add(new StarCount("o/d", 0)));
    }

    @Test
    void viewKind_resolvesPathSegments() {
        assertThat(ViewKind.fromPathSegment("open_issues")).contains(ViewKind.OPEN_ISSUES);
        assertThat(ViewKind.fromPathSegment("LAST_UPDATED")).contains(ViewKind.LAST_UPDATED);
        assertThat(ViewKind.fromPathSegment("watchers")).isEmpty();
        assertThat(ViewKind.fromPathSegment(null)).isEmpty();
    }
}
