package io.tilelite.core.key;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class KeyBoundsSpec {

    private static SpatialKey k(int c, int r) {
        return new SpatialKey(c, r);
    }

    @Test
    void min_above_max_on_any_axis_is_rejected() {
        assertThrows(InvalidBoundsException.class, () -> new KeyBounds<>(k(5, 0), k(4, 9)));
        assertThrows(InvalidBoundsException.class, () -> new KeyBounds<>(k(0, 5), k(9, 4)));
        var ex = assertThrows(IllegalArgumentException.class,
                () -> new KeyBounds<>(new SpaceTimeKey(0, 0, 10), new SpaceTimeKey(1, 1, 9)));
        assertInstanceOf(InvalidBoundsException.class, ex);
    }

    @Test
    void from_keys_encloses_all_keys() {
        var b = KeyBounds.fromKeys(List.of(k(3, 1), k(0, 7), k(5, 4)));
        assertEquals(Optional.of(new KeyBounds<>(k(0, 1), k(5, 7))), b);
        assertEquals(Optional.empty(), KeyBounds.fromKeys(List.<SpatialKey>of()));
    }

    @Test
    void intersect_clips_or_reports_disjoint() {
        var a = new KeyBounds<>(k(0, 0), k(9, 9));
        assertEquals(Optional.of(new KeyBounds<>(k(5, 5), k(9, 9))),
                a.intersect(new KeyBounds<>(k(5, 5), k(20, 20))));
        assertTrue(a.intersect(new KeyBounds<>(k(10, 0), k(12, 3))).isEmpty());
        // overlapping on one axis only is still disjoint
        assertTrue(a.intersect(new KeyBounds<>(k(2, 10), k(3, 11))).isEmpty());
    }

    @Test
    void includes_contains_and_combine() {
        var a = new KeyBounds<>(k(0, 0), k(3, 3));
        assertTrue(a.includes(k(3, 0)));
        assertFalse(a.includes(k(4, 0)));
        assertTrue(a.contains(new KeyBounds<>(k(1, 1), k(2, 3))));
        assertFalse(a.contains(new KeyBounds<>(k(1, 1), k(2, 4))));
        assertEquals(new KeyBounds<>(k(0, 0), k(8, 5)), a.combine(KeyBounds.of(k(8, 5))));
        assertTrue(KeyBounds.of(k(2, 2)).isSingleKey());
    }

    @Test
    void space_time_keys_order_by_instant_then_row_then_col() {
        var a = new SpaceTimeKey(9, 9, 1);
        var b = new SpaceTimeKey(0, 0, 2);
        var c = new SpaceTimeKey(5, 0, 2);
        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(c) < 0);
        assertEquals(k(9, 9), a.spatialKey());
    }
}
