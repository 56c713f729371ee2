package io.tilelite.core.index;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MergeQueueSpec {

    private static IndexRange r(long s, long e) {
        return new IndexRange(s, e);
    }

    @Test
    void touching_ranges_merge() {
        assertEquals(List.of(r(0, 10)), MergeQueue.merge(List.of(r(0, 5), r(6, 10))));
    }

    @Test
    void ranges_with_a_gap_stay_separate() {
        assertEquals(List.of(r(0, 5), r(7, 10)), MergeQueue.merge(List.of(r(7, 10), r(0, 5))));
    }

    @Test
    void overlapping_and_nested_ranges_merge() {
        assertEquals(List.of(r(0, 8)), MergeQueue.merge(List.of(r(0, 5), r(3, 8))));
        assertEquals(List.of(r(0, 10)), MergeQueue.merge(List.of(r(0, 10), r(2, 3))));
        assertEquals(List.of(r(0, 10)), MergeQueue.merge(List.of(r(2, 3), r(0, 10))));
    }

    @Test
    void ranges_sharing_an_end_are_both_covered() {
        assertEquals(List.of(r(0, 5)), MergeQueue.merge(List.of(r(3, 5), r(0, 5))));
        assertEquals(List.of(r(0, 5)), MergeQueue.merge(List.of(r(0, 5), r(3, 5))));
    }

    @Test
    void late_wide_range_absorbs_several_runs() {
        var out = MergeQueue.merge(List.of(r(0, 2), r(10, 20), r(30, 40), r(3, 35)));
        assertEquals(List.of(r(0, 40)), out);

        var out2 = MergeQueue.merge(List.of(r(0, 2), r(10, 20), r(5, 30)));
        assertEquals(List.of(r(0, 2), r(5, 30)), out2);
    }

    @Test
    void empty_single_duplicate_and_point_inputs() {
        assertEquals(List.of(), MergeQueue.merge(List.of()));
        assertEquals(List.of(r(4, 9)), MergeQueue.merge(List.of(r(4, 9))));
        assertEquals(List.of(r(4, 9)), MergeQueue.merge(List.of(r(4, 9), r(4, 9), r(4, 9))));
        assertEquals(List.of(r(7, 7)), MergeQueue.merge(List.of(IndexRange.point(7))));
        assertEquals(List.of(r(7, 8)), MergeQueue.merge(List.of(IndexRange.point(8), IndexRange.point(7))));
    }

    @Test
    void no_overflow_near_long_max() {
        long max = Long.MAX_VALUE;
        assertEquals(List.of(r(0, max)), MergeQueue.merge(List.of(r(max - 1, max), r(0, max - 2))));
        assertEquals(List.of(r(0, max - 3), r(max - 1, max)),
                MergeQueue.merge(List.of(r(max - 1, max), r(0, max - 3))));
        assertEquals(List.of(r(max, max)), MergeQueue.merge(List.of(r(max, max), r(max, max))));
    }

    @Test
    void accumulating_form_matches_one_shot_merge() {
        var q = new MergeQueue();
        q.add(r(20, 30));
        q.addAll(List.of(r(0, 3), r(4, 9)));
        assertEquals(3, q.size());
        assertEquals(List.of(r(0, 9), r(20, 30)), q.toList());

        q.add(r(10, 19));
        assertEquals(List.of(r(0, 30)), q.toList());
    }

    @Test
    void output_covers_exactly_the_union_and_is_disjoint_sorted_and_gapped() {
        var rnd = new Random(42);
        for (int round = 0; round < 200; round++) {
            List<IndexRange> in = randomRanges(rnd, 1 + rnd.nextInt(40), 300);
            var out = MergeQueue.merge(in);

            boolean[] expected = new boolean[301];
            for (var x : in) for (long i = x.start(); i <= x.end(); i++) expected[(int) i] = true;
            boolean[] actual = new boolean[301];
            for (var x : out) for (long i = x.start(); i <= x.end(); i++) {
                assertFalse(actual[(int) i], "ranges overlap at " + i);
                actual[(int) i] = true;
            }
            for (int i = 0; i <= 300; i++) {
                assertEquals(expected[i], actual[i], "coverage differs at " + i + " for " + in);
            }
            for (int i = 1; i < out.size(); i++) {
                assertTrue(out.get(i).start() > out.get(i - 1).end() + MergeQueue.FUDGE,
                        "runs should be separated by a gap: " + out);
            }
        }
    }

    @Test
    void result_does_not_depend_on_insertion_order() {
        var rnd = new Random(7);
        for (int round = 0; round < 50; round++) {
            var in = randomRanges(rnd, 30, 1_000);
            var expected = MergeQueue.merge(in);
            for (int shuffle = 0; shuffle < 5; shuffle++) {
                var copy = new ArrayList<>(in);
                Collections.shuffle(copy, rnd);
                assertEquals(expected, MergeQueue.merge(copy));
            }
        }
    }

    @Test
    void merging_is_idempotent() {
        var rnd = new Random(99);
        for (int round = 0; round < 50; round++) {
            var once = MergeQueue.merge(randomRanges(rnd, 25, 500));
            assertEquals(once, MergeQueue.merge(once));
        }
    }

    private static List<IndexRange> randomRanges(Random rnd, int count, int limit) {
        List<IndexRange> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long s = rnd.nextInt(limit);
            long e = Math.min(limit, s + rnd.nextInt(15));
            out.add(r(s, e));
        }
        return out;
    }
}
