// file: core/src/main/java/io/tilelite/core/index/MergeQueue.java
package io.tilelite.core.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Coalesces index ranges into the minimal sorted list of disjoint scan ranges.
 * <p>
 * Algorithm:
 *  - Ranges are kept in a set ordered by end (then start), so duplicates collapse
 *    and iteration order depends only on the multiset of ranges added.
 *  - A single left-to-right sweep keeps a stack of output runs. The next range
 *    absorbs every run on top of the stack whose end is within FUDGE of its start,
 *    then is pushed. Because ends only grow during the sweep, the stack stays
 *    sorted by start and pairwise disjoint.
 * <p>
 * FUDGE = 1 merges ranges that merely touch ([0,5] and [6,10] become [0,10]),
 * trading nothing in scanned rows for one less scan request.
 * <p>
 * Not thread safe; the static {@link #merge(Iterable)} allocates its own queue.
 */
public final class MergeQueue {

    static final long FUDGE = 1L;

    private static final Comparator<IndexRange> BY_END_THEN_START =
            Comparator.comparingLong(IndexRange::end).thenComparingLong(IndexRange::start);

    private final TreeSet<IndexRange> ranges = new TreeSet<>(BY_END_THEN_START);

    /** Merge the given ranges in one call. */
    public static List<IndexRange> merge(Iterable<IndexRange> ranges) {
        MergeQueue q = new MergeQueue();
        q.addAll(ranges);
        return q.toList();
    }

    public void add(IndexRange range) {
        ranges.add(range);
    }

    public void addAll(Iterable<IndexRange> more) {
        for (IndexRange r : more) {
            ranges.add(r);
        }
    }

    public int size() {
        return ranges.size();
    }

    /**
     * Return the merged ranges, sorted ascending by start.
     * The queue itself is left untouched and can keep accumulating.
     */
    public List<IndexRange> toList() {
        List<IndexRange> stack = new ArrayList<>();
        for (IndexRange next : ranges) {
            long start = next.start();
            while (!stack.isEmpty()) {
                IndexRange top = stack.get(stack.size() - 1);
                if (!coalesces(top.end(), start)) {
                    break;
                }
                start = Math.min(start, top.start());
                stack.remove(stack.size() - 1);
            }
            stack.add(new IndexRange(start, next.end()));
        }
        return List.copyOf(stack);
    }

    /** True when a range starting at nextStart overlaps or is within FUDGE of a run ending at runEnd. */
    private static boolean coalesces(long runEnd, long nextStart) {
        if (nextStart <= runEnd) {
            return true;
        }
        // runEnd + FUDGE would overflow: anything after it is within reach.
        return runEnd > Long.MAX_VALUE - FUDGE || nextStart <= runEnd + FUDGE;
    }
}
