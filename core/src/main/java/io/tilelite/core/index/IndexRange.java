// file: core/src/main/java/io/tilelite/core/index/IndexRange.java
package io.tilelite.core.index;

/**
 * Inclusive interval [start, end] of positions in the one-dimensional index space.
 * A range with start == end is a single position.
 */
public record IndexRange(long start, long end) {

    public IndexRange {
        if (start > end) {
            throw new IllegalArgumentException("range end " + end + " must be >= start " + start);
        }
    }

    public static IndexRange point(long index) {
        return new IndexRange(index, index);
    }

    public boolean contains(long index) {
        return index >= start && index <= end;
    }

    public boolean contains(IndexRange other) {
        return other.start >= start && other.end <= end;
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + "]";
    }
}
