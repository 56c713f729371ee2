// file: core/src/main/java/io/tilelite/core/index/curve/SpaceFillingCurve.java
package io.tilelite.core.index.curve;

import io.tilelite.core.index.IndexRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A bijection between the cells of a 2^bits-wide hypercube grid and [0, 2^(dims*bits)).
 * <p>
 * Range decomposition relies on one property shared by Z-order and Hilbert curves:
 * an aligned sub-cube of side 2^k covers exactly one contiguous block of 2^(k*dims)
 * indices, starting at a multiple of the block size. The decomposition walks the
 * implicit 2^dims-ary tree of aligned cubes:
 *  - a cube disjoint from the query is skipped,
 *  - a cube inside the query emits its whole block,
 *  - anything else is split into children, visited in curve order so that
 *    output comes out sorted and touching blocks can be joined on the fly.
 * Only cubes crossing the query boundary are split, so the output is proportional
 * to the query's surface, not its volume.
 */
public abstract class SpaceFillingCurve {

    /** Indices stay non-negative longs. */
    public static final int MAX_INDEX_BITS = 62;

    private final int dimensions;
    private final int bitsPerDimension;

    protected SpaceFillingCurve(int dimensions, int bitsPerDimension) {
        if (dimensions < 1) throw new IllegalArgumentException("dimensions must be >= 1");
        if (bitsPerDimension < 0) throw new IllegalArgumentException("bitsPerDimension must be >= 0");
        if ((long) dimensions * bitsPerDimension > MAX_INDEX_BITS) {
            throw new IllegalArgumentException(
                    "%d dimensions x %d bits exceeds %d index bits"
                            .formatted(dimensions, bitsPerDimension, MAX_INDEX_BITS));
        }
        this.dimensions = dimensions;
        this.bitsPerDimension = bitsPerDimension;
    }

    public int dimensions() {
        return dimensions;
    }

    public int bitsPerDimension() {
        return bitsPerDimension;
    }

    /** Number of cells along each axis. */
    public long sideLength() {
        return 1L << bitsPerDimension;
    }

    public long maxIndex() {
        return (1L << (dimensions * bitsPerDimension)) - 1;
    }

    /** Position of a cell on the curve. Every coordinate must be in [0, sideLength()). */
    public abstract long index(long... cell);

    /** Inverse of {@link #index(long...)}. */
    public abstract long[] cell(long index);

    /**
     * Index ranges covering exactly the cells of the box [min, max] (inclusive),
     * sorted ascending and disjoint.
     */
    public List<IndexRange> ranges(long[] min, long[] max) {
        checkCell(min);
        checkCell(max);
        for (int d = 0; d < dimensions; d++) {
            if (min[d] > max[d]) {
                throw new IllegalArgumentException("min > max on axis " + d);
            }
        }
        List<IndexRange> out = new ArrayList<>();
        decompose(new long[dimensions], bitsPerDimension, min, max, out);
        return out;
    }

    private void decompose(long[] origin, int level, long[] min, long[] max, List<IndexRange> out) {
        long side = 1L << level;
        boolean inside = true;
        for (int d = 0; d < dimensions; d++) {
            long lo = origin[d];
            long hi = origin[d] + side - 1;
            if (hi < min[d] || lo > max[d]) {
                return;
            }
            if (lo < min[d] || hi > max[d]) {
                inside = false;
            }
        }

        if (inside) {
            long blockSize = 1L << (level * dimensions);
            long start = index(origin) & -blockSize;
            emit(out, start, start + blockSize - 1);
            return;
        }

        // A single cell is either inside or disjoint, so level > 0 here.
        int childLevel = level - 1;
        long childSide = 1L << childLevel;
        int childCount = 1 << dimensions;
        long[][] childOrigins = new long[childCount][];
        long[] childStarts = new long[childCount];
        Integer[] order = new Integer[childCount];
        for (int c = 0; c < childCount; c++) {
            long[] o = origin.clone();
            for (int d = 0; d < dimensions; d++) {
                if (((c >>> d) & 1) != 0) {
                    o[d] += childSide;
                }
            }
            childOrigins[c] = o;
            childStarts[c] = index(o);
            order[c] = c;
        }
        Arrays.sort(order, (a, b) -> Long.compare(childStarts[a], childStarts[b]));
        for (int c : order) {
            decompose(childOrigins[c], childLevel, min, max, out);
        }
    }

    private static void emit(List<IndexRange> out, long start, long end) {
        if (!out.isEmpty()) {
            IndexRange last = out.get(out.size() - 1);
            if (last.end() + 1 == start) {
                out.set(out.size() - 1, new IndexRange(last.start(), end));
                return;
            }
        }
        out.add(new IndexRange(start, end));
    }

    protected final void checkCell(long[] cell) {
        if (cell.length != dimensions) {
            throw new IllegalArgumentException(
                    "expected %d coordinates, got %d".formatted(dimensions, cell.length));
        }
        long side = sideLength();
        for (int d = 0; d < dimensions; d++) {
            if (cell[d] < 0 || cell[d] >= side) {
                throw new IllegalArgumentException(
                        "coordinate %d on axis %d outside [0, %d)".formatted(cell[d], d, side));
            }
        }
    }

    protected final void checkIndex(long index) {
        if (index < 0 || index > maxIndex()) {
            throw new IllegalArgumentException("index " + index + " outside [0, " + maxIndex() + "]");
        }
    }

    /** Bits needed to address {@code extent} cells along one axis (0 for a single cell). */
    public static int bitsFor(long extent) {
        if (extent < 1) throw new IllegalArgumentException("extent must be >= 1, got " + extent);
        return 64 - Long.numberOfLeadingZeros(extent - 1);
    }
}
