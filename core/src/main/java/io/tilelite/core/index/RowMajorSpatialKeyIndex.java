// file: core/src/main/java/io/tilelite/core/index/RowMajorSpatialKeyIndex.java
package io.tilelite.core.index;

import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpatialKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Row-major index: index = (row - minRow) * width + (col - minCol).
 * <p>
 * Decomposition yields one range per query row, or a single range when the
 * query spans the full width of the key space.
 */
public final class RowMajorSpatialKeyIndex implements KeyIndex<SpatialKey> {

    public static final String TYPE = "rowmajor";

    private final KeyBounds<SpatialKey> keyBounds;
    private final long width;

    public RowMajorSpatialKeyIndex(KeyBounds<SpatialKey> keyBounds) {
        this.keyBounds = Objects.requireNonNull(keyBounds, "keyBounds");
        SpatialKey min = keyBounds.minKey();
        SpatialKey max = keyBounds.maxKey();
        this.width = (long) max.col() - min.col() + 1;
        long height = (long) max.row() - min.row() + 1;
        // fails fast on key spaces whose last index does not fit a long
        Math.multiplyExact(width, height);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public KeyBounds<SpatialKey> keyBounds() {
        return keyBounds;
    }

    @Override
    public long toIndex(SpatialKey key) {
        if (!keyBounds.includes(key)) {
            throw new IllegalArgumentException(key + " is outside the index key space " + keyBounds);
        }
        return index(key.col(), key.row());
    }

    @Override
    public List<IndexRange> indexRanges(KeyBounds<SpatialKey> bounds) {
        Objects.requireNonNull(bounds, "bounds");
        Optional<KeyBounds<SpatialKey>> clipped = keyBounds.intersect(bounds);
        if (clipped.isEmpty()) {
            return List.of();
        }
        SpatialKey qMin = clipped.get().minKey();
        SpatialKey qMax = clipped.get().maxKey();

        boolean fullWidth = qMin.col() == keyBounds.minKey().col() && qMax.col() == keyBounds.maxKey().col();
        if (fullWidth) {
            return List.of(new IndexRange(index(qMin.col(), qMin.row()), index(qMax.col(), qMax.row())));
        }

        List<IndexRange> ranges = new ArrayList<>(qMax.row() - qMin.row() + 1);
        for (int row = qMin.row(); row <= qMax.row(); row++) {
            ranges.add(new IndexRange(index(qMin.col(), row), index(qMax.col(), row)));
        }
        return ranges;
    }

    private long index(int col, int row) {
        SpatialKey origin = keyBounds.minKey();
        return ((long) row - origin.row()) * width + ((long) col - origin.col());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowMajorSpatialKeyIndex other)) return false;
        return keyBounds.equals(other.keyBounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TYPE, keyBounds);
    }

    @Override
    public String toString() {
        return "RowMajorSpatialKeyIndex(" + keyBounds + ")";
    }
}
