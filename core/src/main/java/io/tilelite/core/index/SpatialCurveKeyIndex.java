// file: core/src/main/java/io/tilelite/core/index/SpatialCurveKeyIndex.java
package io.tilelite.core.index;

import io.tilelite.core.index.curve.SpaceFillingCurve;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpatialKey;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Spatial key index backed by a 2D space-filling curve.
 * <p>
 * Keys are shifted so the key space starts at cell (0, 0); the curve is sized to
 * the smallest power of two covering the wider axis.
 */
abstract class SpatialCurveKeyIndex implements KeyIndex<SpatialKey> {

    private final KeyBounds<SpatialKey> keyBounds;
    private final SpaceFillingCurve curve;

    SpatialCurveKeyIndex(KeyBounds<SpatialKey> keyBounds, IntFunction<SpaceFillingCurve> curveForBits) {
        this.keyBounds = Objects.requireNonNull(keyBounds, "keyBounds");
        SpatialKey min = keyBounds.minKey();
        SpatialKey max = keyBounds.maxKey();
        long width = (long) max.col() - min.col() + 1;
        long height = (long) max.row() - min.row() + 1;
        int bits = Math.max(SpaceFillingCurve.bitsFor(width), SpaceFillingCurve.bitsFor(height));
        this.curve = curveForBits.apply(bits);
    }

    @Override
    public KeyBounds<SpatialKey> keyBounds() {
        return keyBounds;
    }

    SpaceFillingCurve curve() {
        return curve;
    }

    @Override
    public long toIndex(SpatialKey key) {
        if (!keyBounds.includes(key)) {
            throw new IllegalArgumentException(key + " is outside the index key space " + keyBounds);
        }
        return curve.index(cellOf(key));
    }

    @Override
    public List<IndexRange> indexRanges(KeyBounds<SpatialKey> bounds) {
        Objects.requireNonNull(bounds, "bounds");
        Optional<KeyBounds<SpatialKey>> clipped = keyBounds.intersect(bounds);
        if (clipped.isEmpty()) {
            return List.of();
        }
        KeyBounds<SpatialKey> q = clipped.get();
        return curve.ranges(cellOf(q.minKey()), cellOf(q.maxKey()));
    }

    private long[] cellOf(SpatialKey key) {
        SpatialKey origin = keyBounds.minKey();
        return new long[]{(long) key.col() - origin.col(), (long) key.row() - origin.row()};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return keyBounds.equals(((SpatialCurveKeyIndex) o).keyBounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type(), keyBounds);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + keyBounds + ")";
    }
}
