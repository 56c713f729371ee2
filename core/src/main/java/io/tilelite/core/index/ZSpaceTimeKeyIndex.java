// file: core/src/main/java/io/tilelite/core/index/ZSpaceTimeKeyIndex.java
package io.tilelite.core.index;

import io.tilelite.core.index.curve.MortonCurve;
import io.tilelite.core.index.curve.SpaceFillingCurve;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpaceTimeKey;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 3D Z-order index over (col, row, time bin).
 * <p>
 * The time axis is discretised: bin = floorDiv(instant - minInstant, temporalResolutionMillis).
 * Keys at the same cell whose instants fall in one bin share an index; the
 * storage layer keeps every entry of a shared index, and readers filter on the
 * exact key.
 */
public final class ZSpaceTimeKeyIndex implements KeyIndex<SpaceTimeKey> {

    public static final String TYPE = "zorder";

    private final KeyBounds<SpaceTimeKey> keyBounds;
    private final long temporalResolutionMillis;
    private final MortonCurve curve;

    public ZSpaceTimeKeyIndex(KeyBounds<SpaceTimeKey> keyBounds, long temporalResolutionMillis) {
        this.keyBounds = Objects.requireNonNull(keyBounds, "keyBounds");
        if (temporalResolutionMillis <= 0) {
            throw new IllegalArgumentException("temporal resolution must be > 0 ms, got " + temporalResolutionMillis);
        }
        this.temporalResolutionMillis = temporalResolutionMillis;

        SpaceTimeKey min = keyBounds.minKey();
        SpaceTimeKey max = keyBounds.maxKey();
        long width = (long) max.col() - min.col() + 1;
        long height = (long) max.row() - min.row() + 1;
        long bins = bin(max.instant()) + 1;
        int bits = Math.max(
                SpaceFillingCurve.bitsFor(bins),
                Math.max(SpaceFillingCurve.bitsFor(width), SpaceFillingCurve.bitsFor(height)));
        this.curve = new MortonCurve(3, bits);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public KeyBounds<SpaceTimeKey> keyBounds() {
        return keyBounds;
    }

    public long temporalResolutionMillis() {
        return temporalResolutionMillis;
    }

    @Override
    public long toIndex(SpaceTimeKey key) {
        if (!keyBounds.includes(key)) {
            throw new IllegalArgumentException(key + " is outside the index key space " + keyBounds);
        }
        return curve.index(cellOf(key));
    }

    @Override
    public List<IndexRange> indexRanges(KeyBounds<SpaceTimeKey> bounds) {
        Objects.requireNonNull(bounds, "bounds");
        Optional<KeyBounds<SpaceTimeKey>> clipped = keyBounds.intersect(bounds);
        if (clipped.isEmpty()) {
            return List.of();
        }
        KeyBounds<SpaceTimeKey> q = clipped.get();
        return curve.ranges(cellOf(q.minKey()), cellOf(q.maxKey()));
    }

    private long[] cellOf(SpaceTimeKey key) {
        SpaceTimeKey origin = keyBounds.minKey();
        return new long[]{
                (long) key.col() - origin.col(),
                (long) key.row() - origin.row(),
                bin(key.instant())
        };
    }

    private long bin(long instant) {
        return Math.floorDiv(Math.subtractExact(instant, keyBounds.minKey().instant()), temporalResolutionMillis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ZSpaceTimeKeyIndex other)) return false;
        return temporalResolutionMillis == other.temporalResolutionMillis && keyBounds.equals(other.keyBounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TYPE, keyBounds, temporalResolutionMillis);
    }

    @Override
    public String toString() {
        return "ZSpaceTimeKeyIndex(" + keyBounds + ", resolution=" + temporalResolutionMillis + "ms)";
    }
}
