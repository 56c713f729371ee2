// file: core/src/main/java/io/tilelite/core/key/SpaceTimeKey.java
package io.tilelite.core.key;

import java.time.Instant;

/**
 * Tile position plus a point in time.
 * <p>
 * Fields:
 *  - col, row: layout grid position.
 *  - instant:  epoch milliseconds.
 * <p>
 * Total order: by instant, then row, then column.
 */
public record SpaceTimeKey(int col, int row, long instant)
        implements GridKey<SpaceTimeKey>, Comparable<SpaceTimeKey> {

    public static SpaceTimeKey of(int col, int row, Instant time) {
        return new SpaceTimeKey(col, row, time.toEpochMilli());
    }

    public SpatialKey spatialKey() {
        return new SpatialKey(col, row);
    }

    public Instant time() {
        return Instant.ofEpochMilli(instant);
    }

    @Override
    public SpaceTimeKey componentMin(SpaceTimeKey other) {
        return new SpaceTimeKey(
                Math.min(col, other.col),
                Math.min(row, other.row),
                Math.min(instant, other.instant));
    }

    @Override
    public SpaceTimeKey componentMax(SpaceTimeKey other) {
        return new SpaceTimeKey(
                Math.max(col, other.col),
                Math.max(row, other.row),
                Math.max(instant, other.instant));
    }

    @Override
    public boolean isComponentwiseLessOrEqual(SpaceTimeKey other) {
        return col <= other.col && row <= other.row && instant <= other.instant;
    }

    @Override
    public int compareTo(SpaceTimeKey o) {
        int c = Long.compare(instant, o.instant);
        if (c != 0) return c;
        c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(col, o.col);
    }

    @Override
    public String toString() {
        return "SpaceTimeKey(" + col + "," + row + "," + time() + ")";
    }
}
