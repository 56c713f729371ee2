// file: core/src/main/java/io/tilelite/core/key/SpatialKey.java
package io.tilelite.core.key;

/**
 * Column/row position of a tile in a layout grid.
 * <p>
 * Total order is row-major: by row, then by column.
 */
public record SpatialKey(int col, int row) implements GridKey<SpatialKey>, Comparable<SpatialKey> {

    @Override
    public SpatialKey componentMin(SpatialKey other) {
        return new SpatialKey(Math.min(col, other.col), Math.min(row, other.row));
    }

    @Override
    public SpatialKey componentMax(SpatialKey other) {
        return new SpatialKey(Math.max(col, other.col), Math.max(row, other.row));
    }

    @Override
    public boolean isComponentwiseLessOrEqual(SpatialKey other) {
        return col <= other.col && row <= other.row;
    }

    @Override
    public int compareTo(SpatialKey o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(col, o.col);
    }

    @Override
    public String toString() {
        return "SpatialKey(" + col + "," + row + ")";
    }
}
