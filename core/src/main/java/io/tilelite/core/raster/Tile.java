// file: core/src/main/java/io/tilelite/core/raster/Tile.java
package io.tilelite.core.raster;

import java.util.Arrays;

/**
 * Immutable cols x rows grid of double cells, stored row by row.
 * Cells are copied on the way in and on the way out.
 */
public final class Tile {
    private final int cols;
    private final int rows;
    private final double[] cells;

    public Tile(int cols, int rows, double[] cells) {
        if (cols <= 0 || rows <= 0) {
            throw new IllegalArgumentException("tile dimensions must be > 0, got " + cols + "x" + rows);
        }
        if (cells == null || cells.length != (long) cols * rows) {
            throw new IllegalArgumentException("expected " + ((long) cols * rows) + " cells");
        }
        this.cols = cols;
        this.rows = rows;
        this.cells = Arrays.copyOf(cells, cells.length);
    }

    public static Tile fill(int cols, int rows, double value) {
        double[] c = new double[cols * rows];
        Arrays.fill(c, value);
        return new Tile(cols, rows, c);
    }

    public int cols() { return cols; }

    public int rows() { return rows; }

    public double get(int col, int row) {
        if (col < 0 || col >= cols || row < 0 || row >= rows) {
            throw new IndexOutOfBoundsException("cell (" + col + "," + row + ") outside " + cols + "x" + rows);
        }
        return cells[row * cols + col];
    }

    public double[] cells() { return Arrays.copyOf(cells, cells.length); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tile t)) return false;
        return cols == t.cols && rows == t.rows && Arrays.equals(cells, t.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * cols + rows) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "Tile(" + cols + "x" + rows + ")";
    }
}
