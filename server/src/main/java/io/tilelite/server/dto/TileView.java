package io.tilelite.server.dto;

/** A tile with its grid position; cells are row by row. */
public class TileView {
    public int col;
    public int row;
    public int cols;
    public int rows;
    public double[] cells;
}
