// file: storage/src/main/java/io/tilelite/storage/codec/TileCodec.java
package io.tilelite.storage.codec;

import io.tilelite.core.layer.RecordSchema;
import io.tilelite.core.raster.Tile;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Codec for {@link Tile} values, schema "tile" v1.
 * <p>
 * Layout (little-endian):
 *   - cols:  int32
 *   - rows:  int32
 *   - cells: cols * rows float64, row by row
 */
public final class TileCodec implements ValueCodec<Tile> {

    public static final RecordSchema SCHEMA = new RecordSchema("tile", 1);

    @Override
    public RecordSchema schema() {
        return SCHEMA;
    }

    @Override
    public byte[] encode(Tile tile) {
        double[] cells = tile.cells();
        ByteBuffer b = ByteBuffer.allocate(8 + cells.length * 8).order(ByteOrder.LITTLE_ENDIAN);
        b.putInt(tile.cols()).putInt(tile.rows());
        for (double c : cells) b.putDouble(c);
        return b.array();
    }

    @Override
    public Tile decode(byte[] bytes, RecordSchema writerSchema) {
        if (!canRead(writerSchema)) {
            throw new RecordDecodeException("cannot decode " + writerSchema + " with " + SCHEMA);
        }
        try {
            ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
            int cols = b.getInt();
            int rows = b.getInt();
            long expected = (long) cols * rows * 8;
            if (cols <= 0 || rows <= 0 || expected != b.remaining()) {
                throw new RecordDecodeException(
                        "tile " + cols + "x" + rows + " does not match " + b.remaining() + " cell bytes");
            }
            double[] cells = new double[cols * rows];
            for (int i = 0; i < cells.length; i++) cells[i] = b.getDouble();
            return new Tile(cols, rows, cells);
        } catch (BufferUnderflowException e) {
            throw new RecordDecodeException("truncated tile record", e);
        }
    }
}
