// file: core/src/main/java/io/tilelite/core/index/curve/MortonCurve.java
package io.tilelite.core.index.curve;

/**
 * Z-order (Morton) curve: bit b of axis d lands at position b * dims + d.
 */
public final class MortonCurve extends SpaceFillingCurve {

    public MortonCurve(int dimensions, int bitsPerDimension) {
        super(dimensions, bitsPerDimension);
    }

    @Override
    public long index(long... cell) {
        checkCell(cell);
        int dims = dimensions();
        long z = 0;
        for (int b = 0; b < bitsPerDimension(); b++) {
            for (int d = 0; d < dims; d++) {
                z |= ((cell[d] >>> b) & 1L) << (b * dims + d);
            }
        }
        return z;
    }

    @Override
    public long[] cell(long index) {
        checkIndex(index);
        int dims = dimensions();
        long[] cell = new long[dims];
        for (int b = 0; b < bitsPerDimension(); b++) {
            for (int d = 0; d < dims; d++) {
                cell[d] |= ((index >>> (b * dims + d)) & 1L) << b;
            }
        }
        return cell;
    }
}
