// file: core/src/main/java/io/tilelite/core/index/HilbertSpatialKeyIndex.java
package io.tilelite.core.index;

import io.tilelite.core.index.curve.HilbertCurve2D;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpatialKey;

/**
 * Hilbert curve index over spatial keys.
 */
public final class HilbertSpatialKeyIndex extends SpatialCurveKeyIndex {

    public static final String TYPE = "hilbert";

    public HilbertSpatialKeyIndex(KeyBounds<SpatialKey> keyBounds) {
        super(keyBounds, HilbertCurve2D::new);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
