// file: core/src/main/java/io/tilelite/core/index/ZSpatialKeyIndex.java
package io.tilelite.core.index;

import io.tilelite.core.index.curve.MortonCurve;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpatialKey;

/**
 * Z-order (Morton) index over spatial keys.
 */
public final class ZSpatialKeyIndex extends SpatialCurveKeyIndex {

    public static final String TYPE = "zorder";

    public ZSpatialKeyIndex(KeyBounds<SpatialKey> keyBounds) {
        super(keyBounds, bits -> new MortonCurve(2, bits));
    }

    @Override
    public String type() {
        return TYPE;
    }
}
