// file: core/src/main/java/io/tilelite/core/index/KeyIndexMethods.java
package io.tilelite.core.index;

import io.tilelite.core.key.SpaceTimeKey;
import io.tilelite.core.key.SpatialKey;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Preset index methods.
 */
public final class KeyIndexMethods {

    private KeyIndexMethods() {
        // utility
    }

    public static KeyIndexMethod<SpatialKey> rowMajor() {
        return RowMajorSpatialKeyIndex::new;
    }

    public static KeyIndexMethod<SpatialKey> zCurve() {
        return ZSpatialKeyIndex::new;
    }

    public static KeyIndexMethod<SpatialKey> hilbert() {
        return HilbertSpatialKeyIndex::new;
    }

    /** Z-order over (col, row, time bin); instants within one resolution step share a bin. */
    public static KeyIndexMethod<SpaceTimeKey> zCurve(Duration temporalResolution) {
        Objects.requireNonNull(temporalResolution, "temporalResolution");
        long millis = temporalResolution.toMillis();
        return bounds -> new ZSpaceTimeKeyIndex(bounds, millis);
    }

    /**
     * Resolve a spatial method by its persisted type name ("rowmajor", "zorder", "hilbert").
     */
    public static KeyIndexMethod<SpatialKey> spatialByName(String name) {
        Objects.requireNonNull(name, "name");
        return switch (name.toLowerCase(Locale.ROOT)) {
            case RowMajorSpatialKeyIndex.TYPE -> rowMajor();
            case ZSpatialKeyIndex.TYPE -> zCurve();
            case HilbertSpatialKeyIndex.TYPE -> hilbert();
            default -> throw new IllegalArgumentException("unknown index method: " + name);
        };
    }
}
