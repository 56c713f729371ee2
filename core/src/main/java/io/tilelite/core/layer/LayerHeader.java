// file: core/src/main/java/io/tilelite/core/layer/LayerHeader.java
package io.tilelite.core.layer;

import java.util.Objects;

/**
 * Storage location descriptor of a layer.
 * <p>
 * Fields:
 *  - keyType:    key format name the layer was written with (e.g. "spatial").
 *  - valueType:  value schema name (e.g. "tile").
 *  - table:      backing-store table holding the data.
 *  - partition:  partition within the table holding this generation's records.
 *  - generation: bumped on every rewrite; a rewrite lands in a fresh partition so
 *                the old metadata never points at half-written data.
 */
public record LayerHeader(String keyType, String valueType, String table, String partition, long generation) {

    public LayerHeader {
        Objects.requireNonNull(keyType, "keyType");
        Objects.requireNonNull(valueType, "valueType");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(partition, "partition");
        if (generation < 1) throw new IllegalArgumentException("generation must be >= 1");
    }
}
