// file: core/src/main/java/io/tilelite/core/layer/LayerMetadata.java
package io.tilelite.core.layer;

import io.tilelite.core.index.KeyIndex;
import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;

import java.util.Objects;

/**
 * Everything a reader needs to find and decode a layer.
 * Created at write time, never mutated, replaced wholesale when the layer is rewritten.
 */
public record LayerMetadata<K extends GridKey<K>>(
        LayerHeader header,
        KeyBounds<K> keyBounds,
        KeyIndex<K> keyIndex,
        RecordSchema schema
) {
    public LayerMetadata {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(keyBounds, "keyBounds");
        Objects.requireNonNull(keyIndex, "keyIndex");
        Objects.requireNonNull(schema, "schema");
    }
}
