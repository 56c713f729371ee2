// file: core/src/main/java/io/tilelite/core/index/KeyIndexMethod.java
package io.tilelite.core.index;

import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;

/**
 * Factory selecting the index strategy for a layer at write time.
 * The writer hands it the bounds of the data being written.
 */
@FunctionalInterface
public interface KeyIndexMethod<K extends GridKey<K>> {

    KeyIndex<K> createIndex(KeyBounds<K> keyBounds);
}
