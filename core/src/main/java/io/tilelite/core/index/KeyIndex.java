// file: core/src/main/java/io/tilelite/core/index/KeyIndex.java
package io.tilelite.core.index;

import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;

import java.util.List;

/**
 * Maps keys of one layer to positions in a one-dimensional index space.
 * <p>
 * Contract:
 *  - Immutable; built once per layer when the layer is written and persisted
 *    with the layer metadata, so reads use the exact same strategy and parameters.
 *  - toIndex() is deterministic and collision-free within {@link #keyBounds()}
 *    (except where a strategy documents a coarser resolution on some axis).
 *    Keys outside the key space are rejected.
 *  - indexRanges() is sound: every key inside the query maps into one of the
 *    returned ranges. Ranges are sorted ascending and disjoint. Over-coverage is
 *    legal but costs scanned rows.
 *  - Implementations are pure and safe to call from many threads.
 */
public interface KeyIndex<K extends GridKey<K>> {

    /** Persisted name of the strategy, e.g. "zorder". */
    String type();

    /** The key space this index was built for. */
    KeyBounds<K> keyBounds();

    long toIndex(K key);

    /**
     * Decompose a query region into index ranges. The region is clipped to the
     * key space first; a region outside the key space yields an empty list.
     */
    List<IndexRange> indexRanges(KeyBounds<K> bounds);
}
