// file: storage/src/main/java/io/tilelite/storage/codec/KeyFormat.java
package io.tilelite.storage.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tilelite.core.index.KeyIndex;
import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;

/**
 * Persisted forms of one key type.
 * <p>
 * Responsibilities:
 *  - binary key encoding for stored entries,
 *  - JSON encoding of keys, key bounds and key indices for the metadata catalog.
 * <p>
 * JSON decoders throw {@link IllegalArgumentException} on missing fields or unknown
 * index types; binary decoders throw {@link RecordDecodeException}.
 */
public interface KeyFormat<K extends GridKey<K>> {

    /** Key type name written to the layer header, e.g. "spatial". */
    String name();

    byte[] encodeKey(K key);

    K decodeKey(byte[] bytes);

    ObjectNode keyToJson(K key);

    K keyFromJson(JsonNode node);

    ObjectNode indexToJson(KeyIndex<K> index);

    KeyIndex<K> indexFromJson(JsonNode node);

    default ObjectNode boundsToJson(KeyBounds<K> bounds) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.set("minKey", keyToJson(bounds.minKey()));
        n.set("maxKey", keyToJson(bounds.maxKey()));
        return n;
    }

    default KeyBounds<K> boundsFromJson(JsonNode node) {
        return new KeyBounds<>(
                keyFromJson(JsonFields.object(node, "minKey")),
                keyFromJson(JsonFields.object(node, "maxKey")));
    }
}
