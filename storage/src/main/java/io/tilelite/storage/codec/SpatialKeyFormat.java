// file: storage/src/main/java/io/tilelite/storage/codec/SpatialKeyFormat.java
package io.tilelite.storage.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tilelite.core.index.HilbertSpatialKeyIndex;
import io.tilelite.core.index.KeyIndex;
import io.tilelite.core.index.RowMajorSpatialKeyIndex;
import io.tilelite.core.index.ZSpatialKeyIndex;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpatialKey;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Formats for {@link SpatialKey}.
 * <p>
 * Binary key: col int32, row int32 (little-endian).
 * Index JSON: {"type": "rowmajor" | "zorder" | "hilbert", "keyBounds": {...}}.
 */
public final class SpatialKeyFormat implements KeyFormat<SpatialKey> {

    public static final String NAME = "spatial";
    public static final SpatialKeyFormat INSTANCE = new SpatialKeyFormat();

    private SpatialKeyFormat() {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] encodeKey(SpatialKey key) {
        return ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(key.col()).putInt(key.row()).array();
    }

    @Override
    public SpatialKey decodeKey(byte[] bytes) {
        if (bytes.length != 8) throw new RecordDecodeException("spatial key must be 8 bytes, got " + bytes.length);
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        return new SpatialKey(b.getInt(), b.getInt());
    }

    @Override
    public ObjectNode keyToJson(SpatialKey key) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("col", key.col());
        n.put("row", key.row());
        return n;
    }

    @Override
    public SpatialKey keyFromJson(JsonNode node) {
        return new SpatialKey(JsonFields.integer(node, "col"), JsonFields.integer(node, "row"));
    }

    @Override
    public ObjectNode indexToJson(KeyIndex<SpatialKey> index) {
        if (!(index instanceof RowMajorSpatialKeyIndex
                || index instanceof ZSpatialKeyIndex
                || index instanceof HilbertSpatialKeyIndex)) {
            throw new IllegalArgumentException("no persisted form for index " + index);
        }
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("type", index.type());
        n.set("keyBounds", boundsToJson(index.keyBounds()));
        return n;
    }

    @Override
    public KeyIndex<SpatialKey> indexFromJson(JsonNode node) {
        String type = JsonFields.text(node, "type");
        KeyBounds<SpatialKey> bounds = boundsFromJson(JsonFields.object(node, "keyBounds"));
        return switch (type) {
            case RowMajorSpatialKeyIndex.TYPE -> new RowMajorSpatialKeyIndex(bounds);
            case ZSpatialKeyIndex.TYPE -> new ZSpatialKeyIndex(bounds);
            case HilbertSpatialKeyIndex.TYPE -> new HilbertSpatialKeyIndex(bounds);
            default -> throw new IllegalArgumentException("unknown spatial index type '" + type + "'");
        };
    }
}
