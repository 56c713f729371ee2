// file: storage/src/main/java/io/tilelite/storage/codec/SpaceTimeKeyFormat.java
package io.tilelite.storage.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tilelite.core.index.KeyIndex;
import io.tilelite.core.index.ZSpaceTimeKeyIndex;
import io.tilelite.core.key.SpaceTimeKey;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Formats for {@link SpaceTimeKey}.
 * <p>
 * Binary key: col int32, row int32, instant int64 (little-endian).
 * Index JSON: {"type": "zorder", "keyBounds": {...}, "temporalResolutionMillis": n}.
 */
public final class SpaceTimeKeyFormat implements KeyFormat<SpaceTimeKey> {

    public static final String NAME = "spacetime";
    public static final SpaceTimeKeyFormat INSTANCE = new SpaceTimeKeyFormat();

    private SpaceTimeKeyFormat() {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] encodeKey(SpaceTimeKey key) {
        return ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(key.col()).putInt(key.row()).putLong(key.instant()).array();
    }

    @Override
    public SpaceTimeKey decodeKey(byte[] bytes) {
        if (bytes.length != 16) throw new RecordDecodeException("space-time key must be 16 bytes, got " + bytes.length);
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        return new SpaceTimeKey(b.getInt(), b.getInt(), b.getLong());
    }

    @Override
    public ObjectNode keyToJson(SpaceTimeKey key) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("col", key.col());
        n.put("row", key.row());
        n.put("instant", key.instant());
        return n;
    }

    @Override
    public SpaceTimeKey keyFromJson(JsonNode node) {
        return new SpaceTimeKey(
                JsonFields.integer(node, "col"),
                JsonFields.integer(node, "row"),
                JsonFields.longValue(node, "instant"));
    }

    @Override
    public ObjectNode indexToJson(KeyIndex<SpaceTimeKey> index) {
        if (!(index instanceof ZSpaceTimeKeyIndex z)) {
            throw new IllegalArgumentException("no persisted form for index " + index);
        }
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("type", z.type());
        n.set("keyBounds", boundsToJson(z.keyBounds()));
        n.put("temporalResolutionMillis", z.temporalResolutionMillis());
        return n;
    }

    @Override
    public KeyIndex<SpaceTimeKey> indexFromJson(JsonNode node) {
        String type = JsonFields.text(node, "type");
        if (!ZSpaceTimeKeyIndex.TYPE.equals(type)) {
            throw new IllegalArgumentException("unknown space-time index type '" + type + "'");
        }
        return new ZSpaceTimeKeyIndex(
                boundsFromJson(JsonFields.object(node, "keyBounds")),
                JsonFields.longValue(node, "temporalResolutionMillis"));
    }
}
