// file: storage/src/main/java/io/tilelite/storage/codec/EntryCodec.java
package io.tilelite.storage.codec;

import io.tilelite.core.key.GridKey;
import io.tilelite.core.layer.Dataset;
import io.tilelite.core.layer.RecordSchema;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Packs every (key, value) entry that maps to one index into a single stored value.
 * <p>
 * Layout (little-endian):
 *   - count: int32
 *   repeated count times:
 *     - key:   int32 len + key bytes   ({@link KeyFormat#encodeKey})
 *     - value: int32 len + value bytes ({@link ValueCodec#encode})
 * <p>
 * Several entries per index occur when a key index maps distinct keys onto the
 * same position, e.g. instants inside one time bin.
 */
public final class EntryCodec<K extends GridKey<K>, V> {

    private final KeyFormat<K> keyFormat;
    private final ValueCodec<V> valueCodec;

    public EntryCodec(KeyFormat<K> keyFormat, ValueCodec<V> valueCodec) {
        this.keyFormat = Objects.requireNonNull(keyFormat, "keyFormat");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
    }

    public byte[] encode(List<Dataset.Entry<K, V>> entries) {
        List<byte[]> parts = new ArrayList<>(entries.size() * 2);
        int size = 4;
        for (Dataset.Entry<K, V> e : entries) {
            byte[] k = keyFormat.encodeKey(e.key());
            byte[] v = valueCodec.encode(e.value());
            parts.add(k);
            parts.add(v);
            size = grow(size, k.length, v.length);
        }
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putInt(entries.size());
        for (byte[] p : parts) {
            b.putInt(p.length).put(p);
        }
        return b.array();
    }

    /** Size after appending one entry with both length prefixes. */
    static int grow(int size, int keyLength, int valueLength) {
        try {
            return Math.addExact(size, Math.addExact(8, Math.addExact(keyLength, valueLength)));
        } catch (ArithmeticException overflow) {
            throw new IllegalArgumentException("entries sharing one index exceed 2 GiB encoded", overflow);
        }
    }

    /**
     * @throws RecordDecodeException on truncated or malformed input
     */
    public List<Dataset.Entry<K, V>> decode(byte[] bytes, RecordSchema writerSchema) {
        try {
            ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
            int count = b.getInt();
            // each entry needs at least two length prefixes
            if (count < 0 || count > b.remaining() / 8) {
                throw new RecordDecodeException("bad entry count " + count);
            }
            List<Dataset.Entry<K, V>> out = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                K key = keyFormat.decodeKey(readBytes(b));
                V value = valueCodec.decode(readBytes(b), writerSchema);
                out.add(new Dataset.Entry<>(key, value));
            }
            if (b.hasRemaining()) {
                throw new RecordDecodeException(b.remaining() + " trailing bytes after " + count + " entries");
            }
            return out;
        } catch (BufferUnderflowException e) {
            throw new RecordDecodeException("truncated entry record", e);
        }
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new RecordDecodeException("bad length " + len + " with " + b.remaining() + " bytes left");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
