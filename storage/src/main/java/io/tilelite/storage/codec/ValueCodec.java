// file: storage/src/main/java/io/tilelite/storage/codec/ValueCodec.java
package io.tilelite.storage.codec;

import io.tilelite.core.layer.RecordSchema;

/**
 * Binary encoding of layer values.
 * <p>
 * The codec's {@link #schema()} is persisted with every layer it writes. A reader
 * decodes with the schema the data was written with, and can read any earlier
 * version of its own schema.
 */
public interface ValueCodec<V> {

    RecordSchema schema();

    byte[] encode(V value);

    /**
     * @throws RecordDecodeException when the bytes do not match the writer schema
     */
    V decode(byte[] bytes, RecordSchema writerSchema);

    default boolean canRead(RecordSchema writerSchema) {
        return schema().name().equals(writerSchema.name())
                && writerSchema.version() <= schema().version();
    }
}
