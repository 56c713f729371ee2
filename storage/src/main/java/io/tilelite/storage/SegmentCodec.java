// file: storage/src/main/java/io/tilelite/storage/SegmentCodec.java
package io.tilelite.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for tile segment files.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x711E
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - index:  int64
 *     - value:  remaining bytes
 * <p>
 * Readers validate magic, version, length and CRC and treat the first
 * mismatch as the end of the segment.
 */
final class SegmentCodec {
    static final short MAGIC = (short) 0x711E;
    static final byte VERSION = 1;
    static final int HEADER_SIZE = 2 + 1 + 4 + 4;

    private SegmentCodec() {
    }

    /** Header of a frame, as read from disk. */
    record FrameHeader(int length, int crc) {}

    static byte[] encode(StoredRecord record) {
        byte[] value = record.value();
        ByteBuffer payload = ByteBuffer.allocate(8 + value.length).order(ByteOrder.LITTLE_ENDIAN);
        payload.putLong(record.index()).put(value);
        byte[] p = payload.array();

        ByteBuffer out = ByteBuffer.allocate(HEADER_SIZE + p.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(p.length).putInt(crc32(p)).put(p);
        return out.array();
    }

    /** Parse a header; null when it is not a valid frame start. */
    static FrameHeader readHeader(ByteBuffer hdr) {
        hdr.order(ByteOrder.LITTLE_ENDIAN);
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != MAGIC || ver != VERSION || len < 8) return null;
        return new FrameHeader(len, crc);
    }

    static StoredRecord decodePayload(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long index = b.getLong();
        byte[] value = new byte[b.remaining()];
        b.get(value);
        return new StoredRecord(index, value);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
