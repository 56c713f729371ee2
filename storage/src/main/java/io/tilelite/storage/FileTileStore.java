// file: storage/src/main/java/io/tilelite/storage/FileTileStore.java
package io.tilelite.storage;

import io.tilelite.core.index.IndexRange;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed tile store: one append-only segment per partition.
 * <p>
 * Layout:
 *   root/&lt;table&gt;/&lt;partition&gt;/00000001.seg   (names URL-encoded, dots escaped)
 * <p>
 * Properties:
 *  - write():
 *      - frames every record with {@link SegmentCodec},
 *      - stages frames in a bounded buffer and writes it out whenever it fills,
 *      - calls force(true) once per batch, before the records become visible to scans.
 *    Appends are serialised per store.
 * <p>
 *  - Offset index:
 *      - built the first time a partition is touched, by replaying its segment,
 *      - replay stops at the first truncated header/payload or bad CRC and cuts
 *        the file back to the last good record, so later appends stay readable,
 *      - a later record for the same index shadows the earlier one.
 * <p>
 *  - scan() uses positional reads and runs concurrently with appends.
 * <p>
 * A scan racing with drop() of the same partition may fail; drop is only
 * used on partitions the catalog no longer points at.
 */
public final class FileTileStore implements TileStore {
    private static final Logger log = Logger.getLogger(FileTileStore.class.getName());

    static final String SEGMENT_NAME = "00000001.seg";
    /** Frames are staged in a buffer of this size; larger frames are written directly. */
    static final int WRITE_BUFFER_BYTES = 1 << 20;

    private final Path root;
    private final Map<PartitionSelector, Segment> segments = new ConcurrentHashMap<>();
    private final Object appendLock = new Object();
    private final ByteBuffer writeBuffer; // guarded by appendLock

    public FileTileStore(Path root) {
        this(root, WRITE_BUFFER_BYTES);
    }

    FileTileStore(Path root, int writeBufferBytes) {
        if (writeBufferBytes < 1) throw new IllegalArgumentException("writeBufferBytes must be >= 1");
        this.root = root;
        this.writeBuffer = ByteBuffer.allocate(writeBufferBytes);
        try { Files.createDirectories(root); } catch (IOException e) { throw new RuntimeException(e); }
    }

    @Override
    public List<StoredRecord> scan(PartitionSelector selector, IndexRange range) {
        Segment seg = segment(selector, false);
        if (seg == null) return List.of();
        try {
            return seg.scan(range);
        } catch (IOException e) {
            throw new RuntimeException("scan of " + selector + " " + range + " failed", e);
        }
    }

    @Override
    public void write(PartitionSelector selector, List<StoredRecord> records) {
        if (records.isEmpty()) return;
        synchronized (appendLock) {
            try {
                segment(selector, true).append(records, writeBuffer);
            } catch (IOException e) {
                throw new RuntimeException("append to " + selector + " failed", e);
            }
        }
    }

    @Override
    public void drop(PartitionSelector selector) {
        synchronized (appendLock) {
            Segment seg = segments.remove(selector);
            try {
                if (seg != null) seg.close();
                Path dir = partitionDir(selector);
                if (!Files.exists(dir)) return;
                try (Stream<Path> files = Files.walk(dir)) {
                    for (Path p : files.sorted(Comparator.reverseOrder()).toList()) {
                        Files.delete(p);
                    }
                }
            } catch (IOException e) {
                throw new RuntimeException("drop of " + selector + " failed", e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (appendLock) {
            for (Segment seg : segments.values()) {
                try {
                    seg.close();
                } catch (IOException e) {
                    log.warning("failed to close segment " + seg.file + ": " + e.getMessage());
                }
            }
            segments.clear();
        }
    }

    Path partitionDir(PartitionSelector selector) {
        return root.resolve(encode(selector.table())).resolve(encode(selector.partition()));
    }

    private static String encode(String name) {
        return URLEncoder.encode(name, StandardCharsets.UTF_8).replace(".", "%2E");
    }

    /**
     * Open (and replay) the segment of a partition. Returns null for a partition
     * that has no segment yet unless {@code create} is set.
     */
    private Segment segment(PartitionSelector selector, boolean create) {
        Segment seg = segments.get(selector);
        if (seg != null) return seg;
        synchronized (appendLock) {
            seg = segments.get(selector);
            if (seg != null) return seg;
            Path file = partitionDir(selector).resolve(SEGMENT_NAME);
            try {
                if (!Files.exists(file)) {
                    if (!create) return null;
                    Files.createDirectories(file.getParent());
                }
                seg = Segment.open(file);
            } catch (IOException e) {
                throw new RuntimeException("cannot open segment " + file, e);
            }
            segments.put(selector, seg);
            return seg;
        }
    }

    private static final class Segment {
        private final Path file;
        private final FileChannel ch;
        private final ConcurrentSkipListMap<Long, Long> offsets = new ConcurrentSkipListMap<>();
        private long end;

        private Segment(Path file, FileChannel ch) {
            this.file = file;
            this.ch = ch;
        }

        static Segment open(Path file) throws IOException {
            Segment seg = new Segment(file, FileChannel.open(file, CREATE, READ, WRITE));
            seg.replay();
            return seg;
        }

        private void replay() throws IOException {
            long size = ch.size();
            long pos = 0;
            while (pos + SegmentCodec.HEADER_SIZE <= size) {
                ByteBuffer hdr = ByteBuffer.allocate(SegmentCodec.HEADER_SIZE);
                if (readFully(hdr, pos) < SegmentCodec.HEADER_SIZE) break;
                hdr.flip();
                SegmentCodec.FrameHeader h = SegmentCodec.readHeader(hdr);
                if (h == null) break;
                long next = pos + SegmentCodec.HEADER_SIZE + h.length();
                if (next > size) break; // truncated payload
                ByteBuffer payload = ByteBuffer.allocate(h.length());
                readFully(payload, pos + SegmentCodec.HEADER_SIZE);
                if (SegmentCodec.crc32(payload.array()) != h.crc()) break;
                long index = ByteBuffer.wrap(payload.array()).order(ByteOrder.LITTLE_ENDIAN).getLong();
                offsets.put(index, pos);
                pos = next;
            }
            if (pos < size) {
                log.warning("segment " + file + ": dropping " + (size - pos) + " bytes of torn tail at offset " + pos);
                ch.truncate(pos);
                ch.force(true);
            }
            end = pos;
        }

        void append(List<StoredRecord> records, ByteBuffer buf) throws IOException {
            long[] starts = new long[records.size()];
            long pos = end;
            buf.clear();
            for (int i = 0; i < records.size(); i++) {
                byte[] frame = SegmentCodec.encode(records.get(i));
                if (frame.length > buf.remaining()) {
                    pos = flush(buf, pos);
                }
                starts[i] = pos + buf.position();
                if (frame.length > buf.capacity()) {
                    pos = writeFully(ByteBuffer.wrap(frame), pos);
                } else {
                    buf.put(frame);
                }
            }
            pos = flush(buf, pos);
            ch.force(true);

            for (int i = 0; i < records.size(); i++) {
                offsets.put(records.get(i).index(), starts[i]);
            }
            end = pos;
        }

        private long flush(ByteBuffer buf, long position) throws IOException {
            buf.flip();
            long next = writeFully(buf, position);
            buf.clear();
            return next;
        }

        private long writeFully(ByteBuffer src, long position) throws IOException {
            long pos = position;
            while (src.hasRemaining()) {
                pos += ch.write(src, pos);
            }
            return pos;
        }

        List<StoredRecord> scan(IndexRange range) throws IOException {
            List<StoredRecord> out = new ArrayList<>();
            for (long offset : offsets.subMap(range.start(), true, range.end(), true).values()) {
                out.add(readAt(offset));
            }
            return out;
        }

        private StoredRecord readAt(long offset) throws IOException {
            ByteBuffer hdr = ByteBuffer.allocate(SegmentCodec.HEADER_SIZE);
            readFully(hdr, offset);
            hdr.flip();
            SegmentCodec.FrameHeader h = SegmentCodec.readHeader(hdr);
            if (h == null) throw new IOException("bad frame header at offset " + offset + " in " + file);
            ByteBuffer payload = ByteBuffer.allocate(h.length());
            if (readFully(payload, offset + SegmentCodec.HEADER_SIZE) < h.length()
                    || SegmentCodec.crc32(payload.array()) != h.crc()) {
                throw new IOException("corrupt frame at offset " + offset + " in " + file);
            }
            return SegmentCodec.decodePayload(payload.array());
        }

        private int readFully(ByteBuffer buf, long position) throws IOException {
            int total = 0;
            while (buf.hasRemaining()) {
                int n = ch.read(buf, position + total);
                if (n < 0) break;
                total += n;
            }
            return total;
        }

        void close() throws IOException {
            ch.close();
        }
    }
}
