package io.tilelite.storage;

import io.tilelite.core.index.IndexRange;
import io.tilelite.core.layer.LayerId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileTileStoreTest {

    @TempDir Path root;

    private static final PartitionSelector P = PartitionSelector.forLayer("tiles", new LayerId("dem", 3), 1);

    private static StoredRecord rec(long index, String v) {
        return new StoredRecord(index, v.getBytes());
    }

    private static List<Long> indices(List<StoredRecord> records) {
        return records.stream().map(StoredRecord::index).toList();
    }

    @Test
    void scan_returns_records_in_range_ordered_by_index() {
        try (var store = new FileTileStore(root)) {
            store.write(P, List.of(rec(9, "i"), rec(2, "b"), rec(5, "e")));
            store.write(P, List.of(rec(7, "g")));
            assertEquals(List.of(5L, 7L, 9L), indices(store.scan(P, new IndexRange(3, 100))));
            assertEquals(List.of(2L, 5L, 7L, 9L, 2L),
                    indices(store.scan(P, List.of(new IndexRange(0, 100), new IndexRange(2, 2)))));
            assertEquals(List.of(), store.scan(P, new IndexRange(10, 20)));
        }
    }

    @Test
    void later_write_of_an_index_replaces_the_earlier_one() {
        try (var store = new FileTileStore(root)) {
            store.write(P, List.of(rec(1, "old")));
            store.write(P, List.of(rec(1, "new")));
            var out = store.scan(P, IndexRange.point(1));
            assertEquals(1, out.size());
            assertArrayEquals("new".getBytes(), out.get(0).value());
        }
    }

    @Test
    void records_survive_restart() {
        try (var store = new FileTileStore(root)) {
            store.write(P, List.of(rec(1, "a"), rec(2, "b")));
            store.write(P, List.of(rec(1, "c")));
        }
        try (var store = new FileTileStore(root)) {
            var out = store.scan(P, new IndexRange(0, 10));
            assertEquals(List.of(rec(1, "c"), rec(2, "b")), out);
        }
    }

    @Test
    void replay_ignores_torn_tail_and_keeps_later_appends_readable() throws Exception {
        try (var store = new FileTileStore(root)) {
            store.write(P, List.of(rec(1, "a"), rec(2, "b")));
            Path seg = store.partitionDir(P).resolve(FileTileStore.SEGMENT_NAME);
            byte[] frame = SegmentCodec.encode(rec(3, "torn"));
            store.close();
            try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
                out.write(frame, 0, frame.length - 3);
            }
        }
        try (var store = new FileTileStore(root)) {
            assertEquals(List.of(1L, 2L), indices(store.scan(P, new IndexRange(0, 10))));
            store.write(P, List.of(rec(4, "d")));
        }
        try (var store = new FileTileStore(root)) {
            assertEquals(List.of(1L, 2L, 4L), indices(store.scan(P, new IndexRange(0, 10))));
        }
    }

    @Test
    void drop_removes_the_partition_only() {
        var other = PartitionSelector.forLayer("tiles", new LayerId("dem", 3), 2);
        try (var store = new FileTileStore(root)) {
            store.write(P, List.of(rec(1, "a")));
            store.write(other, List.of(rec(1, "b")));
            store.drop(P);
            assertEquals(List.of(), store.scan(P, new IndexRange(0, 10)));
            assertFalse(Files.exists(store.partitionDir(P)));
            assertEquals(1, store.scan(other, new IndexRange(0, 10)).size());
            // dropping twice is harmless
            store.drop(P);
        }
    }

    @Test
    void unknown_partition_scans_empty_without_creating_files() throws Exception {
        try (var store = new FileTileStore(root)) {
            var p = new PartitionSelector("tiles", "nothing/0@1");
            assertEquals(List.of(), store.scan(p, new IndexRange(0, Long.MAX_VALUE)));
            assertFalse(Files.exists(store.partitionDir(p)));
        }
    }

    @Test
    void batches_larger_than_the_write_buffer_are_written_in_pieces() throws Exception {
        String big = "x".repeat(200);
        var batch = List.of(rec(1, "a"), rec(2, big), rec(3, "c"), rec(4, "d"), rec(5, "e"), rec(6, big + "!"));
        long frameBytes = batch.stream().mapToLong(r -> SegmentCodec.encode(r).length).sum();

        Path segment;
        try (var store = new FileTileStore(root, 64)) {
            segment = store.partitionDir(P).resolve(FileTileStore.SEGMENT_NAME);
            store.write(P, batch);
            store.write(P, List.of(rec(7, "g")));
            assertEquals(List.of(2L, 3L, 4L, 5L, 6L), indices(store.scan(P, new IndexRange(2, 6))));
        }
        assertEquals(frameBytes + SegmentCodec.encode(rec(7, "g")).length, Files.size(segment));

        try (var store = new FileTileStore(root)) {
            var out = store.scan(P, new IndexRange(0, 10));
            assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L), indices(out));
            assertArrayEquals(big.getBytes(), out.get(1).value());
            assertArrayEquals((big + "!").getBytes(), out.get(5).value());
            assertArrayEquals("e".getBytes(), out.get(4).value());
        }
    }
}
