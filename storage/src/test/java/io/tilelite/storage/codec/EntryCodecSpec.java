package io.tilelite.storage.codec;

import io.tilelite.core.key.SpaceTimeKey;
import io.tilelite.core.key.SpatialKey;
import io.tilelite.core.layer.Dataset;
import io.tilelite.core.layer.RecordSchema;
import io.tilelite.core.raster.Tile;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntryCodecSpec {

    private final TileCodec tiles = new TileCodec();

    @Test
    void entries_sharing_an_index_are_kept_together() {
        var codec = new EntryCodec<>(SpaceTimeKeyFormat.INSTANCE, tiles);
        var entries = List.of(
                new Dataset.Entry<>(new SpaceTimeKey(1, 2, 1_000), Tile.fill(2, 2, 1)),
                new Dataset.Entry<>(new SpaceTimeKey(1, 2, 5_000), Tile.fill(2, 2, 2)));
        assertEquals(entries, codec.decode(codec.encode(entries), TileCodec.SCHEMA));
    }

    @Test
    void truncated_or_padded_records_fail_to_decode() {
        var codec = new EntryCodec<>(SpatialKeyFormat.INSTANCE, tiles);
        byte[] bytes = codec.encode(List.of(new Dataset.Entry<>(new SpatialKey(0, 0), Tile.fill(1, 1, 5))));

        assertThrows(RecordDecodeException.class,
                () -> codec.decode(Arrays.copyOf(bytes, bytes.length - 1), TileCodec.SCHEMA));
        assertThrows(RecordDecodeException.class,
                () -> codec.decode(Arrays.copyOf(bytes, bytes.length + 2), TileCodec.SCHEMA));
        assertThrows(RecordDecodeException.class, () -> codec.decode(new byte[]{1}, TileCodec.SCHEMA));
        assertThrows(RecordDecodeException.class,
                () -> codec.decode(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0x7F}, TileCodec.SCHEMA));
    }

    @Test
    void tile_codec_reads_only_its_own_schema_family() {
        assertTrue(tiles.canRead(new RecordSchema("tile", 1)));
        assertFalse(tiles.canRead(new RecordSchema("tile", 2)));
        assertFalse(tiles.canRead(new RecordSchema("float-tile", 1)));
        byte[] bytes = tiles.encode(Tile.fill(3, 1, 0.5));
        assertThrows(RecordDecodeException.class, () -> tiles.decode(bytes, new RecordSchema("tile", 2)));
        assertThrows(RecordDecodeException.class, () -> tiles.decode(Arrays.copyOf(bytes, 12), TileCodec.SCHEMA));
        assertEquals(Tile.fill(3, 1, 0.5), tiles.decode(bytes, TileCodec.SCHEMA));
    }

    @Test
    void encoded_size_that_would_pass_2_gib_is_rejected() {
        assertEquals(4 + 8 + 10 + 20, EntryCodec.grow(4, 10, 20));
        int nearlyFull = Integer.MAX_VALUE - 100;
        assertEquals(Integer.MAX_VALUE, EntryCodec.grow(nearlyFull, 50, 42));
        var e = assertThrows(IllegalArgumentException.class, () -> EntryCodec.grow(nearlyFull, 50, 43));
        assertTrue(e.getMessage().contains("2 GiB"));
        assertThrows(IllegalArgumentException.class,
                () -> EntryCodec.grow(4, Integer.MAX_VALUE / 2 + 1, Integer.MAX_VALUE / 2 + 1));
    }
}
