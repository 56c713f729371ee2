package io.tilelite.core.layer;

import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpatialKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DatasetSpec {

    @Test
    void duplicate_keys_are_rejected() {
        var k = new SpatialKey(1, 1);
        assertThrows(IllegalArgumentException.class,
                () -> Dataset.of(List.of(new Dataset.Entry<>(k, "a"), new Dataset.Entry<>(k, "b"))));
    }

    @Test
    void key_bounds_enclose_every_key() {
        var ds = Dataset.of(Map.of(new SpatialKey(4, 2), "a", new SpatialKey(1, 6), "b"));
        assertEquals(Optional.of(new KeyBounds<>(new SpatialKey(1, 2), new SpatialKey(4, 6))), ds.keyBounds());
        assertEquals(2, ds.size());
        assertEquals("b", ds.asMap().get(new SpatialKey(1, 6)));
        assertTrue(Dataset.<SpatialKey, String>empty().keyBounds().isEmpty());
    }

    @Test
    void layer_ids_and_headers_validate_their_fields() {
        assertThrows(IllegalArgumentException.class, () -> new LayerId(" ", 1));
        assertThrows(IllegalArgumentException.class, () -> new LayerId("dem", -1));
        assertThrows(IllegalArgumentException.class, () -> new LayerHeader("spatial", "tile", "tiles", "p", 0));
        assertThrows(IllegalArgumentException.class, () -> new RecordSchema("tile", 0));
    }

    @Test
    void layer_errors_carry_the_layer_and_cause() {
        var id = new LayerId("dem", 3);
        var cause = new IllegalStateException("disk");
        var read = new LayerReadException(id, cause);
        assertSame(id, read.layerId());
        assertSame(cause, read.getCause());

        var corrupt = new AttributeCorruptException(id, "keyIndex", "unknown index type");
        assertEquals("keyIndex", corrupt.attribute());
        assertTrue(corrupt.getMessage().contains("keyIndex"));

        var meta = new MetadataWriteException(id, "dem/3@2", cause);
        assertEquals("dem/3@2", meta.orphanedPartition());
        assertInstanceOf(LayerException.class, new LayerNotFoundException(id));
    }
}
