package io.tilelite.storage.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tilelite.core.index.KeyIndexMethods;
import io.tilelite.core.index.ZSpaceTimeKeyIndex;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpaceTimeKey;
import io.tilelite.core.key.SpatialKey;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyFormatSpec {

    private static final KeyBounds<SpatialKey> BOUNDS =
            new KeyBounds<>(new SpatialKey(-4, 2), new SpatialKey(30, 17));

    @Test
    void persisted_spatial_indices_keep_their_strategy() {
        var fmt = SpatialKeyFormat.INSTANCE;
        for (var method : List.of(KeyIndexMethods.rowMajor(), KeyIndexMethods.zCurve(), KeyIndexMethods.hilbert())) {
            var idx = method.createIndex(BOUNDS);
            var restored = fmt.indexFromJson(fmt.indexToJson(idx));
            assertEquals(idx, restored);
            assertEquals(idx.toIndex(new SpatialKey(7, 9)), restored.toIndex(new SpatialKey(7, 9)));
        }
    }

    @Test
    void persisted_space_time_index_keeps_its_resolution() throws Exception {
        var fmt = SpaceTimeKeyFormat.INSTANCE;
        var bounds = new KeyBounds<>(new SpaceTimeKey(0, 0, 0), new SpaceTimeKey(9, 9, 86_400_000L * 30));
        var idx = KeyIndexMethods.zCurve(Duration.ofDays(1)).createIndex(bounds);
        var json = new ObjectMapper().writeValueAsString(fmt.indexToJson(idx));
        var restored = (ZSpaceTimeKeyIndex) fmt.indexFromJson(new ObjectMapper().readTree(json));
        assertEquals(idx, restored);
        assertEquals(86_400_000L, restored.temporalResolutionMillis());
    }

    @Test
    void unknown_index_types_and_missing_fields_are_rejected() throws Exception {
        var mapper = new ObjectMapper();
        var fmt = SpatialKeyFormat.INSTANCE;
        var json = fmt.indexToJson(KeyIndexMethods.zCurve().createIndex(BOUNDS));
        json.put("type", "peano");
        assertThrows(IllegalArgumentException.class, () -> fmt.indexFromJson(json));

        assertThrows(IllegalArgumentException.class, () -> fmt.keyFromJson(mapper.readTree("{\"col\": 1}")));
        assertThrows(IllegalArgumentException.class, () -> fmt.keyFromJson(mapper.readTree("{\"col\": 1, \"row\": \"x\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> SpaceTimeKeyFormat.INSTANCE.indexFromJson(mapper.readTree("{\"type\": \"hilbert\"}")));
    }

    @Test
    void inverted_bounds_in_json_are_rejected() throws Exception {
        var node = new ObjectMapper().readTree(
                "{\"minKey\": {\"col\": 5, \"row\": 0}, \"maxKey\": {\"col\": 1, \"row\": 0}}");
        assertThrows(IllegalArgumentException.class, () -> SpatialKeyFormat.INSTANCE.boundsFromJson(node));
    }

    @Test
    void binary_keys_have_fixed_width() {
        var k = new SpaceTimeKey(-3, 8, 1_600_000_000_000L);
        assertEquals(k, SpaceTimeKeyFormat.INSTANCE.decodeKey(SpaceTimeKeyFormat.INSTANCE.encodeKey(k)));
        assertThrows(RecordDecodeException.class, () -> SpatialKeyFormat.INSTANCE.decodeKey(new byte[7]));
    }
}
