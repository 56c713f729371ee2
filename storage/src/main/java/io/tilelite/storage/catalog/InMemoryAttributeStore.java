// file: storage/src/main/java/io/tilelite/storage/catalog/InMemoryAttributeStore.java
package io.tilelite.storage.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.tilelite.core.layer.LayerId;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed attribute store. Values are deep-copied in and out.
 */
public final class InMemoryAttributeStore implements AttributeStore {

    private final Map<LayerId, Map<String, JsonNode>> layers = new ConcurrentHashMap<>();

    @Override
    public JsonNode read(LayerId id, String attribute) {
        Map<String, JsonNode> attrs = layers.get(id);
        if (attrs == null) return null;
        JsonNode v = attrs.get(attribute);
        return v == null ? null : v.deepCopy();
    }

    @Override
    public void write(LayerId id, String attribute, JsonNode value) {
        layers.compute(id, (k, old) -> {
            Map<String, JsonNode> next = old == null ? new HashMap<>() : new HashMap<>(old);
            next.put(attribute, value.deepCopy());
            return Map.copyOf(next);
        });
    }

    @Override
    public void writeAll(LayerId id, Map<String, JsonNode> attributes) {
        Map<String, JsonNode> copy = new HashMap<>();
        attributes.forEach((name, value) -> copy.put(name, value.deepCopy()));
        layers.put(id, Map.copyOf(copy));
    }

    @Override
    public boolean layerExists(LayerId id) {
        return layers.containsKey(id);
    }

    @Override
    public List<LayerId> layerIds() {
        return layers.keySet().stream()
                .sorted(Comparator.comparing(LayerId::name).thenComparingInt(LayerId::zoom))
                .toList();
    }
}
