// file: storage/src/main/java/io/tilelite/storage/catalog/AttributeStore.java
package io.tilelite.storage.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.tilelite.core.layer.LayerId;

import java.util.List;
import java.util.Map;

/**
 * Physical store for layer metadata: named JSON attributes per layer.
 * <p>
 * Responsibilities:
 *  - read():     the stored attribute, or null when the layer or attribute is absent.
 *  - write():    set one attribute, keeping the others.
 *  - writeAll(): replace every attribute of the layer in one step.
 *  - layerIds(): every layer holding at least one attribute.
 * <p>
 * Failures other than undecodable content surface as unchecked exceptions.
 */
public interface AttributeStore {

    JsonNode read(LayerId id, String attribute);

    void write(LayerId id, String attribute, JsonNode value);

    /** Replace all attributes of a layer. The default is not atomic; stores should override. */
    default void writeAll(LayerId id, Map<String, JsonNode> attributes) {
        attributes.forEach((name, value) -> write(id, name, value));
    }

    boolean layerExists(LayerId id);

    List<LayerId> layerIds();
}
