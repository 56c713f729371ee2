// file: storage/src/main/java/io/tilelite/storage/catalog/LayerAttributes.java
package io.tilelite.storage.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tilelite.core.layer.LayerHeader;
import io.tilelite.core.layer.RecordSchema;
import io.tilelite.storage.codec.JsonFields;

/**
 * Names of the persisted layer attributes and the JSON form of the
 * key-type independent ones.
 */
public final class LayerAttributes {

    public static final String HEADER = "header";
    public static final String KEY_BOUNDS = "keyBounds";
    public static final String KEY_INDEX = "keyIndex";
    public static final String SCHEMA = "schema";

    private LayerAttributes() {
    }

    public static ObjectNode headerToJson(LayerHeader h) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("keyType", h.keyType());
        n.put("valueType", h.valueType());
        n.put("table", h.table());
        n.put("partition", h.partition());
        n.put("generation", h.generation());
        return n;
    }

    public static LayerHeader headerFromJson(JsonNode n) {
        return new LayerHeader(
                JsonFields.text(n, "keyType"),
                JsonFields.text(n, "valueType"),
                JsonFields.text(n, "table"),
                JsonFields.text(n, "partition"),
                JsonFields.longValue(n, "generation"));
    }

    public static ObjectNode schemaToJson(RecordSchema s) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("name", s.name());
        n.put("version", s.version());
        return n;
    }

    public static RecordSchema schemaFromJson(JsonNode n) {
        return new RecordSchema(JsonFields.text(n, "name"), JsonFields.integer(n, "version"));
    }
}
