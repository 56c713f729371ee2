// file: storage/src/main/java/io/tilelite/storage/codec/JsonFields.java
package io.tilelite.storage.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Strict field accessors for persisted JSON documents.
 * Every accessor fails with {@link IllegalArgumentException} naming the field.
 */
public final class JsonFields {

    private JsonFields() {
    }

    public static JsonNode object(JsonNode node, String field) {
        JsonNode v = field(node, field);
        if (!v.isObject()) throw new IllegalArgumentException("field '" + field + "' must be an object");
        return v;
    }

    public static String text(JsonNode node, String field) {
        JsonNode v = field(node, field);
        if (!v.isTextual()) throw new IllegalArgumentException("field '" + field + "' must be a string");
        return v.asText();
    }

    public static int integer(JsonNode node, String field) {
        JsonNode v = field(node, field);
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw new IllegalArgumentException("field '" + field + "' must be a 32-bit integer");
        }
        return v.intValue();
    }

    public static long longValue(JsonNode node, String field) {
        JsonNode v = field(node, field);
        if (!v.isIntegralNumber() || !v.canConvertToLong()) {
            throw new IllegalArgumentException("field '" + field + "' must be a 64-bit integer");
        }
        return v.longValue();
    }

    private static JsonNode field(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("expected a JSON object holding '" + field + "'");
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) throw new IllegalArgumentException("missing field '" + field + "'");
        return v;
    }
}
