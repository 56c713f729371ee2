// file: core/src/main/java/io/tilelite/core/layer/RecordSchema.java
package io.tilelite.core.layer;

import java.util.Objects;

/**
 * Descriptor of the record encoding a layer was written with.
 * Persisted once per layer; readers check they understand it before scanning.
 */
public record RecordSchema(String name, int version) {

    public RecordSchema {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("schema name must not be blank");
        if (version < 1) throw new IllegalArgumentException("schema version must be >= 1");
    }

    @Override
    public String toString() {
        return name + "/v" + version;
    }
}
