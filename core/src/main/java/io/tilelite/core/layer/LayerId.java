// file: core/src/main/java/io/tilelite/core/layer/LayerId.java
package io.tilelite.core.layer;

import java.util.Objects;

/**
 * Logical identity of a layer: a name plus a zoom level.
 * Stable; used as the catalog key. Names are free text except for "." and ".."
 * and control characters.
 */
public record LayerId(String name, int zoom) {

    public LayerId {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("layer name must not be blank");
        if (name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("layer name must not be '" + name + "'");
        }
        if (name.chars().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException("layer name must not contain control characters");
        }
        if (zoom < 0) throw new IllegalArgumentException("zoom must be >= 0, got " + zoom);
    }

    @Override
    public String toString() {
        return "Layer(name=" + name + ", zoom=" + zoom + ")";
    }
}
