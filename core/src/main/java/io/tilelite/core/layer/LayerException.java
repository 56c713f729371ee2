// file: core/src/main/java/io/tilelite/core/layer/LayerException.java
package io.tilelite.core.layer;

/**
 * Base of all layer-level failures. Always names the layer and keeps the original cause.
 */
public class LayerException extends RuntimeException {

    private final LayerId layerId;

    public LayerException(LayerId layerId, String message) {
        super(message);
        this.layerId = layerId;
    }

    public LayerException(LayerId layerId, String message, Throwable cause) {
        super(message, cause);
        this.layerId = layerId;
    }

    public LayerId layerId() {
        return layerId;
    }
}
