// file: core/src/main/java/io/tilelite/core/layer/LayerWriteException.java
package io.tilelite.core.layer;

/**
 * Writing a layer failed before its metadata was written: the layer keeps its
 * previous catalog entry, or stays absent if it never existed.
 */
public class LayerWriteException extends LayerException {

    public LayerWriteException(LayerId layerId, String message) {
        super(layerId, message);
    }

    public LayerWriteException(LayerId layerId, Throwable cause) {
        super(layerId, "failed to write " + layerId, cause);
    }
}
