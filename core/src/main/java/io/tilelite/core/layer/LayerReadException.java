// file: core/src/main/java/io/tilelite/core/layer/LayerReadException.java
package io.tilelite.core.layer;

/** Reading a layer failed; the cause says why. */
public class LayerReadException extends LayerException {

    public LayerReadException(LayerId layerId, Throwable cause) {
        super(layerId, "failed to read " + layerId, cause);
    }
}
