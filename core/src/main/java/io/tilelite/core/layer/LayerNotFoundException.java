// file: core/src/main/java/io/tilelite/core/layer/LayerNotFoundException.java
package io.tilelite.core.layer;

/** No catalog entry exists for the layer. */
public class LayerNotFoundException extends LayerException {

    public LayerNotFoundException(LayerId layerId) {
        super(layerId, layerId + " not found");
    }
}
