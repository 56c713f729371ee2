// file: core/src/main/java/io/tilelite/core/layer/AttributeCorruptException.java
package io.tilelite.core.layer;

/**
 * A stored metadata attribute is missing or cannot be decoded against the
 * expected format. Indicates a format mismatch or upstream corruption; not retried.
 */
public class AttributeCorruptException extends LayerException {

    private final String attribute;

    public AttributeCorruptException(LayerId layerId, String attribute, String detail) {
        super(layerId, message(layerId, attribute, detail));
        this.attribute = attribute;
    }

    public AttributeCorruptException(LayerId layerId, String attribute, Throwable cause) {
        super(layerId, message(layerId, attribute, String.valueOf(cause.getMessage())), cause);
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }

    private static String message(LayerId layerId, String attribute, String detail) {
        return "attribute '" + attribute + "' of " + layerId + " is corrupt: " + detail;
    }
}
