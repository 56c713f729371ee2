// file: core/src/main/java/io/tilelite/core/layer/MetadataWriteException.java
package io.tilelite.core.layer;

/**
 * Layer data was written but its metadata was not. The data is unreachable
 * garbage, not corruption: the catalog still describes the previous state.
 */
public class MetadataWriteException extends LayerException {

    private final String orphanedPartition;

    public MetadataWriteException(LayerId layerId, String orphanedPartition, Throwable cause) {
        super(layerId, "data of " + layerId + " written to partition " + orphanedPartition
                + " but its metadata could not be written", cause);
        this.orphanedPartition = orphanedPartition;
    }

    public String orphanedPartition() {
        return orphanedPartition;
    }
}
