// file: storage/src/main/java/io/tilelite/storage/PartitionSelector.java
package io.tilelite.storage;

import io.tilelite.core.layer.LayerHeader;
import io.tilelite.core.layer.LayerId;

import java.util.Objects;

/**
 * Selects the records of one layer generation inside a backing-store table.
 * <p>
 * Computed once per read from the layer header and handed to every scan.
 */
public record PartitionSelector(String table, String partition) {

    public PartitionSelector {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(partition, "partition");
        if (table.isBlank()) throw new IllegalArgumentException("table must not be blank");
        if (partition.isBlank()) throw new IllegalArgumentException("partition must not be blank");
    }

    /** Partition of a given layer generation: {@code <name>/<zoom>@<generation>}. */
    public static PartitionSelector forLayer(String table, LayerId id, long generation) {
        return new PartitionSelector(table, id.name() + "/" + id.zoom() + "@" + generation);
    }

    public static PartitionSelector of(LayerHeader header) {
        return new PartitionSelector(header.table(), header.partition());
    }
}
