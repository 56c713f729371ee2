// file: storage/src/main/java/io/tilelite/storage/TileStore.java
package io.tilelite.storage;

import io.tilelite.core.index.IndexRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstraction over the physical record store that holds layer data.
 * <p>
 * Responsibilities:
 *  - write(): upsert a batch of records into a partition; a record replaces any
 *    earlier record with the same index. A batch is durable when write() returns.
 *  - scan(): return the records of a partition whose index lies in a range,
 *    ordered by index. An unknown partition scans as empty.
 *  - drop(): remove a partition and all its records.
 * <p>
 * Implementations are safe for concurrent scans; failures surface as unchecked exceptions.
 */
public interface TileStore extends AutoCloseable {

    List<StoredRecord> scan(PartitionSelector selector, IndexRange range);

    /** Scan several ranges in order and concatenate the results. */
    default List<StoredRecord> scan(PartitionSelector selector, List<IndexRange> ranges) {
        List<StoredRecord> out = new ArrayList<>();
        for (IndexRange r : ranges) {
            out.addAll(scan(selector, r));
        }
        return out;
    }

    void write(PartitionSelector selector, List<StoredRecord> records);

    void drop(PartitionSelector selector);

    @Override
    void close();
}
