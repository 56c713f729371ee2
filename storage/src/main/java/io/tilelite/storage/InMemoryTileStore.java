// file: storage/src/main/java/io/tilelite/storage/InMemoryTileStore.java
package io.tilelite.storage;

import io.tilelite.core.index.IndexRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed tile store. One concurrent skip-list per partition.
 * Used by tests and for embedding without a data directory.
 */
public final class InMemoryTileStore implements TileStore {

    private final Map<PartitionSelector, NavigableMap<Long, StoredRecord>> partitions = new ConcurrentHashMap<>();

    @Override
    public List<StoredRecord> scan(PartitionSelector selector, IndexRange range) {
        NavigableMap<Long, StoredRecord> p = partitions.get(selector);
        if (p == null) return List.of();
        return new ArrayList<>(p.subMap(range.start(), true, range.end(), true).values());
    }

    @Override
    public void write(PartitionSelector selector, List<StoredRecord> records) {
        NavigableMap<Long, StoredRecord> p =
                partitions.computeIfAbsent(selector, s -> new ConcurrentSkipListMap<>());
        for (StoredRecord r : records) {
            p.put(r.index(), r);
        }
    }

    @Override
    public void drop(PartitionSelector selector) {
        partitions.remove(selector);
    }

    /** Partitions currently holding data. */
    public Set<PartitionSelector> partitions() {
        return Set.copyOf(partitions.keySet());
    }

    @Override
    public void close() {
        partitions.clear();
    }
}
