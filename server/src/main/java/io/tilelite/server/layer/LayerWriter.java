// file: server/src/main/java/io/tilelite/server/layer/LayerWriter.java
package io.tilelite.server.layer;

import com.google.common.util.concurrent.Striped;
import io.tilelite.core.index.KeyIndex;
import io.tilelite.core.index.KeyIndexMethod;
import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.layer.Dataset;
import io.tilelite.core.layer.LayerHeader;
import io.tilelite.core.layer.LayerId;
import io.tilelite.core.layer.LayerMetadata;
import io.tilelite.core.layer.LayerWriteException;
import io.tilelite.core.layer.MetadataWriteException;
import io.tilelite.storage.PartitionSelector;
import io.tilelite.storage.StoredRecord;
import io.tilelite.storage.TileStore;
import io.tilelite.storage.catalog.LayerCatalog;
import io.tilelite.storage.codec.EntryCodec;
import io.tilelite.storage.codec.KeyFormat;
import io.tilelite.storage.codec.ValueCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists a {@link Dataset} as a layer: data first, metadata last.
 * <p>
 * Steps of a write:
 *  1) Reject empty datasets.
 *  2) Compute the data's key bounds and build (or check) the key index.
 *  3) Pick the next generation: previous header's generation + 1, or 1.
 *     Data lands in partition "&lt;name&gt;/&lt;zoom&gt;@&lt;generation&gt;", which is cleared first.
 *  4) Group entries by index position and write them as one batch.
 *  5) Write the metadata. Until this succeeds the catalog still points at the
 *     previous generation, so readers never see half-written data.
 *  6) Drop the generation before the previous one (best effort). The previous
 *     generation is retained so a read that loaded the old metadata can finish.
 * <p>
 * Failures:
 *  - before 5): {@link LayerWriteException}, the new partition is dropped best effort,
 *  - in 5):     {@link MetadataWriteException}, the new partition stays as an orphan.
 * <p>
 * Writes to the same layer are serialised; writes to different layers run in parallel.
 */
public final class LayerWriter<K extends GridKey<K>, V> {
    private static final Logger log = Logger.getLogger(LayerWriter.class.getName());

    private final LayerCatalog catalog;
    private final TileStore store;
    private final KeyFormat<K> keyFormat;
    private final ValueCodec<V> valueCodec;
    private final EntryCodec<K, V> entryCodec;
    private final String table;
    private final Striped<Lock> layerLocks = Striped.lock(64);

    public LayerWriter(LayerCatalog catalog,
                       TileStore store,
                       KeyFormat<K> keyFormat,
                       ValueCodec<V> valueCodec,
                       String table) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.store = Objects.requireNonNull(store, "store");
        this.keyFormat = Objects.requireNonNull(keyFormat, "keyFormat");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
        this.entryCodec = new EntryCodec<>(keyFormat, valueCodec);
        this.table = Objects.requireNonNull(table, "table");
    }

    /** Write with a fresh index built by {@code method} over the data's key bounds. */
    public LayerMetadata<K> write(LayerId id, Dataset<K, V> data, KeyIndexMethod<K> method) {
        Objects.requireNonNull(method, "method");
        return writeWith(id, data, method::createIndex);
    }

    /** Write with a caller-supplied index; its key space must contain the data. */
    public LayerMetadata<K> write(LayerId id, Dataset<K, V> data, KeyIndex<K> index) {
        Objects.requireNonNull(index, "index");
        return writeWith(id, data, bounds -> {
            if (!index.keyBounds().contains(bounds)) {
                throw new LayerWriteException(id,
                        "key index space " + index.keyBounds() + " does not contain data bounds " + bounds);
            }
            return index;
        });
    }

    private LayerMetadata<K> writeWith(LayerId id, Dataset<K, V> data, Function<KeyBounds<K>, KeyIndex<K>> indexFor) {
        Objects.requireNonNull(id, "id");
        Optional<KeyBounds<K>> maybeBounds = data.keyBounds();
        if (maybeBounds.isEmpty()) {
            throw new LayerWriteException(id, "cannot write an empty dataset to " + id);
        }
        KeyBounds<K> bounds = maybeBounds.get();

        Lock lock = layerLocks.get(id);
        lock.lock();
        try {
            KeyIndex<K> index;
            List<StoredRecord> records;
            Optional<LayerHeader> previous;
            try {
                index = indexFor.apply(bounds);
                records = encode(data, index);
                previous = catalog.readHeader(id);
            } catch (LayerWriteException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new LayerWriteException(id, e);
            }

            long generation = previous.map(h -> h.generation() + 1).orElse(1L);
            PartitionSelector target = PartitionSelector.forLayer(table, id, generation);
            try {
                store.drop(target);
                store.write(target, records);
            } catch (RuntimeException e) {
                dropQuietly(target, e);
                throw new LayerWriteException(id, e);
            }

            LayerHeader header = new LayerHeader(
                    keyFormat.name(), valueCodec.schema().name(), table, target.partition(), generation);
            LayerMetadata<K> metadata = new LayerMetadata<>(header, bounds, index, valueCodec.schema());
            try {
                catalog.write(id, metadata, keyFormat);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "metadata of " + id + " not written; partition "
                        + target.partition() + " is orphaned", e);
                throw new MetadataWriteException(id, target.partition(), e);
            }

            // The previous generation stays for reads that resolved it before the swap.
            previous.filter(h -> h.generation() > 1).ifPresent(h ->
                    dropQuietly(PartitionSelector.forLayer(h.table(), id, h.generation() - 1), null));

            log.info(() -> String.format("wrote %s: %d entries in %d records, generation %d, %s index",
                    id, data.size(), records.size(), generation, index.type()));
            return metadata;
        } finally {
            lock.unlock();
        }
    }

    /** Group entries by index position; one stored record per position. */
    private List<StoredRecord> encode(Dataset<K, V> data, KeyIndex<K> index) {
        Map<Long, List<Dataset.Entry<K, V>>> byIndex = new TreeMap<>();
        for (Dataset.Entry<K, V> e : data.entries()) {
            byIndex.computeIfAbsent(index.toIndex(e.key()), i -> new ArrayList<>()).add(e);
        }
        List<StoredRecord> out = new ArrayList<>(byIndex.size());
        byIndex.forEach((i, entries) -> out.add(new StoredRecord(i, entryCodec.encode(entries))));
        return out;
    }

    private void dropQuietly(PartitionSelector selector, Exception primary) {
        try {
            store.drop(selector);
        } catch (RuntimeException dropFailure) {
            if (primary != null) primary.addSuppressed(dropFailure);
            log.log(Level.WARNING, "failed to drop partition " + selector, dropFailure);
        }
    }
}
