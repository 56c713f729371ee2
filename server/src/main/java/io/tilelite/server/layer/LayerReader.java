// file: server/src/main/java/io/tilelite/server/layer/LayerReader.java
package io.tilelite.server.layer;

import io.tilelite.core.index.IndexRange;
import io.tilelite.core.index.MergeQueue;
import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.layer.AttributeCorruptException;
import io.tilelite.core.layer.Dataset;
import io.tilelite.core.layer.LayerId;
import io.tilelite.core.layer.LayerMetadata;
import io.tilelite.core.layer.LayerReadException;
import io.tilelite.storage.PartitionSelector;
import io.tilelite.storage.StoredRecord;
import io.tilelite.storage.TileStore;
import io.tilelite.storage.catalog.LayerAttributes;
import io.tilelite.storage.catalog.LayerCatalog;
import io.tilelite.storage.codec.EntryCodec;
import io.tilelite.storage.codec.KeyFormat;
import io.tilelite.storage.codec.ValueCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Reads a layer, or the part of it inside a query region, back into a {@link Dataset}.
 * <p>
 * Steps of a read:
 *  1) Load the layer metadata from the catalog.
 *  2) Check the stored record schema is readable by the value codec.
 *  3) Clip the query to the layer extent; nothing left means an empty result.
 *  4) Decompose the query with the layer's own key index and merge the ranges.
 *  5) Scan every merged range of the layer's partition through the executor.
 *  6) Decode the records and keep the entries whose key lies in the query.
 *     Step 6 removes the over-coverage of range decomposition and of shared
 *     index positions.
 * <p>
 * Any failure in 1) to 6) surfaces as {@link LayerReadException} with the original cause.
 */
public final class LayerReader<K extends GridKey<K>, V> {
    private static final Logger log = Logger.getLogger(LayerReader.class.getName());

    private final LayerCatalog catalog;
    private final TileStore store;
    private final KeyFormat<K> keyFormat;
    private final ValueCodec<V> valueCodec;
    private final EntryCodec<K, V> entryCodec;
    private final Executor executor;

    /** Reader that scans on the calling thread. */
    public LayerReader(LayerCatalog catalog, TileStore store, KeyFormat<K> keyFormat, ValueCodec<V> valueCodec) {
        this(catalog, store, keyFormat, valueCodec, Runnable::run);
    }

    public LayerReader(LayerCatalog catalog,
                       TileStore store,
                       KeyFormat<K> keyFormat,
                       ValueCodec<V> valueCodec,
                       Executor executor) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.store = Objects.requireNonNull(store, "store");
        this.keyFormat = Objects.requireNonNull(keyFormat, "keyFormat");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
        this.entryCodec = new EntryCodec<>(keyFormat, valueCodec);
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /** The whole layer. */
    public Dataset<K, V> read(LayerId id) {
        LayerMetadata<K> md = metadata(id);
        return read(id, md, md.keyBounds());
    }

    public Dataset<K, V> read(LayerId id, KeyBounds<K> queryBounds) {
        Objects.requireNonNull(queryBounds, "queryBounds");
        return read(id, metadata(id), queryBounds);
    }

    /** Value stored under exactly this key, if any. */
    public Optional<V> readTile(LayerId id, K key) {
        return Optional.ofNullable(read(id, KeyBounds.of(key)).asMap().get(key));
    }

    private LayerMetadata<K> metadata(LayerId id) {
        LayerMetadata<K> md;
        try {
            md = catalog.read(id, keyFormat);
        } catch (RuntimeException e) {
            throw new LayerReadException(id, e);
        }
        if (!valueCodec.canRead(md.schema())) {
            throw new LayerReadException(id, new AttributeCorruptException(id, LayerAttributes.SCHEMA,
                    "records written as " + md.schema() + " cannot be read as " + valueCodec.schema()));
        }
        return md;
    }

    private Dataset<K, V> read(LayerId id, LayerMetadata<K> md, KeyBounds<K> queryBounds) {
        long start = System.nanoTime();
        Optional<KeyBounds<K>> clipped = md.keyBounds().intersect(queryBounds);
        if (clipped.isEmpty()) {
            log.fine(() -> "read " + id + ": query " + queryBounds + " misses layer extent " + md.keyBounds());
            return Dataset.empty();
        }

        List<IndexRange> ranges = MergeQueue.merge(md.keyIndex().indexRanges(clipped.get()));
        log.fine(() -> "read " + id + ": " + clipped.get() + " -> " + ranges.size() + " scan ranges");

        PartitionSelector selector = PartitionSelector.of(md.header());
        List<CompletableFuture<List<StoredRecord>>> scans = new ArrayList<>(ranges.size());
        for (IndexRange r : ranges) {
            scans.add(CompletableFuture.supplyAsync(() -> store.scan(selector, r), executor));
        }

        List<Dataset.Entry<K, V>> out = new ArrayList<>();
        try {
            for (CompletableFuture<List<StoredRecord>> scan : scans) {
                for (StoredRecord rec : scan.join()) {
                    for (Dataset.Entry<K, V> e : entryCodec.decode(rec.value(), md.schema())) {
                        if (queryBounds.includes(e.key())) out.add(e);
                    }
                }
            }
        } catch (CompletionException e) {
            scans.forEach(f -> f.cancel(false));
            throw new LayerReadException(id, e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            scans.forEach(f -> f.cancel(false));
            throw new LayerReadException(id, e);
        }

        Dataset<K, V> result;
        try {
            result = Dataset.of(out);
        } catch (IllegalArgumentException e) {
            throw new LayerReadException(id, e);
        }
        long ms = (System.nanoTime() - start) / 1_000_000L;
        log.info(() -> String.format("read %s: %d records from %d scan ranges of %s (%dms)",
                id, result.size(), ranges.size(), selector.partition(), ms));
        return result;
    }
}
