// file: storage/src/main/java/io/tilelite/storage/catalog/LayerCatalog.java
package io.tilelite.storage.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.tilelite.core.index.KeyIndex;
import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.layer.AttributeCorruptException;
import io.tilelite.core.layer.LayerHeader;
import io.tilelite.core.layer.LayerId;
import io.tilelite.core.layer.LayerMetadata;
import io.tilelite.core.layer.LayerNotFoundException;
import io.tilelite.core.layer.RecordSchema;
import io.tilelite.storage.codec.KeyFormat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Durable mapping LayerId -> LayerMetadata on top of an {@link AttributeStore}.
 * <p>
 * Responsibilities:
 *  - write(): persist header, key bounds, key index and schema of a layer in one
 *    step and drop the layer's cached attributes. Last writer wins.
 *  - read(): assemble the metadata from the four attributes and validate it
 *    against the expected key format.
 *  - cache raw attributes per (layer, attribute), bounded by entry count.
 * <p>
 * Concurrency:
 *  - one read/write lock: writes are exclusive, reads share. A reader holding the
 *    read lock sees all attributes from the same write, cached or not.
 */
public final class LayerCatalog {
    private static final Logger log = Logger.getLogger(LayerCatalog.class.getName());

    private record AttributeKey(LayerId id, String attribute) {}

    private static final List<String> ATTRIBUTES = List.of(
            LayerAttributes.HEADER, LayerAttributes.KEY_BOUNDS, LayerAttributes.KEY_INDEX, LayerAttributes.SCHEMA);

    private final AttributeStore store;
    private final Cache<AttributeKey, JsonNode> cache;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public LayerCatalog(AttributeStore store, long maxCachedAttributes) {
        this.store = Objects.requireNonNull(store, "store");
        if (maxCachedAttributes < 0) throw new IllegalArgumentException("cache size must be >= 0");
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxCachedAttributes)
                .build();
    }

    /**
     * @throws LayerNotFoundException     when the layer has no header
     * @throws AttributeCorruptException  when an attribute is missing, undecodable
     *                                    or written for another key type
     */
    public <K extends GridKey<K>> LayerMetadata<K> read(LayerId id, KeyFormat<K> keyFormat) {
        lock.readLock().lock();
        try {
            JsonNode headerJson = cachedRead(id, LayerAttributes.HEADER);
            if (headerJson == null) throw new LayerNotFoundException(id);
            LayerHeader header = decode(id, LayerAttributes.HEADER, headerJson, LayerAttributes::headerFromJson);
            if (!header.keyType().equals(keyFormat.name())) {
                throw new AttributeCorruptException(id, LayerAttributes.HEADER,
                        "layer has key type '" + header.keyType() + "', expected '" + keyFormat.name() + "'");
            }

            KeyBounds<K> keyBounds = decode(id, LayerAttributes.KEY_BOUNDS,
                    required(id, LayerAttributes.KEY_BOUNDS), keyFormat::boundsFromJson);
            KeyIndex<K> keyIndex = decode(id, LayerAttributes.KEY_INDEX,
                    required(id, LayerAttributes.KEY_INDEX), keyFormat::indexFromJson);
            RecordSchema schema = decode(id, LayerAttributes.SCHEMA,
                    required(id, LayerAttributes.SCHEMA), LayerAttributes::schemaFromJson);

            return new LayerMetadata<>(header, keyBounds, keyIndex, schema);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Header only; empty when the layer does not exist. */
    public Optional<LayerHeader> readHeader(LayerId id) {
        lock.readLock().lock();
        try {
            JsonNode headerJson = cachedRead(id, LayerAttributes.HEADER);
            if (headerJson == null) return Optional.empty();
            return Optional.of(decode(id, LayerAttributes.HEADER, headerJson, LayerAttributes::headerFromJson));
        } finally {
            lock.readLock().unlock();
        }
    }

    public <K extends GridKey<K>> void write(LayerId id, LayerMetadata<K> metadata, KeyFormat<K> keyFormat) {
        if (!metadata.header().keyType().equals(keyFormat.name())) {
            throw new IllegalArgumentException("header key type '" + metadata.header().keyType()
                    + "' does not match key format '" + keyFormat.name() + "'");
        }
        Map<String, JsonNode> attrs = new LinkedHashMap<>();
        attrs.put(LayerAttributes.HEADER, LayerAttributes.headerToJson(metadata.header()));
        attrs.put(LayerAttributes.KEY_BOUNDS, keyFormat.boundsToJson(metadata.keyBounds()));
        attrs.put(LayerAttributes.KEY_INDEX, keyFormat.indexToJson(metadata.keyIndex()));
        attrs.put(LayerAttributes.SCHEMA, LayerAttributes.schemaToJson(metadata.schema()));

        lock.writeLock().lock();
        try {
            store.writeAll(id, attrs);
        } finally {
            invalidate(id);
            lock.writeLock().unlock();
        }
        log.fine(() -> "catalog: wrote " + id + " generation " + metadata.header().generation());
    }

    public boolean exists(LayerId id) {
        lock.readLock().lock();
        try {
            return cache.getIfPresent(new AttributeKey(id, LayerAttributes.HEADER)) != null
                    || store.read(id, LayerAttributes.HEADER) != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<LayerId> layerIds() {
        lock.readLock().lock();
        try {
            return store.layerIds();
        } finally {
            lock.readLock().unlock();
        }
    }

    long cachedAttributeCount() {
        return cache.size();
    }

    private void invalidate(LayerId id) {
        for (String a : ATTRIBUTES) {
            cache.invalidate(new AttributeKey(id, a));
        }
    }

    private JsonNode cachedRead(LayerId id, String attribute) {
        AttributeKey key = new AttributeKey(id, attribute);
        JsonNode v = cache.getIfPresent(key);
        if (v != null) return v;
        log.finer(() -> "catalog: cache miss " + id + "/" + attribute);
        v = store.read(id, attribute);
        if (v != null) cache.put(key, v);
        return v;
    }

    private JsonNode required(LayerId id, String attribute) {
        JsonNode v = cachedRead(id, attribute);
        if (v == null) throw new AttributeCorruptException(id, attribute, "attribute is missing");
        return v;
    }

    private static <T> T decode(LayerId id, String attribute, JsonNode json, Function<JsonNode, T> decoder) {
        try {
            return decoder.apply(json);
        } catch (RuntimeException e) {
            throw new AttributeCorruptException(id, attribute, e);
        }
    }
}
