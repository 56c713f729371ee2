// file: core/src/main/java/io/tilelite/core/layer/Dataset.java
package io.tilelite.core.layer;

import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * In-memory set of (key, value) records of one layer. Keys are unique.
 * <p>
 * Immutable: the entry list is copied on construction.
 */
public final class Dataset<K extends GridKey<K>, V> {

    /** One record. */
    public record Entry<K, V>(K key, V value) {
        public Entry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    private final List<Entry<K, V>> entries;

    private Dataset(List<Entry<K, V>> entries) {
        this.entries = entries;
    }

    public static <K extends GridKey<K>, V> Dataset<K, V> empty() {
        return new Dataset<>(List.of());
    }

    /**
     * @throws IllegalArgumentException if two entries share a key
     */
    public static <K extends GridKey<K>, V> Dataset<K, V> of(Collection<Entry<K, V>> entries) {
        List<Entry<K, V>> copy = List.copyOf(entries);
        Set<K> seen = new HashSet<>(copy.size() * 2);
        for (Entry<K, V> e : copy) {
            if (!seen.add(e.key())) {
                throw new IllegalArgumentException("duplicate key in dataset: " + e.key());
            }
        }
        return new Dataset<>(copy);
    }

    public static <K extends GridKey<K>, V> Dataset<K, V> of(Map<K, V> records) {
        List<Entry<K, V>> list = new ArrayList<>(records.size());
        records.forEach((k, v) -> list.add(new Entry<>(k, v)));
        return new Dataset<>(List.copyOf(list));
    }

    public List<Entry<K, V>> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Stream<Entry<K, V>> stream() {
        return entries.stream();
    }

    public List<K> keys() {
        return entries.stream().map(Entry::key).toList();
    }

    /** Bounding region of all keys, or empty for an empty dataset. */
    public Optional<KeyBounds<K>> keyBounds() {
        return KeyBounds.fromKeys(keys());
    }

    /** Entries as an insertion-ordered map. */
    public Map<K, V> asMap() {
        Map<K, V> m = new LinkedHashMap<>(entries.size() * 2);
        for (Entry<K, V> e : entries) {
            m.put(e.key(), e.value());
        }
        return m;
    }

    @Override
    public String toString() {
        return "Dataset(size=" + entries.size() + ")";
    }
}
