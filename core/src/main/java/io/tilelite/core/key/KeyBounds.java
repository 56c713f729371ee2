// file: core/src/main/java/io/tilelite/core/key/KeyBounds.java
package io.tilelite.core.key;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Inclusive axis-aligned region [minKey, maxKey] in key space.
 * <p>
 * Invariant: minKey <= maxKey component-wise. Construction fails with
 * {@link InvalidBoundsException} otherwise.
 */
public record KeyBounds<K extends GridKey<K>>(K minKey, K maxKey) {

    public KeyBounds {
        Objects.requireNonNull(minKey, "minKey");
        Objects.requireNonNull(maxKey, "maxKey");
        if (!minKey.isComponentwiseLessOrEqual(maxKey)) {
            throw new InvalidBoundsException(minKey, maxKey);
        }
    }

    /** Degenerate region holding a single key. */
    public static <K extends GridKey<K>> KeyBounds<K> of(K key) {
        return new KeyBounds<>(key, key);
    }

    /**
     * Minimal bounds enclosing all keys, or empty when there are none.
     */
    public static <K extends GridKey<K>> Optional<KeyBounds<K>> fromKeys(Iterable<K> keys) {
        Iterator<K> it = keys.iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        K first = it.next();
        K min = first;
        K max = first;
        while (it.hasNext()) {
            K k = it.next();
            min = min.componentMin(k);
            max = max.componentMax(k);
        }
        return Optional.of(new KeyBounds<>(min, max));
    }

    public boolean includes(K key) {
        return minKey.isComponentwiseLessOrEqual(key) && key.isComponentwiseLessOrEqual(maxKey);
    }

    public boolean contains(KeyBounds<K> other) {
        return includes(other.minKey) && includes(other.maxKey);
    }

    public boolean isSingleKey() {
        return minKey.equals(maxKey);
    }

    /**
     * Overlapping region of both bounds, or empty when they are disjoint on any axis.
     */
    public Optional<KeyBounds<K>> intersect(KeyBounds<K> other) {
        K min = minKey.componentMax(other.minKey);
        K max = maxKey.componentMin(other.maxKey);
        if (!min.isComponentwiseLessOrEqual(max)) {
            return Optional.empty();
        }
        return Optional.of(new KeyBounds<>(min, max));
    }

    /** Smallest bounds enclosing both. */
    public KeyBounds<K> combine(KeyBounds<K> other) {
        return new KeyBounds<>(minKey.componentMin(other.minKey), maxKey.componentMax(other.maxKey));
    }
}
