// file: core/src/main/java/io/tilelite/core/key/GridKey.java
package io.tilelite.core.key;

/**
 * A structured, immutable grid key (spatial, optionally with a time component).
 * <p>
 * Keys form a lattice under their component-wise order, which is what
 * {@link KeyBounds} needs to describe axis-aligned regions:
 *  - componentMin / componentMax give the meet and join of two keys,
 *  - isComponentwiseLessOrEqual is the partial order used to validate bounds.
 * <p>
 * Implementations are value types: equals/hashCode based purely on components.
 */
public interface GridKey<K extends GridKey<K>> {

    /** Key whose every component is the minimum of this and {@code other}. */
    K componentMin(K other);

    /** Key whose every component is the maximum of this and {@code other}. */
    K componentMax(K other);

    /** True when every component of this key is {@code <=} the same component of {@code other}. */
    boolean isComponentwiseLessOrEqual(K other);
}
