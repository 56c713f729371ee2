// file: core/src/main/java/io/tilelite/core/key/InvalidBoundsException.java
package io.tilelite.core.key;

/**
 * Thrown when a key region is malformed: the min key exceeds the max key on some axis.
 * This is a caller contract violation and is never coerced into an empty region.
 */
public class InvalidBoundsException extends IllegalArgumentException {

    public InvalidBoundsException(Object minKey, Object maxKey) {
        super("invalid key bounds: min " + minKey + " is not <= max " + maxKey + " on every axis");
    }
}
