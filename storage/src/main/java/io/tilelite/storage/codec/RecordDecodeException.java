// file: storage/src/main/java/io/tilelite/storage/codec/RecordDecodeException.java
package io.tilelite.storage.codec;

/** A stored record cannot be decoded with the codec at hand. */
public class RecordDecodeException extends RuntimeException {

    public RecordDecodeException(String message) {
        super(message);
    }

    public RecordDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
