// file: storage/src/main/java/io/tilelite/storage/StoredRecord.java
package io.tilelite.storage;

import java.util.Arrays;
import java.util.Objects;

/**
 * One row of the backing store: a position in the index space plus an opaque value.
 * Value bytes are copied in and out.
 */
public final class StoredRecord {
    private final long index;
    private final byte[] value;

    public StoredRecord(long index, byte[] value) {
        Objects.requireNonNull(value, "value");
        this.index = index;
        this.value = value.clone();
    }

    public long index() { return index; }

    public byte[] value() { return value.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredRecord r)) return false;
        return index == r.index && Arrays.equals(value, r.value);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(index) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "StoredRecord(index=" + index + ", " + value.length + " bytes)";
    }
}
