// file: server/src/main/java/io/tilelite/server/CatalogConfig.java
package io.tilelite.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tilelite.core.index.KeyIndexMethods;
import io.tilelite.server.dto.JsonCatalogConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Storage and catalog tuning.
 * <p>
 * Fields:
 *  - tileTable:          backing-store table receiving layer data.
 *  - cacheSize:          maximum number of cached metadata attributes.
 *  - defaultIndexMethod: index method for writes that do not name one.
 *  - scanThreads:        size of the pool running range scans of a read.
 */
public record CatalogConfig(
        String tileTable,
        long cacheSize,
        String defaultIndexMethod,
        int scanThreads
) {
    public static final String DEFAULT_TABLE = "tiles";
    public static final long DEFAULT_CACHE_SIZE = 1024;
    public static final String DEFAULT_INDEX_METHOD = "zorder";
    public static final int DEFAULT_SCAN_THREADS = 4;

    public CatalogConfig {
        Objects.requireNonNull(tileTable, "tileTable");
        Objects.requireNonNull(defaultIndexMethod, "defaultIndexMethod");
        if (tileTable.isBlank()) throw new IllegalArgumentException("tileTable must not be blank");
        if (cacheSize < 0) throw new IllegalArgumentException("cacheSize must be >= 0");
        if (scanThreads <= 0) throw new IllegalArgumentException("scanThreads must be > 0");
        // fail at startup, not on the first write
        KeyIndexMethods.spatialByName(defaultIndexMethod);
    }

    public static CatalogConfig defaults() {
        return new CatalogConfig(DEFAULT_TABLE, DEFAULT_CACHE_SIZE, DEFAULT_INDEX_METHOD, DEFAULT_SCAN_THREADS);
    }

    public static CatalogConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonCatalogConfig cfg = mapper.readValue(path.toFile(), JsonCatalogConfig.class);
            return new CatalogConfig(
                    cfg.tileTable != null ? cfg.tileTable : DEFAULT_TABLE,
                    cfg.cacheSize != null ? cfg.cacheSize : DEFAULT_CACHE_SIZE,
                    cfg.defaultIndexMethod != null ? cfg.defaultIndexMethod : DEFAULT_INDEX_METHOD,
                    cfg.scanThreads != null ? cfg.scanThreads : DEFAULT_SCAN_THREADS
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load CatalogConfig from " + path, e);
        }
    }
}
