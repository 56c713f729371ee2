package io.tilelite.server.dto;

/**
 * JSON form of the catalog configuration. Absent fields fall back to defaults.
 */
public class JsonCatalogConfig {
    public String tileTable;
    public Long cacheSize;
    public String defaultIndexMethod;
    public Integer scanThreads;
}
