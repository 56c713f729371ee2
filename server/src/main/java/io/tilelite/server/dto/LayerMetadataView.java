package io.tilelite.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON response for GET /layers/{name}/{zoom}.
 *   {
 *     "name": "dem", "zoom": 3,
 *     "keyType": "spatial", "valueType": "tile",
 *     "table": "tiles", "partition": "dem/3@2", "generation": 2,
 *     "keyBounds": {"minKey": {...}, "maxKey": {...}},
 *     "keyIndex": {"type": "zorder", ...},
 *     "schemaName": "tile", "schemaVersion": 1
 *   }
 */
public class LayerMetadataView {
    public String name;
    public int zoom;
    public String keyType;
    public String valueType;
    public String table;
    public String partition;
    public long generation;
    public JsonNode keyBounds;
    public JsonNode keyIndex;
    public String schemaName;
    public int schemaVersion;
}
