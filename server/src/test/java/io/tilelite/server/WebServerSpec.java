// file: server/src/test/java/io/tilelite/server/WebServerSpec.java
package io.tilelite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tilelite.core.index.KeyIndexMethods;
import io.tilelite.core.key.SpaceTimeKey;
import io.tilelite.core.layer.Dataset;
import io.tilelite.core.layer.LayerId;
import io.tilelite.core.raster.Tile;
import io.tilelite.server.layer.LayerReader;
import io.tilelite.server.layer.LayerWriter;
import io.tilelite.storage.InMemoryTileStore;
import io.tilelite.storage.catalog.InMemoryAttributeStore;
import io.tilelite.storage.catalog.LayerCatalog;
import io.tilelite.storage.codec.SpaceTimeKeyFormat;
import io.tilelite.storage.codec.SpatialKeyFormat;
import io.tilelite.storage.codec.TileCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the tile HTTP API over in-memory stores.
 *
 * Focus:
 *  - PUT then GET of tiles, with and without a bounding box.
 *  - Metadata views for spatial and space-time layers.
 *  - Status mapping: 404 unknown layer, 400 bad input (including rejected layer
 *    names and key spaces the index cannot cover), 405 wrong method.
 */
class WebServerSpec {

    private static final int PORT = 18091; // test-only port
    private final ObjectMapper json = new ObjectMapper();

    private WebServer server;
    private HttpClient client;
    private LayerCatalog catalog;
    private InMemoryTileStore tiles;

    @BeforeEach
    void startServer() {
        tiles = new InMemoryTileStore();
        catalog = new LayerCatalog(new InMemoryAttributeStore(), 64);
        var reader = new LayerReader<>(catalog, tiles, SpatialKeyFormat.INSTANCE, new TileCodec());
        var writer = new LayerWriter<>(catalog, tiles, SpatialKeyFormat.INSTANCE, new TileCodec(), "tiles");
        var service = new TileService(catalog, reader, writer, "zorder");

        server = new WebServer(PORT, service);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> put(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .PUT(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    /** Four 1x1 tiles at (0,0), (1,0), (0,1), (1,1), valued 10 * col + row. */
    private static final String FOUR_TILES = """
            {
              "indexMethod": "hilbert",
              "tiles": [
                {"col": 0, "row": 0, "cols": 1, "rows": 1, "cells": [0.0]},
                {"col": 1, "row": 0, "cols": 1, "rows": 1, "cells": [10.0]},
                {"col": 0, "row": 1, "cols": 1, "rows": 1, "cells": [1.0]},
                {"col": 1, "row": 1, "cols": 1, "rows": 1, "cells": [11.0]}
              ]
            }
            """;

    @Test
    void health_is_ok() throws Exception {
        var resp = get("/admin/health");
        assertEquals(200, resp.statusCode());
        assertEquals("ok", json.readTree(resp.body()).path("status").asText());
    }

    @Test
    void put_then_get_tiles_round_trips() throws Exception {
        var putResp = put("/layers/dem/4/tiles", FOUR_TILES);
        assertEquals(200, putResp.statusCode(), putResp.body());
        JsonNode written = json.readTree(putResp.body());
        assertTrue(written.path("ok").asBoolean());
        assertEquals(4, written.path("count").asInt());
        assertEquals(1, written.path("generation").asLong());
        assertEquals("hilbert", written.path("indexType").asText());

        var getResp = get("/layers/dem/4/tiles");
        assertEquals(200, getResp.statusCode());
        JsonNode body = json.readTree(getResp.body());
        assertEquals("dem", body.path("name").asText());
        assertEquals(4, body.path("zoom").asInt());
        assertEquals(4, body.path("count").asInt());
        assertEquals(4, body.path("tiles").size());
    }

    @Test
    void bounding_box_limits_returned_tiles() throws Exception {
        assertEquals(200, put("/layers/dem/4/tiles", FOUR_TILES).statusCode());

        var resp = get("/layers/dem/4/tiles?minCol=1&minRow=0&maxCol=1&maxRow=5");
        assertEquals(200, resp.statusCode());
        JsonNode body = json.readTree(resp.body());
        assertEquals(2, body.path("count").asInt());
        for (JsonNode t : body.path("tiles")) {
            assertEquals(1, t.path("col").asInt());
            assertEquals(10.0 + t.path("row").asInt(), t.path("cells").get(0).asDouble());
        }
    }

    @Test
    void metadata_and_listing_reflect_written_layers() throws Exception {
        assertEquals(200, put("/layers/dem/4/tiles", FOUR_TILES).statusCode());

        JsonNode layers = json.readTree(get("/layers").body());
        assertEquals(1, layers.size());
        assertEquals("dem", layers.get(0).path("name").asText());

        var resp = get("/layers/dem/4");
        assertEquals(200, resp.statusCode());
        JsonNode md = json.readTree(resp.body());
        assertEquals("spatial", md.path("keyType").asText());
        assertEquals("tile", md.path("valueType").asText());
        assertEquals("dem/4@1", md.path("partition").asText());
        assertEquals("hilbert", md.path("keyIndex").path("type").asText());
        assertEquals(1, md.path("keyBounds").path("maxKey").path("col").asInt());
    }

    @Test
    void metadata_of_space_time_layer_is_served() throws Exception {
        var stWriter = new LayerWriter<>(catalog, tiles, SpaceTimeKeyFormat.INSTANCE, new TileCodec(), "tiles");
        var key = SpaceTimeKey.of(2, 3, Instant.parse("2024-01-01T00:00:00Z"));
        stWriter.write(new LayerId("ndvi", 2), Dataset.of(Map.of(key, Tile.fill(1, 1, 0.5))),
                KeyIndexMethods.zCurve(Duration.ofDays(1)));

        var resp = get("/layers/ndvi/2");
        assertEquals(200, resp.statusCode(), resp.body());
        JsonNode md = json.readTree(resp.body());
        assertEquals("spacetime", md.path("keyType").asText());
        assertEquals(Duration.ofDays(1).toMillis(), md.path("keyIndex").path("temporalResolutionMillis").asLong());
    }

    @Test
    void unknown_layer_returns_404() throws Exception {
        assertEquals(404, get("/layers/nope/1").statusCode());
        var resp = get("/layers/nope/1/tiles");
        assertEquals(404, resp.statusCode());
        assertTrue(resp.body().contains("nope"));
    }

    @Test
    void partial_bounding_box_returns_400() throws Exception {
        assertEquals(200, put("/layers/dem/4/tiles", FOUR_TILES).statusCode());
        assertEquals(400, get("/layers/dem/4/tiles?minCol=0&maxCol=3").statusCode());
    }

    @Test
    void inverted_bounding_box_returns_400() throws Exception {
        assertEquals(200, put("/layers/dem/4/tiles", FOUR_TILES).statusCode());
        assertEquals(400, get("/layers/dem/4/tiles?minCol=5&minRow=0&maxCol=1&maxRow=1").statusCode());
    }

    @Test
    void non_numeric_zoom_returns_400() throws Exception {
        var resp = get("/layers/dem/high");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("zoom"));
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        var resp = put("/layers/dem/4/tiles", "{ not-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void empty_tile_list_returns_400() throws Exception {
        var resp = put("/layers/dem/4/tiles", "{\"tiles\": []}");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("tiles must not be empty"));
    }

    @Test
    void wrong_cell_count_returns_400() throws Exception {
        var body = "{\"tiles\": [{\"col\": 0, \"row\": 0, \"cols\": 2, \"rows\": 2, \"cells\": [1.0]}]}";
        assertEquals(400, put("/layers/dem/4/tiles", body).statusCode());
    }

    @Test
    void unknown_index_method_returns_400() throws Exception {
        var body = "{\"indexMethod\": \"peano\", \"tiles\": [{\"col\": 0, \"row\": 0, \"cols\": 1, \"rows\": 1, \"cells\": [1.0]}]}";
        var resp = put("/layers/dem/4/tiles", body);
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("peano"));
    }

    @Test
    void unsupported_method_returns_405() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + "/layers/dem/4"))
                .DELETE()
                .build();
        assertEquals(405, client.send(req, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void unknown_path_returns_404() throws Exception {
        assertEquals(404, get("/nothing/here").statusCode());
    }

    @Test
    void dot_segment_layer_name_returns_400_and_writes_nothing() throws Exception {
        var resp = put("/layers/%2E%2E/5/tiles", FOUR_TILES);
        assertEquals(400, resp.statusCode(), resp.body());
        assertTrue(resp.body().contains("layer name"));
        assertEquals(0, json.readTree(get("/layers").body()).size());
    }

    @Test
    void key_space_too_wide_for_the_index_returns_400() throws Exception {
        var body = """
                {
                  "indexMethod": "zorder",
                  "tiles": [
                    {"col": -2147483648, "row": 0, "cols": 1, "rows": 1, "cells": [1.0]},
                    {"col": 2147483647, "row": 0, "cols": 1, "rows": 1, "cells": [2.0]}
                  ]
                }
                """;
        var resp = put("/layers/wide/1/tiles", body);
        assertEquals(400, resp.statusCode(), resp.body());
        assertTrue(resp.body().contains("bits"), resp.body());
        assertEquals(404, get("/layers/wide/1").statusCode());
    }
}
