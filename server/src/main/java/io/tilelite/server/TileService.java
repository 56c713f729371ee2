// file: server/src/main/java/io/tilelite/server/TileService.java
package io.tilelite.server;

import io.tilelite.core.index.KeyIndexMethod;
import io.tilelite.core.index.KeyIndexMethods;
import io.tilelite.core.key.GridKey;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpatialKey;
import io.tilelite.core.layer.AttributeCorruptException;
import io.tilelite.core.layer.Dataset;
import io.tilelite.core.layer.LayerHeader;
import io.tilelite.core.layer.LayerId;
import io.tilelite.core.layer.LayerMetadata;
import io.tilelite.core.layer.LayerNotFoundException;
import io.tilelite.core.raster.Tile;
import io.tilelite.server.dto.LayerIdView;
import io.tilelite.server.dto.LayerMetadataView;
import io.tilelite.server.dto.TileView;
import io.tilelite.server.dto.TilesResponse;
import io.tilelite.server.dto.WriteTilesRequest;
import io.tilelite.server.dto.WriteTilesResponse;
import io.tilelite.server.layer.LayerReader;
import io.tilelite.server.layer.LayerWriter;
import io.tilelite.storage.catalog.LayerAttributes;
import io.tilelite.storage.catalog.LayerCatalog;
import io.tilelite.storage.codec.KeyFormat;
import io.tilelite.storage.codec.SpaceTimeKeyFormat;
import io.tilelite.storage.codec.SpatialKeyFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Application service behind the HTTP API: spatial tile layers.
 * <p>
 * Responsibilities:
 *  - Hide catalog, reader and writer wiring from the HTTP layer.
 *  - Translate between DTOs and layer datasets.
 *  - Resolve index methods by name, falling back to the configured default.
 * <p>
 * Metadata can be viewed for layers of any key type; tiles are served for
 * spatial layers.
 */
public class TileService {

    private final LayerCatalog catalog;
    private final LayerReader<SpatialKey, Tile> reader;
    private final LayerWriter<SpatialKey, Tile> writer;
    private final String defaultIndexMethod;

    public TileService(LayerCatalog catalog,
                       LayerReader<SpatialKey, Tile> reader,
                       LayerWriter<SpatialKey, Tile> writer,
                       String defaultIndexMethod) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.defaultIndexMethod = Objects.requireNonNull(defaultIndexMethod, "defaultIndexMethod");
    }

    public List<LayerIdView> layers() {
        List<LayerIdView> out = new ArrayList<>();
        for (LayerId id : catalog.layerIds()) {
            var v = new LayerIdView();
            v.name = id.name();
            v.zoom = id.zoom();
            out.add(v);
        }
        return out;
    }

    /**
     * @throws LayerNotFoundException    when the layer does not exist
     * @throws AttributeCorruptException when its metadata cannot be decoded
     */
    public LayerMetadataView metadata(LayerId id) {
        LayerHeader header = catalog.readHeader(id).orElseThrow(() -> new LayerNotFoundException(id));
        return switch (header.keyType()) {
            case SpatialKeyFormat.NAME -> view(id, SpatialKeyFormat.INSTANCE);
            case SpaceTimeKeyFormat.NAME -> view(id, SpaceTimeKeyFormat.INSTANCE);
            default -> throw new AttributeCorruptException(id, LayerAttributes.HEADER,
                    "unknown key type '" + header.keyType() + "'");
        };
    }

    /** Tiles inside {@code bounds}, or the whole layer when bounds is null. */
    public TilesResponse tiles(LayerId id, KeyBounds<SpatialKey> bounds) {
        Dataset<SpatialKey, Tile> data = bounds == null ? reader.read(id) : reader.read(id, bounds);
        var resp = new TilesResponse();
        resp.name = id.name();
        resp.zoom = id.zoom();
        resp.count = data.size();
        resp.tiles = new ArrayList<>(data.size());
        for (Dataset.Entry<SpatialKey, Tile> e : data.entries()) {
            resp.tiles.add(toView(e.key(), e.value()));
        }
        return resp;
    }

    public WriteTilesResponse writeTiles(LayerId id, WriteTilesRequest req) {
        if (req == null || req.tiles == null || req.tiles.isEmpty()) {
            throw new IllegalArgumentException("tiles must not be empty");
        }
        List<Dataset.Entry<SpatialKey, Tile>> entries = new ArrayList<>(req.tiles.size());
        for (TileView t : req.tiles) {
            if (t == null) throw new IllegalArgumentException("tile must not be null");
            entries.add(new Dataset.Entry<>(new SpatialKey(t.col, t.row), new Tile(t.cols, t.rows, t.cells)));
        }
        String method = req.indexMethod != null ? req.indexMethod : defaultIndexMethod;
        KeyIndexMethod<SpatialKey> indexMethod = KeyIndexMethods.spatialByName(method);

        LayerMetadata<SpatialKey> md = writer.write(id, Dataset.of(entries), indexMethod);

        var resp = new WriteTilesResponse();
        resp.ok = true;
        resp.count = entries.size();
        resp.generation = md.header().generation();
        resp.indexType = md.keyIndex().type();
        return resp;
    }

    private <K extends GridKey<K>> LayerMetadataView view(LayerId id, KeyFormat<K> format) {
        LayerMetadata<K> md = catalog.read(id, format);
        var v = new LayerMetadataView();
        v.name = id.name();
        v.zoom = id.zoom();
        v.keyType = md.header().keyType();
        v.valueType = md.header().valueType();
        v.table = md.header().table();
        v.partition = md.header().partition();
        v.generation = md.header().generation();
        v.keyBounds = format.boundsToJson(md.keyBounds());
        v.keyIndex = format.indexToJson(md.keyIndex());
        v.schemaName = md.schema().name();
        v.schemaVersion = md.schema().version();
        return v;
    }

    private static TileView toView(SpatialKey key, Tile tile) {
        var v = new TileView();
        v.col = key.col();
        v.row = key.row();
        v.cols = tile.cols();
        v.rows = tile.rows();
        v.cells = tile.cells();
        return v;
    }
}
