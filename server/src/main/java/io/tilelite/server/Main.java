// file: server/src/main/java/io/tilelite/server/Main.java
package io.tilelite.server;

import io.tilelite.server.layer.LayerReader;
import io.tilelite.server.layer.LayerWriter;
import io.tilelite.storage.FileTileStore;
import io.tilelite.storage.catalog.FileAttributeStore;
import io.tilelite.storage.catalog.LayerCatalog;
import io.tilelite.storage.codec.SpatialKeyFormat;
import io.tilelite.storage.codec.TileCodec;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a single TileLite node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional catalog config file).
 *  - Wire together storage components (attribute store, tile store, catalog).
 *  - Create the layer reader/writer pair for spatial tiles.
 *  - Create TileService and WebServer.
 *  - Start HTTP server for the client API.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        var catalogCfg = cfg.catalogConfig();
        Path dataDir = Path.of(cfg.dataDir());

        // ------ Storage Layer -------
        var attributes = new FileAttributeStore(dataDir.resolve("attributes"));
        var tileStore = new FileTileStore(dataDir.resolve("tiles"));
        var catalog = new LayerCatalog(attributes, catalogCfg.cacheSize());

        // ------ Layer I/O -------
        ExecutorService scanPool = Executors.newFixedThreadPool(catalogCfg.scanThreads(), scanThreadFactory());
        var reader = new LayerReader<>(catalog, tileStore, SpatialKeyFormat.INSTANCE, new TileCodec(), scanPool);
        var writer = new LayerWriter<>(catalog, tileStore, SpatialKeyFormat.INSTANCE, new TileCodec(),
                catalogCfg.tileTable());

        // ------ HTTP layer ------
        var service = new TileService(catalog, reader, writer, catalogCfg.defaultIndexMethod());
        var web = new WebServer(cfg.httpPort(), service);

        web.start();
        System.out.printf("TileLite listening on http://%s:%d (data in %s)%n",
                "localhost", cfg.httpPort(), dataDir.toAbsolutePath());

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                scanPool.shutdown();
                if (!scanPool.awaitTermination(5, TimeUnit.SECONDS)) {
                    scanPool.shutdownNow();
                }
                tileStore.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Shutdown did not complete cleanly", e);
            }
        }));
    }

    private static ThreadFactory scanThreadFactory() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "tile-scan-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
