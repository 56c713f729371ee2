// file: server/src/main/java/io/tilelite/server/WebServer.java
package io.tilelite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tilelite.core.key.KeyBounds;
import io.tilelite.core.key.SpatialKey;
import io.tilelite.core.layer.LayerId;
import io.tilelite.core.layer.LayerNotFoundException;
import io.tilelite.core.layer.LayerReadException;
import io.tilelite.core.layer.LayerWriteException;
import io.tilelite.server.dto.WriteTilesRequest;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Thin HTTP adapter over {@link TileService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging via {@link RequestLogger}.
 *
 * Path layout (v1):
 *   - GET /admin/health
 *   - GET /layers
 *   - GET /layers/{name}/{zoom}
 *   - GET /layers/{name}/{zoom}/tiles[?minCol=&minRow=&maxCol=&maxRow=]
 *   - PUT /layers/{name}/{zoom}/tiles
 *
 * Status mapping:
 *   - unknown layer                                   -> 404
 *   - bad path values, bounds, tile shapes or JSON    -> 400
 *   - anything else                                   -> 500
 *
 * Handlers run on worker threads; reads and writes block on storage.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 64 * 1024 * 1024; // 64 MiB
    private static final String LAYERS_PREFIX = "/layers/";
    private static final List<String> BOUND_PARAMS = List.of("minCol", "minRow", "maxCol", "maxRow");

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final TileService tiles;

    public WebServer(int port, TileService tiles) {
        this.tiles = tiles;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::route))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if ("/admin/health".equals(path)) {
            send(ex, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, 200, 0, -1, null);
        } else if ("/layers".equals(path) || LAYERS_PREFIX.equals(path)) {
            if ("GET".equals(method)) {
                handle(ex, tiles::layers);
            } else {
                methodNotAllowed(ex);
            }
        } else if (path.startsWith(LAYERS_PREFIX)) {
            String[] parts = path.substring(LAYERS_PREFIX.length()).split("/");
            if (parts.length == 2) {
                if ("GET".equals(method)) {
                    handle(ex, () -> tiles.metadata(layerId(parts)));
                } else {
                    methodNotAllowed(ex);
                }
            } else if (parts.length == 3 && "tiles".equals(parts[2])) {
                switch (method) {
                    case "GET" -> handle(ex, () -> tiles.tiles(layerId(parts), queryBounds(ex)));
                    case "PUT" -> handle(ex, () -> tiles.writeTiles(layerId(parts), readBody(ex)));
                    default -> methodNotAllowed(ex);
                }
            } else {
                notFound(ex);
            }
        } else {
            notFound(ex);
        }
    }

    // ---------- handlers ----------

    private void handle(HttpServerExchange ex, Callable<Object> action) {
        long start = System.nanoTime();
        int status = 200;
        long storageMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Object body = action.call();
            storageMs = (System.nanoTime() - sStart) / 1_000_000L;
            send(ex, status, body);
        } catch (BodyTooLargeException tooLarge) {
            status = 413;
            error = tooLarge;
            send(ex, status, Map.of("error", "request body too large"));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            if (status >= 500) {
                send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
            } else {
                boolean wrapped = (e instanceof LayerReadException || e instanceof LayerWriteException) && e.getCause() != null;
                Throwable shown = wrapped ? e.getCause() : e;
                send(ex, status, Map.of("error", String.valueOf(shown.getMessage())));
            }
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, totalMs, storageMs, error);
        }
    }

    static int statusFor(Throwable e) {
        if (e instanceof LayerNotFoundException) return 404;
        if (e instanceof LayerReadException && e.getCause() instanceof LayerNotFoundException) return 404;
        if (e instanceof IllegalArgumentException) return 400;
        if (e instanceof LayerWriteException && e.getCause() instanceof IllegalArgumentException) return 400;
        return 500;
    }

    private void methodNotAllowed(HttpServerExchange ex) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), 405, 0, -1, null);
    }

    private void notFound(HttpServerExchange ex) {
        send(ex, 404, Map.of("error", "not found"));
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), 404, 0, -1, null);
    }

    // ---------- request parsing ----------

    private static LayerId layerId(String[] parts) {
        int zoom;
        try {
            zoom = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("zoom must be an integer, got '" + parts[1] + "'");
        }
        return new LayerId(parts[0], zoom);
    }

    /** All four bound parameters, or none for the full extent. */
    private static KeyBounds<SpatialKey> queryBounds(HttpServerExchange ex) {
        Map<String, Deque<String>> params = ex.getQueryParameters();
        long present = BOUND_PARAMS.stream().filter(params::containsKey).count();
        if (present == 0) return null;
        if (present != BOUND_PARAMS.size()) {
            throw new IllegalArgumentException("bounds need all of " + BOUND_PARAMS);
        }
        int[] v = new int[4];
        for (int i = 0; i < 4; i++) {
            String name = BOUND_PARAMS.get(i);
            String raw = params.get(name).peekFirst();
            try {
                v[i] = Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer, got '" + raw + "'");
            }
        }
        return new KeyBounds<>(new SpatialKey(v[0], v[1]), new SpatialKey(v[2], v[3]));
    }

    private WriteTilesRequest readBody(HttpServerExchange ex) throws Exception {
        byte[] data = ex.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
        if (data.length > MAX_BODY_BYTES) throw new BodyTooLargeException();
        return json.readValue(data, WriteTilesRequest.class);
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }

    private static final class BodyTooLargeException extends Exception {
        BodyTooLargeException() {
            super("request body exceeds " + MAX_BODY_BYTES + " bytes");
        }
    }
}
