// file: client/src/main/java/io/tilelite/client/Cli.java
package io.tilelite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Simple CLI for interacting with a running TileLite node over HTTP.
 *
 * Usage:
 *   tilelite-cli [--base-url http://host:port] layers
 *   tilelite-cli [--base-url http://host:port] meta <name> <zoom>
 *   tilelite-cli [--base-url http://host:port] tiles <name> <zoom> [minCol minRow maxCol maxRow]
 *   tilelite-cli [--base-url http://host:port] put <name> <zoom> <tiles.json>
 *
 * Examples:
 *   tilelite-cli meta dem 4
 *   tilelite-cli tiles dem 4 0 0 3 3
 *   tilelite-cli put dem 4 dem-z4.json
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String baseUrl = parsed.getKey();
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(baseUrl);

            switch (cmd) {
                case "layers" -> cli.get("/layers");
                case "meta" -> {
                    if (rest.length != 3) {
                        usageAndExit("meta requires <name> <zoom>");
                    }
                    cli.get(layerPath(rest[1], rest[2]));
                }
                case "tiles" -> {
                    if (rest.length != 3 && rest.length != 7) {
                        usageAndExit("tiles requires <name> <zoom> [minCol minRow maxCol maxRow]");
                    }
                    String[] bbox = new String[rest.length - 3];
                    System.arraycopy(rest, 3, bbox, 0, bbox.length);
                    cli.get(tilesPath(rest[1], rest[2], bbox));
                }
                case "put" -> {
                    if (rest.length != 4) {
                        usageAndExit("put requires <name> <zoom> <tiles.json>");
                    }
                    cli.put(tilesPath(rest[1], rest[2], new String[0]), Path.of(rest[3]));
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 2 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    static String layerPath(String name, String zoom) {
        return "/layers/" + URLEncoder.encode(name, StandardCharsets.UTF_8).replace("+", "%20") + "/" + zoom;
    }

    /** Tiles path, with a bounding box query when four bounds are given. */
    static String tilesPath(String name, String zoom, String[] bbox) {
        String path = layerPath(name, zoom) + "/tiles";
        if (bbox.length == 0) return path;
        if (bbox.length != 4) throw new CliException("bounding box needs minCol minRow maxCol maxRow");
        return path + "?minCol=" + bbox[0] + "&minRow=" + bbox[1] + "&maxCol=" + bbox[2] + "&maxRow=" + bbox[3];
    }

    private void get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404) {
            System.out.println("(not found)");
            return;
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET failed (" + resp.statusCode() + "): " + resp.body());
        }
        printPretty(resp.body());
    }

    private void put(String path, Path file) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofFile(file))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("PUT failed (" + resp.statusCode() + "): " + resp.body());
        }
        JsonNode body = json.readTree(resp.body());
        System.out.printf("OK: %d tiles, generation %d, %s index%n",
                body.path("count").asInt(), body.path("generation").asLong(), body.path("indexType").asText());
    }

    private void printPretty(String body) throws Exception {
        JsonNode tree = json.readTree(body);
        System.out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(tree));
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  tilelite-cli [--base-url http://host:port] layers
                  tilelite-cli [--base-url http://host:port] meta <name> <zoom>
                  tilelite-cli [--base-url http://host:port] tiles <name> <zoom> [minCol minRow maxCol maxRow]
                  tilelite-cli [--base-url http://host:port] put <name> <zoom> <tiles.json>
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
