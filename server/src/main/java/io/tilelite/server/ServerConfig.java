// file: server/src/main/java/io/tilelite/server/ServerConfig.java
package io.tilelite.server;

import java.nio.file.Path;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:          HTTP API port
 *  - dataDir:           root directory; attributes/ and tiles/ live below it
 *  - catalogConfigPath: optional JSON catalog config (see {@link CatalogConfig})
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String catalogConfigPath
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,      -p <port>
     *   --data-dir,       -d <path>
     *   --catalog-config, -c <path>
     *   --help,           -h
     *
     * All flags are optional.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String dataDir = "./data";
        String catalogConfigPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--catalog-config", "-c" -> {
                    ensureValue(args, i);
                    catalogConfigPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, dataDir, catalogConfigPath);
    }

    public CatalogConfig catalogConfig() {
        if (catalogConfigPath == null || catalogConfigPath.isBlank()) {
            return CatalogConfig.defaults();
        }
        return CatalogConfig.fromJsonFile(Path.of(catalogConfigPath));
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: tilelite-server [options]

            Options:
              --http-port,      -p   HTTP port (default: 8080)
              --data-dir,       -d   Data directory (default: ./data)
              --catalog-config, -c   Path to JSON catalog config (optional)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
