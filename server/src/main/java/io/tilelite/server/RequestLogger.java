// file: server/src/main/java/io/tilelite/server/RequestLogger.java
package io.tilelite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the HTTP API.
 * <p>
 * One line per request with method, path, status and latency; 5xx responses
 * are logged at WARNING together with the failure.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param method        HTTP method
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency of the whole request
     * @param storageMillis latency of the layer read or write, or -1 when none ran
     * @param error         failure behind an error status, or null
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long storageMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                storageMillis >= 0 ? ", storage=" + storageMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
