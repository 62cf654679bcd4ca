// file: server/src/main/java/io/txtlite/server/RequestLogger.java
package io.txtlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log method/path/status and latency of HTTP requests.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path (never the query string, which may carry names)
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       exception behind a 4xx/5xx, or null
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (%dms)", method, path, status, totalMillis);

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.FINE, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
