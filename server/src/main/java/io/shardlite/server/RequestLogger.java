// file: server/src/main/java/io/shardlite/server/RequestLogger.java
package io.shardlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per completed HTTP request.
 * <p>
 * 5xx responses log at WARNING with the exception attached; client errors add
 * the reason to the line; everything else is INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /** Requests answered without touching the sharding layer. */
    public static void logRequest(String method, String path, int status) {
        logRequest(method, path, status, 0, -1, null);
    }

    /**
     * @param totalMillis wall-clock latency of the whole request
     * @param waitMillis  time spent waiting on the region or coordinator, or -1 if not measured
     * @param error       what went wrong for a 4xx/5xx, null if nothing
     */
    public static void logRequest(String method,
                                  String path,
                                  int status,
                                  long totalMillis,
                                  long waitMillis,
                                  Throwable error) {
        StringBuilder line = new StringBuilder()
                .append("HTTP ").append(method).append(' ').append(path)
                .append(" -> ").append(status)
                .append(" (total=").append(totalMillis).append("ms");
        if (waitMillis >= 0) {
            line.append(", sharding=").append(waitMillis).append("ms");
        }
        line.append(')');

        if (status >= 500) {
            log.log(Level.WARNING, line.toString(), error);
        } else if (status >= 400 && error != null) {
            log.info(line + ": " + error.getMessage());
        } else {
            log.info(line.toString());
        }
    }
}
