// file: server/src/main/java/io/shardlite/server/region/UndeliveredHandler.java
package io.shardlite.server.region;

import io.shardlite.core.exception.ShardingException;

import java.util.logging.Logger;

/**
 * Receives every message a region gave up on, with the reason
 * ({@link io.shardlite.core.exception.DeliveryFailedException} or
 * {@link io.shardlite.core.exception.UnknownPartitionException}).
 */
@FunctionalInterface
public interface UndeliveredHandler {

    void onUndelivered(Object message, ShardingException reason);

    /** Logs at WARNING; the default when the application does not care. */
    static UndeliveredHandler logging() {
        Logger log = Logger.getLogger(UndeliveredHandler.class.getName());
        return (message, reason) -> log.warning(() -> "undelivered " + message.getClass().getSimpleName()
                + ": " + reason.getMessage());
    }
}
