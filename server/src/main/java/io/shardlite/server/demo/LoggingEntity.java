// file: server/src/main/java/io/shardlite/server/demo/LoggingEntity.java
package io.shardlite.server.demo;

import io.shardlite.server.runtime.Entity;
import io.shardlite.server.runtime.EntityContext;

import java.util.logging.Logger;

/**
 * Entity behind the HTTP API of the stock server: logs every text it receives
 * and counts them. The text "passivate" asks the shard to stop it.
 * <p>
 * The count lives in memory only, so it restarts at zero after passivation or
 * a move to another node.
 */
public final class LoggingEntity implements Entity {
    private static final Logger log = Logger.getLogger(LoggingEntity.class.getName());

    public static final String PASSIVATE = "passivate";

    private final EntityContext context;
    private long received;

    public LoggingEntity(EntityContext context) {
        this.context = context;
        log.fine(() -> "entity " + context.entityId() + " started in shard " + context.shardId()
                + " on " + context.regionId());
    }

    @Override
    public void onMessage(Object message) {
        received++;
        log.info(() -> "[" + context.regionId() + "/" + context.shardId() + "/" + context.entityId() + "] #"
                + received + ": " + message);
        if (PASSIVATE.equals(message)) {
            context.passivate();
        }
    }

    @Override
    public void postStop() {
        log.fine(() -> "entity " + context.entityId() + " stopped after " + received + " messages");
    }

    public long received() {
        return received;
    }
}
