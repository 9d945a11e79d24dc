// file: server/src/main/java/io/shardlite/server/shard/EntityHandle.java
package io.shardlite.server.shard;

import io.shardlite.server.runtime.Entity;
import io.shardlite.server.runtime.EntityContext;
import io.shardlite.server.runtime.EntityFactory;
import io.shardlite.server.runtime.Mailbox;

import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One live entity instance with its own mailbox.
 * <p>
 * A stop is queued like any message, so everything told before it is handled
 * first. After the stop the handle is dead and the shard is notified.
 */
final class EntityHandle {
    private static final Logger log = Logger.getLogger(EntityHandle.class.getName());

    private static final Object STOP = new Object();

    private final String entityId;
    private final Mailbox<Object> mailbox;
    private final Entity entity;
    private final Consumer<EntityHandle> onTerminated;
    private volatile Object stopMessage;
    private long lastActivityMillis;

    EntityHandle(String shardId,
                 String regionId,
                 String entityId,
                 EntityFactory factory,
                 Executor executor,
                 Consumer<EntityHandle> onPassivate,
                 Consumer<EntityHandle> onTerminated,
                 long nowMillis) {
        this.entityId = entityId;
        this.onTerminated = onTerminated;
        this.lastActivityMillis = nowMillis;
        this.mailbox = new Mailbox<>("entity-" + shardId + "/" + entityId, executor, this::handle);
        EntityHandle self = this;
        this.entity = factory.create(entityId, new EntityContext() {
            @Override
            public String entityId() {
                return entityId;
            }

            @Override
            public String shardId() {
                return shardId;
            }

            @Override
            public String regionId() {
                return regionId;
            }

            @Override
            public void passivate() {
                onPassivate.accept(self);
            }
        });
    }

    String entityId() {
        return entityId;
    }

    /** Called from the owning shard only. */
    void tell(Object message, long nowMillis) {
        lastActivityMillis = nowMillis;
        mailbox.tell(message);
    }

    /** Called from the owning shard only. */
    long lastActivityMillis() {
        return lastActivityMillis;
    }

    /**
     * Queue a stop. {@code message}, if non-null, is delivered to the entity as its
     * last message before {@link Entity#postStop()}.
     */
    void stop(Object message) {
        stopMessage = message;
        mailbox.tell(STOP);
    }

    private void handle(Object message) {
        if (message == STOP) {
            Object last = stopMessage;
            if (last != null) {
                invoke(last);
            }
            try {
                entity.postStop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "entity " + entityId + " failed in postStop", e);
            }
            mailbox.close();
            onTerminated.accept(this);
            return;
        }
        invoke(message);
    }

    private void invoke(Object message) {
        try {
            entity.onMessage(message);
        } catch (RuntimeException e) {
            // resume: keep the instance and its state
            log.log(Level.WARNING, "entity " + entityId + " failed on " + message.getClass().getSimpleName()
                    + ", resuming", e);
        }
    }
}
