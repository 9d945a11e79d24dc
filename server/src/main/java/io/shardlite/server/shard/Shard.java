// file: server/src/main/java/io/shardlite/server/shard/Shard.java
package io.shardlite.server.shard;

import io.shardlite.core.ShardingMessage;
import io.shardlite.server.config.ShardingSettings;
import io.shardlite.server.runtime.Cancellable;
import io.shardlite.server.runtime.Dispatchers;
import io.shardlite.server.runtime.EntityFactory;
import io.shardlite.server.runtime.Mailbox;
import io.shardlite.storage.RememberEntitiesStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host of the entities of one shard on one region.
 * <p>
 * Lifecycle: STARTING -> RUNNING -> HANDING_OFF -> STOPPED.
 * <p>
 * Responsibilities:
 *  - STARTING: load remembered entity ids (if a store is configured), recreate
 *    them, then report RUNNING. Messages arriving meanwhile are buffered.
 *  - RUNNING: route each message to its entity, creating it on first use. With
 *    a store, a new id is recorded durably before its first message is delivered.
 *  - Passivation: idle entities (or ones that ask) are stopped; messages for them
 *    are held and replayed to a fresh instance once the old one has stopped.
 *  - HANDING_OFF: no new activations, incoming messages go back to the region,
 *    every entity is stopped; after they all stopped (or shardHandOffTimeout)
 *    the region is told the shard stopped.
 * <p>
 * All state is confined to the shard's mailbox. Store calls run on a serial
 * queue over the io executor so their order matches the order of decisions.
 */
public final class Shard {
    private static final Logger log = Logger.getLogger(Shard.class.getName());

    /** Callbacks into the owning region. Implementations must only enqueue. */
    public interface Parent {

        void shardStarted(String shardId);

        void shardStopped(String shardId);

        /** A message the shard will not deliver; the region must route it again. */
        void returnToRegion(String shardId, ShardingMessage message);
    }

    public enum State { STARTING, RUNNING, HANDING_OFF, STOPPED }

    private final String shardId;
    private final String regionId;
    private final EntityFactory factory;
    private final ShardingSettings settings;
    private final RememberEntitiesStore store;
    private final Object stopMessage;
    private final Dispatchers dispatchers;
    private final Parent parent;
    private final Mailbox<Object> mailbox;
    private final Mailbox<Runnable> io;

    private State state = State.STARTING;
    private final Map<String, EntityHandle> entities = new HashMap<>();
    private final Map<String, List<ShardingMessage>> passivating = new HashMap<>();
    private final Map<String, List<ShardingMessage>> awaitingRemember = new LinkedHashMap<>();
    private final List<ShardingMessage> startupBuffer = new ArrayList<>();
    private Cancellable idleTick = Cancellable.NONE;
    private Cancellable handOffTimer = Cancellable.NONE;

    /**
     * @param store       remember-entities store, or null when entities are not remembered
     * @param stopMessage delivered to an entity before it stops, or null
     */
    public Shard(String shardId,
                 String regionId,
                 EntityFactory factory,
                 ShardingSettings settings,
                 RememberEntitiesStore store,
                 Object stopMessage,
                 Dispatchers dispatchers,
                 Parent parent) {
        this.shardId = Objects.requireNonNull(shardId, "shardId");
        this.regionId = Objects.requireNonNull(regionId, "regionId");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.store = store;
        this.stopMessage = stopMessage;
        this.dispatchers = Objects.requireNonNull(dispatchers, "dispatchers");
        this.parent = Objects.requireNonNull(parent, "parent");
        this.mailbox = new Mailbox<>("shard-" + shardId, dispatchers.executor(), this::receive);
        this.io = new Mailbox<>("shard-" + shardId + "-io", dispatchers.ioExecutor(), Runnable::run);
    }

    // ---------- public API (thread-safe, asynchronous) ----------

    public void start() {
        mailbox.tell(new Start());
    }

    public void deliver(ShardingMessage message) {
        mailbox.tell(message);
    }

    public void handOff() {
        mailbox.tell(new HandOff());
    }

    /** Ids of the live entities, sorted. */
    public CompletableFuture<Set<String>> entityIds() {
        CompletableFuture<Set<String>> f = new CompletableFuture<>();
        if (!mailbox.tell(new GetEntityIds(f))) {
            f.complete(Set.of());
        }
        return f;
    }

    public String shardId() {
        return shardId;
    }

    // ---------- internal protocol ----------

    private record Start() {
    }

    private record HandOff() {
    }

    private record GetEntityIds(CompletableFuture<Set<String>> reply) {
    }

    private record RememberedLoaded(Set<String> entityIds) {
    }

    private record Remembered(String entityId) {
    }

    private record Passivate(EntityHandle handle) {
    }

    private record Terminated(EntityHandle handle) {
    }

    private record IdleTick() {
    }

    private record HandOffTimeout() {
    }

    private void receive(Object msg) {
        if (msg instanceof GetEntityIds q) {
            q.reply().complete(new TreeSet<>(entities.keySet()));
        } else if (msg instanceof Start) {
            onStart();
        } else if (msg instanceof RememberedLoaded m) {
            onRememberedLoaded(m.entityIds());
        } else if (msg instanceof ShardingMessage m) {
            onMessage(m);
        } else if (msg instanceof Remembered m) {
            onRemembered(m.entityId());
        } else if (msg instanceof Passivate m) {
            passivate(m.handle());
        } else if (msg instanceof Terminated m) {
            onTerminated(m.handle());
        } else if (msg instanceof IdleTick) {
            passivateIdleEntities();
        } else if (msg instanceof HandOff) {
            onHandOff();
        } else if (msg instanceof HandOffTimeout) {
            if (state == State.HANDING_OFF) {
                log.warning(() -> "shard " + shardId + ": " + entities.size()
                        + " entities did not stop within " + settings.shardHandOffTimeout() + ", stopping anyway");
                finishHandOff();
            }
        } else {
            log.warning(() -> "shard " + shardId + ": unexpected message " + msg.getClass().getName());
        }
    }

    // ---------- STARTING ----------

    private void onStart() {
        if (state != State.STARTING) return;
        if (store == null) {
            becomeRunning(Set.of());
            return;
        }
        io.tell(() -> {
            Set<String> ids;
            try {
                ids = store.load(shardId);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "shard " + shardId + ": cannot load remembered entities, starting empty", e);
                ids = Set.of();
            }
            mailbox.tell(new RememberedLoaded(ids));
        });
    }

    private void onRememberedLoaded(Set<String> ids) {
        if (state != State.STARTING) return;
        becomeRunning(ids);
    }

    private void becomeRunning(Set<String> remembered) {
        long now = dispatchers.scheduler().currentTimeMillis();
        for (String id : new TreeSet<>(remembered)) {
            entities.put(id, newHandle(id, now));
        }
        state = State.RUNNING;
        if (!remembered.isEmpty()) {
            log.info(() -> "shard " + shardId + " recreated " + remembered.size() + " remembered entities");
        }
        log.fine(() -> "shard " + shardId + " running on " + regionId);
        parent.shardStarted(shardId);

        if (settings.passivationEnabled()) {
            var period = settings.passivateIdleAfter().dividedBy(2);
            idleTick = dispatchers.scheduler().scheduleAtFixedRate(period, period, () -> mailbox.tell(new IdleTick()));
        }

        List<ShardingMessage> buffered = new ArrayList<>(startupBuffer);
        startupBuffer.clear();
        buffered.forEach(this::onMessage);
    }

    // ---------- RUNNING ----------

    private void onMessage(ShardingMessage m) {
        switch (state) {
            case STARTING:
                startupBuffer.add(m);
                return;
            case HANDING_OFF:
            case STOPPED:
                parent.returnToRegion(shardId, m);
                return;
            default:
                break;
        }

        String entityId;
        if (m instanceof ShardingMessage.EntityDelivery d) {
            entityId = d.entityId();
        } else if (m instanceof ShardingMessage.EntityStart st) {
            entityId = st.entityId();
        } else {
            log.warning(() -> "shard " + shardId + ": unroutable message reached the shard, dropping " + m);
            return;
        }
        route(entityId, m);
    }

    private void route(String entityId, ShardingMessage m) {
        List<ShardingMessage> held = passivating.get(entityId);
        if (held == null) {
            held = awaitingRemember.get(entityId);
        }
        if (held != null) {
            held.add(m);
            return;
        }

        long now = dispatchers.scheduler().currentTimeMillis();
        EntityHandle handle = entities.get(entityId);
        if (handle != null) {
            tellEntity(handle, m, now);
            return;
        }

        if (store == null) {
            handle = newHandle(entityId, now);
            entities.put(entityId, handle);
            tellEntity(handle, m, now);
            return;
        }

        List<ShardingMessage> pending = new ArrayList<>();
        pending.add(m);
        awaitingRemember.put(entityId, pending);
        io.tell(() -> {
            try {
                store.update(shardId, Set.of(entityId), Set.of());
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "shard " + shardId + ": could not remember entity " + entityId
                        + ", delivering anyway", e);
            }
            mailbox.tell(new Remembered(entityId));
        });
    }

    private void onRemembered(String entityId) {
        List<ShardingMessage> pending = awaitingRemember.remove(entityId);
        if (pending == null || state != State.RUNNING) {
            return;
        }
        long now = dispatchers.scheduler().currentTimeMillis();
        EntityHandle handle = newHandle(entityId, now);
        entities.put(entityId, handle);
        for (ShardingMessage p : pending) {
            tellEntity(handle, p, now);
        }
    }

    private static void tellEntity(EntityHandle handle, ShardingMessage m, long now) {
        if (m instanceof ShardingMessage.EntityDelivery d) {
            handle.tell(d.message(), now);
        }
    }

    // ---------- passivation ----------

    private void passivateIdleEntities() {
        if (state != State.RUNNING) return;
        long now = dispatchers.scheduler().currentTimeMillis();
        long idleMillis = settings.passivateIdleAfter().toMillis();
        for (EntityHandle h : new ArrayList<>(entities.values())) {
            if (now - h.lastActivityMillis() >= idleMillis) {
                log.fine(() -> "shard " + shardId + ": passivating idle entity " + h.entityId());
                passivate(h);
            }
        }
    }

    private void passivate(EntityHandle handle) {
        if (state != State.RUNNING) return;
        String id = handle.entityId();
        if (entities.get(id) != handle || passivating.containsKey(id)) {
            return;
        }
        passivating.put(id, new ArrayList<>());
        handle.stop(stopMessage);
    }

    private void onTerminated(EntityHandle handle) {
        String id = handle.entityId();
        if (entities.get(id) != handle) {
            return;
        }
        entities.remove(id);
        List<ShardingMessage> held = passivating.remove(id);

        if (state == State.HANDING_OFF) {
            if (entities.isEmpty()) {
                finishHandOff();
            }
            return;
        }
        if (state != State.RUNNING || held == null) {
            return;
        }

        if (!held.isEmpty()) {
            // messages arrived while stopping: bring the entity back for them
            long now = dispatchers.scheduler().currentTimeMillis();
            EntityHandle fresh = newHandle(id, now);
            entities.put(id, fresh);
            for (ShardingMessage p : held) {
                tellEntity(fresh, p, now);
            }
        } else if (store != null) {
            io.tell(() -> {
                try {
                    store.update(shardId, Set.of(), Set.of(id));
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "shard " + shardId + ": could not forget passivated entity " + id, e);
                }
            });
        }
    }

    // ---------- HANDING_OFF ----------

    private void onHandOff() {
        if (state == State.HANDING_OFF || state == State.STOPPED) return;
        log.info(() -> "shard " + shardId + " handing off, stopping " + entities.size() + " entities");
        state = State.HANDING_OFF;
        idleTick.cancel();

        for (ShardingMessage m : startupBuffer) {
            parent.returnToRegion(shardId, m);
        }
        startupBuffer.clear();
        returnHeld(awaitingRemember);
        returnHeld(passivating);

        if (entities.isEmpty()) {
            finishHandOff();
            return;
        }
        for (EntityHandle h : entities.values()) {
            h.stop(stopMessage);
        }
        handOffTimer = dispatchers.scheduler().schedule(settings.shardHandOffTimeout(),
                () -> mailbox.tell(new HandOffTimeout()));
    }

    /** Held messages were never delivered; the region routes them again. */
    private void returnHeld(Map<String, List<ShardingMessage>> held) {
        for (List<ShardingMessage> messages : held.values()) {
            for (ShardingMessage m : messages) {
                parent.returnToRegion(shardId, m);
            }
        }
        held.clear();
    }

    private void finishHandOff() {
        handOffTimer.cancel();
        state = State.STOPPED;
        entities.clear();
        passivating.clear();
        mailbox.close();
        log.info(() -> "shard " + shardId + " stopped on " + regionId);
        parent.shardStopped(shardId);
    }

    private EntityHandle newHandle(String entityId, long now) {
        return new EntityHandle(shardId, regionId, entityId, factory, dispatchers.executor(),
                h -> mailbox.tell(new Passivate(h)),
                h -> mailbox.tell(new Terminated(h)),
                now);
    }
}
