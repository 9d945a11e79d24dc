// file: server/src/test/java/io/shardlite/server/testkit/RecordingEntity.java
package io.shardlite.server.testkit;

import io.shardlite.server.runtime.Entity;
import io.shardlite.server.runtime.EntityContext;
import io.shardlite.server.runtime.EntityFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entity that records what it sees into a shared {@link Log}.
 * Messages: "passivate" asks for passivation, "boom" throws.
 */
public final class RecordingEntity implements Entity {

    /** Thread-safe event log shared by all instances of one factory. */
    public static final class Log {
        private final List<String> events = Collections.synchronizedList(new ArrayList<>());

        void add(String event) {
            events.add(event);
        }

        public List<String> events() {
            synchronized (events) {
                return List.copyOf(events);
            }
        }

        /** Events of one entity, e.g. "start@r1", "msg:hello", "stop". */
        public List<String> of(String entityId) {
            String prefix = entityId + " ";
            List<String> out = new ArrayList<>();
            for (String e : events()) {
                if (e.startsWith(prefix)) out.add(e.substring(prefix.length()));
            }
            return out;
        }

        public long count(String event) {
            return events().stream().filter(event::equals).count();
        }
    }

    private final EntityContext ctx;
    private final Log log;

    private RecordingEntity(EntityContext ctx, Log log) {
        this.ctx = ctx;
        this.log = log;
        log.add(ctx.entityId() + " start@" + ctx.regionId());
    }

    public static EntityFactory factory(Log log) {
        return (entityId, ctx) -> new RecordingEntity(ctx, log);
    }

    @Override
    public void onMessage(Object message) {
        if ("boom".equals(message)) {
            throw new IllegalStateException("boom");
        }
        log.add(ctx.entityId() + " msg:" + message);
        if ("passivate".equals(message)) {
            ctx.passivate();
        }
    }

    @Override
    public void postStop() {
        log.add(ctx.entityId() + " stop");
    }
}
