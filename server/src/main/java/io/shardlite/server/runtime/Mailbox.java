// file: server/src/main/java/io/shardlite/server/runtime/Mailbox.java
package io.shardlite.server.runtime;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-consumer message queue drained on a shared executor.
 * <p>
 * Contract:
 *  - The handler sees one message at a time, in enqueue order, never
 *    concurrently with itself.
 *  - tell() never blocks and never runs the handler re-entrantly: a message
 *    told from inside the handler is queued behind the current one.
 *  - A RuntimeException from the handler is logged and the next message is
 *    processed.
 *  - After close(), queued and future messages are discarded.
 */
public final class Mailbox<M> {
    private static final Logger log = Logger.getLogger(Mailbox.class.getName());
    private static final int THROUGHPUT = 64;

    private final String name;
    private final Executor executor;
    private final Consumer<M> handler;
    private final Queue<M> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();
    private volatile boolean closed;

    public Mailbox(String name, Executor executor, Consumer<M> handler) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * @return false if the mailbox is closed and the message was discarded
     */
    public boolean tell(M message) {
        Objects.requireNonNull(message, "message");
        if (closed) {
            log.fine(() -> name + ": discarding " + message.getClass().getSimpleName() + " after close");
            return false;
        }
        queue.add(message);
        trySchedule();
        return true;
    }

    public void close() {
        closed = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    public String name() {
        return name;
    }

    private void trySchedule() {
        if (!queue.isEmpty() && scheduled.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            for (int i = 0; i < THROUGHPUT && !closed; i++) {
                M next = queue.poll();
                if (next == null) break;
                try {
                    handler.accept(next);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, name + ": handler failed on " + next.getClass().getSimpleName(), e);
                }
            }
        } finally {
            scheduled.set(false);
        }
        if (!closed) {
            trySchedule();
        }
    }
}
