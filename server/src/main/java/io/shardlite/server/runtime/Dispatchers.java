// file: server/src/main/java/io/shardlite/server/runtime/Dispatchers.java
package io.shardlite.server.runtime;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Execution resources shared by every machine on a node.
 *
 * @param executor   drains mailboxes; must never block on I/O
 * @param ioExecutor runs blocking journal, store and network calls
 * @param scheduler  timers
 */
public record Dispatchers(Executor executor, Executor ioExecutor, Scheduler scheduler) {
    public Dispatchers {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(ioExecutor, "ioExecutor");
        Objects.requireNonNull(scheduler, "scheduler");
    }
}
