// file: server/src/main/java/io/shardlite/server/runtime/Cancellable.java
package io.shardlite.server.runtime;

/** Handle to a scheduled task. Cancelling twice, or after the task ran, is harmless. */
@FunctionalInterface
public interface Cancellable {

    Cancellable NONE = () -> { };

    void cancel();
}
