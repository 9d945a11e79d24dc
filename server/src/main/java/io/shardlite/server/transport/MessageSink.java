// file: server/src/main/java/io/shardlite/server/transport/MessageSink.java
package io.shardlite.server.transport;

/** Receiving side of a bound transport address. Must not block. */
@FunctionalInterface
public interface MessageSink {

    void deliver(String from, Object message);
}
