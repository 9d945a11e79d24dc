// file: storage/src/main/java/io/shardlite/storage/EventCodec.java
package io.shardlite.storage;

/**
 * Converts journal events to and from bytes.
 */
public interface EventCodec<E> {

    byte[] encode(E event);

    E decode(byte[] bytes);
}
