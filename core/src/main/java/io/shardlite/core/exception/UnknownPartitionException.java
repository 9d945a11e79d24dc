// file: core/src/main/java/io/shardlite/core/exception/UnknownPartitionException.java
package io.shardlite.core.exception;

/**
 * The partition functions returned no entity id or no shard id for a message.
 */
public class UnknownPartitionException extends ShardingException {

    public UnknownPartitionException(Object message) {
        super("no shard/entity id for message of type " + (message == null ? "null" : message.getClass().getName()));
    }
}
