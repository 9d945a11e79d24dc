// file: core/src/main/java/io/shardlite/core/exception/DeliveryFailedException.java
package io.shardlite.core.exception;

/**
 * The only failure visible to senders: a message could not be delivered after
 * the region exhausted its retry budget, or it overflowed the region's buffer.
 */
public class DeliveryFailedException extends ShardingException {

    private final String shardId;

    public DeliveryFailedException(String shardId, String message) {
        super(message);
        this.shardId = shardId;
    }

    public DeliveryFailedException(String shardId, String message, Throwable cause) {
        super(message, cause);
        this.shardId = shardId;
    }

    public String shardId() {
        return shardId;
    }
}
