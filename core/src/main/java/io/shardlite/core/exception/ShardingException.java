// file: core/src/main/java/io/shardlite/core/exception/ShardingException.java
package io.shardlite.core.exception;

/**
 * Root of the sharding error taxonomy. All sharding errors are unchecked.
 */
public class ShardingException extends RuntimeException {

    public ShardingException(String message) {
        super(message);
    }

    public ShardingException(String message, Throwable cause) {
        super(message, cause);
    }
}
