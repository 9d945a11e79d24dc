// file: core/src/main/java/io/shardlite/core/exception/TransportException.java
package io.shardlite.core.exception;

/**
 * A point-to-point send failed: unknown address, peer down, RPC error.
 * Transient; callers re-resolve and retry.
 */
public class TransportException extends ShardingException {

    private final String address;

    public TransportException(String address, String message) {
        super(message);
        this.address = address;
    }

    public TransportException(String address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    public String address() {
        return address;
    }
}
