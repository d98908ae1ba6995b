// functions/poller/src/main/java/dev/devanks/aquascenic/poller/exception/PoolApiException.java
package dev.devanks.aquascenic.poller.exception;

import lombok.Getter;

/**
 * Raised when the pool document store answers with a non-success status, or its
 * response cannot be read. Recoverable: the next scheduled poll retries naturally.
 */
@Getter
public class PoolApiException extends RuntimeException {

    /**
     * HTTP status reported by the remote side, or {@code null} when no response was received.
     */
    private final Integer statusCode;

    public PoolApiException(String message) {
        this(message, (Integer) null);
    }

    public PoolApiException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PoolApiException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
