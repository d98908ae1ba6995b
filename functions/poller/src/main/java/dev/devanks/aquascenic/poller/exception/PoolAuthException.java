// functions/poller/src/main/java/dev/devanks/aquascenic/poller/exception/PoolAuthException.java
package dev.devanks.aquascenic.poller.exception;

/**
 * Credentials rejected, refresh token revoked, or the identity provider unreachable while
 * signing in. The device needs new credentials before polling can resume.
 */
public class PoolAuthException extends PoolApiException {

    public PoolAuthException(String message) {
        super(message);
    }

    public PoolAuthException(String message, Integer statusCode) {
        super(message, statusCode);
    }

    public PoolAuthException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
