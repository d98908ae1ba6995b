package dev.devanks.aquascenic.poller.exception;

/**
 * Validation failure during pairing or repair. The message is shown to the user as is.
 */
public class PairingException extends RuntimeException {
    public PairingException(String message) {
        super(message);
    }
}
