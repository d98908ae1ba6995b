package dev.devanks.aquascenic.poller.exception;

public class DocumentCodecException extends RuntimeException {
    public DocumentCodecException(String message) {
        super(message);
    }

    public DocumentCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
