package io.marketnode.storage.piece;

/**
 * The payload produced no pieces: it was empty or could not be read.
 */
public class EmptyPayloadException extends RuntimeException {

    public EmptyPayloadException(String message) {
        super(message);
    }

    public EmptyPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
