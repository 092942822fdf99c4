package io.marketnode.catalog.index;

/**
 * The local index could not be queried. No catalog can be built without it.
 */
public class IndexUnavailableException extends RuntimeException {

    public IndexUnavailableException(String message) {
        super(message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
