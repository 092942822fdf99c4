package io.marketnode.storage;

/**
 * The remote store could not be reached, or did not answer in time.
 */
public class RemoteUnavailableException extends RuntimeException {

    public RemoteUnavailableException(String message) {
        super(message);
    }

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
