package tech.grantwell.engine.error;

/**
 * Thrown by storage adapters when the backing store cannot complete an operation.
 * Always surfaces to callers as {@code server_error}, never as a protocol error.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
