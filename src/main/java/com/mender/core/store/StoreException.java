package com.mender.core.store;

/**
 * Raised when the backing store is unreachable or a record cannot be (de)serialized.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
