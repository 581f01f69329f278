package com.echelon.kernel.store;

/**
 * Thrown by a {@link KernelStore} when the backend is transiently unavailable.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
