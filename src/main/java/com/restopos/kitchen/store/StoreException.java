package com.restopos.kitchen.store;

/**
 * Raised when the order storage can not complete an operation. Inside an admission pass it aborts and rolls back the
 * whole pass.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
