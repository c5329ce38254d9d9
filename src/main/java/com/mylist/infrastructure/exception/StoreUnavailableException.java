package com.mylist.infrastructure.exception;

/**
 * The durable store failed or timed out. Callers may retry.
 */
public class StoreUnavailableException extends BusinessException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super("STORE_UNAVAILABLE", "Durable store unavailable during " + operation, cause);
    }
}
