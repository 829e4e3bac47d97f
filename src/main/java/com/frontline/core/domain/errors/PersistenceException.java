package com.frontline.core.domain.errors;

/**
 * A storage write did not complete. Callers keep the data and retry on the next cycle.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
