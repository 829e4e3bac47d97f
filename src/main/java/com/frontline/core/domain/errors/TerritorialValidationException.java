package com.frontline.core.domain.errors;

/**
 * Rejected input at a boundary API: unknown ids, malformed actions.
 * Always thrown before any state is touched.
 */
public class TerritorialValidationException extends RuntimeException {

    public TerritorialValidationException(String message) {
        super(message);
    }

    public TerritorialValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
