package com.locationinsights.backend.exceptions;

/**
 * The provider quota or the local daily request budget was spent before the run could start.
 */
public class QuotaExhaustedException extends RuntimeException {

    public QuotaExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
