package com.locationinsights.backend.exceptions;

/**
 * The provider could not be reached: every discovery request of a run failed,
 * or address resolution failed after its retries were spent.
 */
public class ProviderUnavailableException extends RuntimeException {

    private final int failedUnits;

    public ProviderUnavailableException(String message, int failedUnits) {
        super(message);
        this.failedUnits = failedUnits;
    }

    public ProviderUnavailableException(String message, int failedUnits, Throwable cause) {
        super(message, cause);
        this.failedUnits = failedUnits;
    }

    public int getFailedUnits() {
        return failedUnits;
    }
}
