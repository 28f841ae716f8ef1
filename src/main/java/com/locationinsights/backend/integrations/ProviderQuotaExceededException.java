package com.locationinsights.backend.integrations;

/**
 * Provider quota (or the local request budget) is spent. Never retried: the run stops issuing requests.
 */
public class ProviderQuotaExceededException extends PlacesProviderException {

    public ProviderQuotaExceededException(String message) {
        super(message);
    }

    public ProviderQuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
