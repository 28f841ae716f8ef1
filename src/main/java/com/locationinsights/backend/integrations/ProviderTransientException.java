package com.locationinsights.backend.integrations;

/**
 * 5xx, timeout or provider UNKNOWN_ERROR. Retried by the gate with backoff.
 */
public class ProviderTransientException extends PlacesProviderException {

    public ProviderTransientException(String message) {
        super(message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
