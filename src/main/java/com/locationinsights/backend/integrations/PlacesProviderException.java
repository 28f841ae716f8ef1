package com.locationinsights.backend.integrations;

/**
 * Provider call failed in a way retrying will not fix (denied key, invalid request, unexpected 4xx).
 */
public class PlacesProviderException extends Exception {

    public PlacesProviderException(String message) {
        super(message);
    }

    public PlacesProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
