package com.locationinsights.backend.exceptions;

/**
 * The run address could not be resolved to a coordinate. Fatal to the run; no partial output exists.
 */
public class GeocodeFailureException extends RuntimeException {

    private final String address;
    private final String providerStatus;

    public GeocodeFailureException(String address, String providerStatus, String message) {
        super(message);
        this.address = address;
        this.providerStatus = providerStatus;
    }

    public GeocodeFailureException(String address, String providerStatus, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
        this.providerStatus = providerStatus;
    }

    public String getAddress() {
        return address;
    }

    public String getProviderStatus() {
        return providerStatus;
    }
}
