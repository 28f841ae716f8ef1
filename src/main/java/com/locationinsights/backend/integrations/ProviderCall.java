package com.locationinsights.backend.integrations;

@FunctionalInterface
public interface ProviderCall<T> {
    T call() throws PlacesProviderException;
}
