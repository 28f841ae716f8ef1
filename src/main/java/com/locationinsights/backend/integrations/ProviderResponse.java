package com.locationinsights.backend.integrations;

/**
 * Successful provider payload plus the number of retries it took to get it.
 */
public record ProviderResponse<T>(T body, int retryAttempts) {
}
