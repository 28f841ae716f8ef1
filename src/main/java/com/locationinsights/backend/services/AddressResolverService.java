package com.locationinsights.backend.services;

import com.locationinsights.backend.integrations.GooglePlacesClient;
import com.locationinsights.backend.integrations.PlacesProviderException;
import com.locationinsights.backend.models.AddressSuggestion;
import com.locationinsights.backend.models.ResolvedAddress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns user input into a search center.
 * A selected autocomplete suggestion wins over the free-text address.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AddressResolverService {

    static final int MIN_SUGGESTION_INPUT = 3;
    static final int MAX_SUGGESTIONS = 10;

    private final GooglePlacesClient placesClient;

    /**
     * Resolve the run center. Throws {@link com.locationinsights.backend.exceptions.GeocodeFailureException}
     * when neither the place id nor the address text can be resolved.
     */
    public ResolvedAddress resolve(String addressText, String placeId) {
        if (placeId != null && !placeId.isBlank()) {
            log.info("Resolving selected suggestion {}", placeId);
            return placesClient.resolvePlace(placeId.trim());
        }
        log.info("Geocoding address '{}'", addressText);
        return placesClient.geocode(addressText);
    }

    /**
     * Autocomplete predictions for partial input. Short input and provider errors yield no suggestions.
     */
    public List<AddressSuggestion> suggest(String input, int limit) {
        if (input == null || input.trim().length() < MIN_SUGGESTION_INPUT) {
            return List.of();
        }
        int boundedLimit = Math.max(1, Math.min(limit, MAX_SUGGESTIONS));
        try {
            return placesClient.autocomplete(input.trim(), boundedLimit);
        } catch (PlacesProviderException e) {
            log.warn("Address autocomplete failed for '{}': {}", input, e.getMessage());
            return List.of();
        }
    }
}
