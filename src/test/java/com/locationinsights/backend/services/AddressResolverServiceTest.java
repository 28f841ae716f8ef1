package com.locationinsights.backend.services;

import com.locationinsights.backend.exceptions.GeocodeFailureException;
import com.locationinsights.backend.integrations.GooglePlacesClient;
import com.locationinsights.backend.integrations.PlacesProviderException;
import com.locationinsights.backend.models.AddressSuggestion;
import com.locationinsights.backend.models.GeoPoint;
import com.locationinsights.backend.models.ResolvedAddress;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AddressResolverServiceTest {

    @Mock
    private GooglePlacesClient placesClient;

    @InjectMocks
    private AddressResolverService addressResolver;

    @Test
    void testSelectedSuggestionWinsOverText() {
        ResolvedAddress resolved = ResolvedAddress.builder().center(GeoPoint.of(1.0, 2.0)).build();
        when(placesClient.resolvePlace("place-123")).thenReturn(resolved);

        assertSame(resolved, addressResolver.resolve("ignored text", " place-123 "));
        verify(placesClient, never()).geocode(anyString());
    }

    @Test
    void testFallsBackToGeocoding() {
        ResolvedAddress resolved = ResolvedAddress.builder().center(GeoPoint.of(1.0, 2.0)).build();
        when(placesClient.geocode("Austin, TX")).thenReturn(resolved);

        assertSame(resolved, addressResolver.resolve("Austin, TX", null));
    }

    @Test
    void testGeocodeFailurePropagates() {
        when(placesClient.geocode("???")).thenThrow(new GeocodeFailureException("???", "ZERO_RESULTS", "no match"));

        assertThrows(GeocodeFailureException.class, () -> addressResolver.resolve("???", ""));
    }

    @Test
    void testSuggest_ShortInputSkipsProvider() {
        assertTrue(addressResolver.suggest("ab", 5).isEmpty());
        assertTrue(addressResolver.suggest(null, 5).isEmpty());
        verifyNoInteractions(placesClient);
    }

    @Test
    void testSuggest_LimitBoundedAndErrorsSwallowedToEmpty() throws Exception {
        List<AddressSuggestion> suggestions = List.of(new AddressSuggestion("Main St", "x"));
        when(placesClient.autocomplete("Main", 10)).thenReturn(suggestions);
        when(placesClient.autocomplete("Broken", 1)).thenThrow(new PlacesProviderException("REQUEST_DENIED"));

        assertEquals(suggestions, addressResolver.suggest(" Main ", 50));
        assertTrue(addressResolver.suggest("Broken", 0).isEmpty());
    }
}
