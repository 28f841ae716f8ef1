package com.locationinsights.backend.integrations;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationinsights.backend.config.GooglePlacesProperties;
import com.locationinsights.backend.exceptions.GeocodeFailureException;
import com.locationinsights.backend.exceptions.ProviderUnavailableException;
import com.locationinsights.backend.exceptions.QuotaExhaustedException;
import com.locationinsights.backend.models.AddressSuggestion;
import com.locationinsights.backend.models.GeoPoint;
import com.locationinsights.backend.models.ResolvedAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Google Maps Platform client (Geocoding, Autocomplete, Text Search, Nearby Search, Place Details).
 *
 * One instance is shared by every component that talks to Google; all calls go through
 * the {@link ProviderRequestGate} so pacing, retries and quota accounting are global.
 */
@Service
@Slf4j
public class GooglePlacesClient {

    private static final Set<String> SEARCH_OK = Set.of("OK", "ZERO_RESULTS");
    private static final Set<String> DETAILS_OK = Set.of("OK");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final GooglePlacesProperties properties;
    private final ProviderRequestGate gate;

    public GooglePlacesClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                              GooglePlacesProperties properties, ProviderRequestGate gate) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.gate = gate;
    }

    /**
     * Geocode free text into a center coordinate.
     *
     * @throws GeocodeFailureException      when there is no match or the response is malformed
     * @throws ProviderUnavailableException when the provider could not be reached after retries
     * @throws QuotaExhaustedException      when the provider quota or local budget is spent
     */
    public ResolvedAddress geocode(String address) {
        if (address == null || address.trim().isEmpty()) {
            throw new GeocodeFailureException(address, null, "Address is empty");
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getGeocodeUrl())
                .queryParam("address", address.trim())
                .queryParam("key", properties.getApiKey())
                .encode()
                .build()
                .toUri();

        JsonNode root;
        try {
            root = gate.execute("geocode", () -> {
                JsonNode json = getJson("geocode", uri);
                String status = json.path("status").asText();
                if ("UNKNOWN_ERROR".equals(status)) {
                    throw new ProviderTransientException("Geocode returned UNKNOWN_ERROR");
                }
                if ("OVER_QUERY_LIMIT".equals(status)) {
                    throw new ProviderQuotaExceededException("Geocode returned OVER_QUERY_LIMIT");
                }
                return json;
            }).body();
        } catch (ProviderQuotaExceededException e) {
            throw new QuotaExhaustedException("Quota exhausted while geocoding: " + e.getMessage(), e);
        } catch (ProviderTransientException e) {
            throw new ProviderUnavailableException("Geocoding unavailable: " + e.getMessage(), 1, e);
        } catch (PlacesProviderException e) {
            throw new GeocodeFailureException(address, null, "Geocoding request failed: " + e.getMessage(), e);
        }

        String status = root.path("status").asText("");
        if (!"OK".equals(status)) {
            throw new GeocodeFailureException(address, status, String.format(
                    "Geocode error: status=%s, msg=%s", status, root.path("error_message").asText(null)));
        }

        JsonNode first = root.path("results").path(0);
        GeoPoint center = parseLocation(first.path("geometry").path("location"));
        if (center == null) {
            throw new GeocodeFailureException(address, status, "Geocode response has no coordinate");
        }

        AddressComponents components = AddressComponents.parse(first.path("address_components"));
        log.info("Geocoded '{}' -> {} ({})", address, center.toParam(), first.path("formatted_address").asText(null));

        return ResolvedAddress.builder()
                .center(center)
                .formattedAddress(first.path("formatted_address").asText(address))
                .city(components.city())
                .state(components.state())
                .zip(components.zip())
                .country(components.country())
                .build();
    }

    /**
     * Autocomplete predictions for an address prefix (geocode types only).
     */
    public List<AddressSuggestion> autocomplete(String input, int limit) throws PlacesProviderException {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getAutocompleteUrl())
                .queryParam("input", input)
                .queryParam("types", "geocode")
                .queryParam("key", properties.getApiKey())
                .encode()
                .build()
                .toUri();

        JsonNode root = gate.execute("autocomplete", () -> {
            JsonNode json = getJson("autocomplete", uri);
            checkStatus("Autocomplete", json, SEARCH_OK);
            return json;
        }).body();

        List<AddressSuggestion> suggestions = new ArrayList<>();
        for (JsonNode prediction : root.path("predictions")) {
            if (suggestions.size() >= limit) {
                break;
            }
            suggestions.add(new AddressSuggestion(
                    prediction.path("description").asText(null),
                    prediction.path("place_id").asText(null)));
        }
        return suggestions;
    }

    /**
     * Resolve a selected autocomplete suggestion into a center coordinate.
     *
     * @throws GeocodeFailureException      when the place cannot be resolved
     * @throws ProviderUnavailableException when the provider could not be reached after retries
     * @throws QuotaExhaustedException      when the provider quota or local budget is spent
     */
    public ResolvedAddress resolvePlace(String placeId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getDetailsUrl())
                .queryParam("place_id", placeId)
                .queryParam("fields", "formatted_address,address_component,geometry")
                .queryParam("key", properties.getApiKey())
                .encode()
                .build()
                .toUri();

        JsonNode result;
        try {
            result = gate.execute("resolve_place", () -> {
                JsonNode json = getJson("resolve_place", uri);
                checkStatus("Place Details (resolve)", json, DETAILS_OK);
                return json.path("result");
            }).body();
        } catch (ProviderQuotaExceededException e) {
            throw new QuotaExhaustedException("Quota exhausted while resolving selection: " + e.getMessage(), e);
        } catch (ProviderTransientException e) {
            throw new ProviderUnavailableException("Selection lookup unavailable: " + e.getMessage(), 1, e);
        } catch (PlacesProviderException e) {
            throw new GeocodeFailureException(placeId, null, "Could not resolve selection: " + e.getMessage(), e);
        }

        GeoPoint center = parseLocation(result.path("geometry").path("location"));
        if (center == null) {
            throw new GeocodeFailureException(placeId, "OK", "Selected place has no coordinate");
        }
        AddressComponents components = AddressComponents.parse(result.path("address_components"));

        return ResolvedAddress.builder()
                .center(center)
                .formattedAddress(result.path("formatted_address").asText(null))
                .city(components.city())
                .state(components.state())
                .zip(components.zip())
                .country(components.country())
                .build();
    }

    /**
     * One page of a ranked Text Search, biased to {@code center}.
     */
    public ProviderResponse<PlacesPage> textSearch(String query, GeoPoint center, int radiusMeters, String pageToken)
            throws PlacesProviderException {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getTextSearchUrl())
                .queryParam("query", query)
                .queryParam("location", center.toParam())
                .queryParam("radius", radiusMeters)
                .queryParam("key", properties.getApiKey());
        if (pageToken != null) {
            builder.queryParam("pagetoken", pageToken);
        }
        URI uri = builder.encode().build().toUri();

        return gate.execute("text_search", () -> parsePage("Text Search", getJson("text_search", uri)));
    }

    /**
     * One page of a Nearby Search restricted to a single tile.
     */
    public ProviderResponse<PlacesPage> nearbySearch(GeoPoint center, int radiusMeters, String keyword, String pageToken)
            throws PlacesProviderException {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getNearbyUrl())
                .queryParam("location", center.toParam())
                .queryParam("radius", Math.min(radiusMeters, properties.getMaxNearbyRadiusMeters()))
                .queryParam("key", properties.getApiKey());
        if (keyword != null && !keyword.isBlank()) {
            builder.queryParam("keyword", keyword);
        }
        if (pageToken != null) {
            builder.queryParam("pagetoken", pageToken);
        }
        URI uri = builder.encode().build().toUri();

        return gate.execute("nearby_search", () -> parsePage("Nearby Search", getJson("nearby_search", uri)));
    }

    /**
     * Place Details: store address, coordinates, provider rating and the exposed recent reviews.
     */
    public ProviderResponse<PlaceDetails> placeDetails(String placeId) throws PlacesProviderException {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getDetailsUrl())
                .queryParam("place_id", placeId)
                .queryParam("fields", properties.getDetailsFields())
                .queryParam("key", properties.getApiKey())
                .encode()
                .build()
                .toUri();

        return gate.execute("place_details", () -> {
            JsonNode json = getJson("place_details", uri);
            checkStatus("Place Details for " + placeId, json, DETAILS_OK);
            return parseDetails(placeId, json.path("result"));
        });
    }

    private JsonNode getJson(String operation, URI uri) throws PlacesProviderException {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            if (response.getBody() == null) {
                throw new ProviderTransientException(operation + " returned an empty body");
            }
            return objectMapper.readTree(response.getBody());
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new ProviderQuotaExceededException(operation + " rejected with HTTP 429", e);
        } catch (HttpServerErrorException e) {
            throw new ProviderTransientException(
                    operation + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            throw new PlacesProviderException(
                    operation + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new ProviderTransientException(operation + " I/O failure: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new PlacesProviderException(operation + " returned malformed JSON", e);
        }
    }

    private void checkStatus(String operation, JsonNode root, Set<String> okStatuses) throws PlacesProviderException {
        String status = root.path("status").asText("");
        if (okStatuses.contains(status)) {
            return;
        }

        String detail = String.format("%s error: status=%s, msg=%s",
                operation, status, root.path("error_message").asText(null));
        switch (status) {
            case "OVER_QUERY_LIMIT":
                throw new ProviderQuotaExceededException(detail);
            case "UNKNOWN_ERROR":
                throw new ProviderTransientException(detail);
            default:
                throw new PlacesProviderException(detail);
        }
    }

    private PlacesPage parsePage(String operation, JsonNode root) throws PlacesProviderException {
        checkStatus(operation, root, SEARCH_OK);

        List<PlaceSummary> results = new ArrayList<>();
        for (JsonNode p : root.path("results")) {
            results.add(PlaceSummary.builder()
                    .placeId(p.path("place_id").asText(null))
                    .name(p.path("name").asText(null))
                    .vicinity(p.hasNonNull("vicinity")
                            ? p.get("vicinity").asText()
                            : p.path("formatted_address").asText(null))
                    .location(parseLocation(p.path("geometry").path("location")))
                    .types(parseTypes(p.path("types")))
                    .build());
        }

        String token = root.path("next_page_token").asText(null);
        return new PlacesPage(results, token);
    }

    private PlaceDetails parseDetails(String placeId, JsonNode result) {
        AddressComponents components = AddressComponents.parse(result.path("address_components"));

        List<ProviderReview> reviews = new ArrayList<>();
        for (JsonNode r : result.path("reviews")) {
            reviews.add(ProviderReview.builder()
                    .authorName(r.path("author_name").asText(null))
                    .rating(r.hasNonNull("rating") ? r.get("rating").asInt() : null)
                    .text(r.path("text").asText(null))
                    .time(r.hasNonNull("time") ? r.get("time").asLong() : null)
                    .relativeTimeDescription(r.path("relative_time_description").asText(null))
                    .build());
        }

        return PlaceDetails.builder()
                .placeId(result.path("place_id").asText(placeId))
                .name(result.path("name").asText(null))
                .formattedAddress(result.path("formatted_address").asText(null))
                .city(components.city())
                .state(components.state())
                .zip(components.zip())
                .country(components.country())
                .location(parseLocation(result.path("geometry").path("location")))
                .rating(result.hasNonNull("rating") ? result.get("rating").asDouble() : null)
                .userRatingsTotal(result.hasNonNull("user_ratings_total") ? result.get("user_ratings_total").asInt() : null)
                .types(parseTypes(result.path("types")))
                .reviews(reviews)
                .build();
    }

    private static GeoPoint parseLocation(JsonNode location) {
        if (!location.hasNonNull("lat") || !location.hasNonNull("lng")) {
            return null;
        }
        return GeoPoint.of(location.get("lat").asDouble(), location.get("lng").asDouble());
    }

    private static List<String> parseTypes(JsonNode types) {
        List<String> out = new ArrayList<>();
        types.forEach(type -> out.add(type.asText()));
        return out;
    }

    /**
     * City/state/ZIP/country extracted from Google's address_components.
     */
    record AddressComponents(String city, String state, String zip, String country) {

        static AddressComponents parse(JsonNode components) {
            String city = null;
            String state = null;
            String zip = null;
            String country = null;

            for (JsonNode c : components) {
                Set<String> types = new HashSet<>();
                c.path("types").forEach(t -> types.add(t.asText()));

                if (types.contains("locality")) {
                    city = c.path("long_name").asText(null);
                }
                if (types.contains("administrative_area_level_1")) {
                    state = c.path("short_name").asText(null);
                }
                if (types.contains("postal_code")) {
                    zip = c.path("long_name").asText(null);
                }
                if (types.contains("country")) {
                    country = c.path("short_name").asText(null);
                }
            }
            return new AddressComponents(city, state, zip, country);
        }
    }
}
