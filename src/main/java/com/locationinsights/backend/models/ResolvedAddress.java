package com.locationinsights.backend.models;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResolvedAddress {
    GeoPoint center;
    String formattedAddress;
    String city;
    String state;
    String zip;
    String country;
}
