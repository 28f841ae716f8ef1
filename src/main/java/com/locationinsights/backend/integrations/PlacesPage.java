package com.locationinsights.backend.integrations;

import lombok.Value;

import java.util.List;

@Value
public class PlacesPage {
    List<PlaceSummary> results;
    String nextPageToken;

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
