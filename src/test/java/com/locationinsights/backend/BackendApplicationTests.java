package com.locationinsights.backend;

import com.locationinsights.backend.config.GooglePlacesProperties;
import com.locationinsights.backend.services.InsightsPipelineService;
import com.locationinsights.backend.services.discovery.DiscoveryStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "google.places.api-key=test-api-key")
class BackendApplicationTests {

    @Autowired
    private InsightsPipelineService pipelineService;

    @Autowired
    private List<DiscoveryStrategy> strategies;

    @Autowired
    private GooglePlacesProperties placesProperties;

    @Test
    void contextLoads() {
        assertNotNull(pipelineService);
        assertEquals(2, strategies.size());
        assertEquals("test-api-key", placesProperties.getApiKey());
        assertEquals(40_000, placesProperties.getMaxTileRadiusMeters(), 1e-9);
    }
}
