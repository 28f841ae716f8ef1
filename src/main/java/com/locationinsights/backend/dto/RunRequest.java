package com.locationinsights.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.locationinsights.backend.models.SearchStrategy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters of one insights run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    @NotBlank(message = "Address is required")
    private String address;

    /**
     * Optional: place id of a selected address suggestion. Wins over the address text.
     */
    private String placeId;

    @NotNull(message = "Radius is required")
    @Positive(message = "Radius must be greater than zero")
    @DecimalMax(value = "200", message = "Radius must be at most 200 miles")
    private Double radiusMiles;

    @NotNull(message = "Strategy is required")
    private SearchStrategy strategy;

    private String keyword;

    @JsonIgnore
    @AssertTrue(message = "Keyword is required for brand search")
    public boolean isKeywordPresentForBrandSearch() {
        return strategy != SearchStrategy.BRAND_SEARCH || (keyword != null && !keyword.isBlank());
    }
}
