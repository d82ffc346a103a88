package com.restaurantguide.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Compact map pin: just enough to place and label a marker.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class MapMarkerDto {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("lat")
    private double lat;

    @JsonProperty("lng")
    private double lng;

    @JsonProperty("category")
    private String category;

    @JsonProperty("rating")
    private BigDecimal rating;

    @JsonProperty("score")
    private BigDecimal score;
}
