package com.restaurantguide.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RankedEstablishmentDto {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("lat")
    private double lat;

    @JsonProperty("lng")
    private double lng;

    @JsonProperty("city")
    private String city;

    @JsonProperty("address")
    private String address;

    @JsonProperty("categories")
    private List<String> categories;

    @JsonProperty("cuisines")
    private List<String> cuisines;

    @JsonProperty("priceRange")
    private String priceRange;

    @JsonProperty("rating")
    private BigDecimal rating;

    @JsonProperty("reviewCount")
    private Integer reviewCount;

    @JsonProperty("subscriptionTier")
    private String subscriptionTier;

    @JsonProperty("primaryImageUrl")
    private String primaryImageUrl;

    @JsonProperty("distanceMeters")
    private long distanceMeters;

    @JsonProperty("score")
    private BigDecimal score;
}
