package com.restaurantguide.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Full public view of an establishment. Stored in the Redis cache, so every
 * field is a JSON-native type (opening hours travel as "HH:mm" strings).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EstablishmentDetailDto {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("city")
    private String city;

    @JsonProperty("address")
    private String address;

    @JsonProperty("lat")
    private BigDecimal lat;

    @JsonProperty("lng")
    private BigDecimal lng;

    @JsonProperty("categories")
    private List<String> categories;

    @JsonProperty("cuisines")
    private List<String> cuisines;

    @JsonProperty("features")
    private List<String> features;

    @JsonProperty("priceRange")
    private String priceRange;

    @JsonProperty("opensAt")
    private String opensAt;

    @JsonProperty("closesAt")
    private String closesAt;

    @JsonProperty("open24Hours")
    private boolean open24Hours;

    @JsonProperty("rating")
    private BigDecimal rating;

    @JsonProperty("reviewCount")
    private int reviewCount;

    @JsonProperty("subscriptionTier")
    private String subscriptionTier;

    @JsonProperty("primaryImageUrl")
    private String primaryImageUrl;
}
