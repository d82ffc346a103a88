package com.restaurantguide.search.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Read-only projection of an establishment with its computed ranking score.
 * Map view rows carry only identity, coordinates, rating and score; the
 * remaining fields are null there.
 */
@Getter
@Builder
@ToString
public class RankedResult {

    private final UUID id;
    private final String name;
    private final double lat;
    private final double lng;
    private final String city;
    private final String address;
    private final List<String> categories;
    private final List<String> cuisines;
    private final String priceRange;
    private final BigDecimal averageRating;
    private final Integer reviewCount;
    private final SubscriptionTier subscriptionTier;
    private final String primaryImageUrl;
    private final Double distanceMeters;
    private final BigDecimal score;

    public String primaryCategory() {
        return categories == null || categories.isEmpty() ? null : categories.get(0);
    }
}
