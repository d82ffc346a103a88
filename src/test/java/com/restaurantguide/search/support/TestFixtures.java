package com.restaurantguide.search.support;

import com.restaurantguide.search.domain.model.City;
import com.restaurantguide.search.domain.model.Establishment;
import com.restaurantguide.search.domain.model.EstablishmentStatus;
import com.restaurantguide.search.domain.model.RankedResult;
import com.restaurantguide.search.domain.model.SubscriptionTier;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Test fixtures for creating test data.
 * Provides factory methods for common test scenarios.
 */
public class TestFixtures {

    private TestFixtures() {
        // Utility class
    }

    /**
     * An active establishment with no ranking signals.
     */
    public static Establishment establishment(String name, double lat, double lng) {
        Establishment establishment = new Establishment(
                name, City.MINSK, BigDecimal.valueOf(lat), BigDecimal.valueOf(lng));
        establishment.setStatus(EstablishmentStatus.ACTIVE);
        return establishment;
    }

    public static RankedResult rankedResult(String score) {
        return rankedResult(UUID.randomUUID(), score);
    }

    public static RankedResult rankedResult(UUID id, String score) {
        return RankedResult.builder()
                .id(id)
                .name("Establishment " + id.toString().substring(0, 8))
                .lat(Coordinates.MINSK_CENTER_LAT)
                .lng(Coordinates.MINSK_CENTER_LNG)
                .city(City.MINSK.getLabel())
                .categories(List.of("Ресторан"))
                .cuisines(List.of("Народная"))
                .priceRange("$$")
                .averageRating(new BigDecimal("4.50"))
                .reviewCount(10)
                .subscriptionTier(SubscriptionTier.FREE)
                .distanceMeters(250.4)
                .score(new BigDecimal(score))
                .build();
    }

    /**
     * Common test coordinates.
     */
    public static class Coordinates {
        public static final double MINSK_CENTER_LAT = 53.9;
        public static final double MINSK_CENTER_LNG = 27.5667;
        public static final double GRODNO_LAT = 53.6778;
        public static final double GRODNO_LNG = 23.8295;
    }

    /**
     * Common test data.
     */
    public static class Common {
        public static final String CURSOR_SECRET = "test-cursor-secret";
    }
}
