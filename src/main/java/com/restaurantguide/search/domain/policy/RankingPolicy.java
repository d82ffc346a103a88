package com.restaurantguide.search.domain.policy;

import com.restaurantguide.search.domain.model.SearchCursor;
import com.restaurantguide.search.domain.model.SubscriptionTier;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Composite relevance score used to order both list and map results.
 *
 * <pre>
 * score = 0.35 * distance + 0.40 * quality + 0.25 * subscription
 * </pre>
 *
 * Each component lies in [0, 1], so the score does too.
 * <ul>
 *   <li>distance: {@code max(0, 1 - d / reference)}; reference is the search radius
 *       for list view and the center-to-corner distance for map view</li>
 *   <li>quality: {@code 0.7 * rating / 5 + 0.3 * min(1, ln(1 + reviews) / ln(101))}.
 *       An establishment without reviews gets the neutral rating term 0.5.</li>
 *   <li>subscription: {@link SubscriptionTier#getRankingWeight()}</li>
 * </ul>
 *
 * The query layer evaluates the same formula in SQL; this class is the
 * single source of its constants.
 */
public final class RankingPolicy {

    public static final double DISTANCE_WEIGHT = 0.35;
    public static final double QUALITY_WEIGHT = 0.40;
    public static final double SUBSCRIPTION_WEIGHT = 0.25;

    public static final double RATING_SHARE = 0.7;
    public static final double VOLUME_SHARE = 0.3;
    public static final double MAX_RATING = 5.0;
    public static final double NEUTRAL_RATING_TERM = 0.5;
    /** Review count at which the volume term saturates. */
    public static final int REVIEW_VOLUME_SATURATION = 100;

    private RankingPolicy() {
    }

    public static double distanceComponent(double distanceMeters, double referenceMeters) {
        if (referenceMeters <= 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - distanceMeters / referenceMeters);
    }

    public static double qualityComponent(BigDecimal averageRating, int reviewCount) {
        double ratingTerm = (averageRating == null || reviewCount <= 0)
                ? NEUTRAL_RATING_TERM
                : averageRating.doubleValue() / MAX_RATING;
        double volumeTerm = Math.min(1.0,
                Math.log(1 + Math.max(0, reviewCount)) / Math.log(1 + REVIEW_VOLUME_SATURATION));
        return RATING_SHARE * ratingTerm + VOLUME_SHARE * volumeTerm;
    }

    public static double subscriptionComponent(SubscriptionTier tier) {
        return tier == null ? 0.0 : tier.getRankingWeight();
    }

    /**
     * Full score, rounded to the precision carried by cursors.
     */
    public static BigDecimal score(double distanceMeters, double referenceMeters,
            BigDecimal averageRating, int reviewCount, SubscriptionTier tier) {
        double raw = DISTANCE_WEIGHT * distanceComponent(distanceMeters, referenceMeters)
                + QUALITY_WEIGHT * qualityComponent(averageRating, reviewCount)
                + SUBSCRIPTION_WEIGHT * subscriptionComponent(tier);
        return BigDecimal.valueOf(raw).setScale(SearchCursor.SCORE_SCALE, RoundingMode.HALF_UP);
    }
}
