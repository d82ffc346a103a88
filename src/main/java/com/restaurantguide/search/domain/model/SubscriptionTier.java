package com.restaurantguide.search.domain.model;

/**
 * Paid placement tier. The weight feeds the subscription component of the ranking score.
 */
public enum SubscriptionTier implements LabeledValue {
    FREE("free", 0.0),
    BASIC("basic", 0.4),
    STANDARD("standard", 0.7),
    PREMIUM("premium", 1.0);

    private final String label;
    private final double rankingWeight;

    SubscriptionTier(String label, double rankingWeight) {
        this.label = label;
        this.rankingWeight = rankingWeight;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public double getRankingWeight() {
        return rankingWeight;
    }
}
