package com.restaurantguide.search.domain.model;

public enum PriceRange implements LabeledValue {
    BUDGET("$"),
    MODERATE("$$"),
    EXPENSIVE("$$$");

    private final String label;

    PriceRange(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }
}
