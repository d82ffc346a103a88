package com.restaurantguide.search.domain.model;

public enum Cuisine implements LabeledValue {
    NATIONAL("Народная"),
    AUTHOR("Авторская"),
    ASIAN("Азиатская"),
    AMERICAN("Американская"),
    VEGETARIAN("Вегетарианская"),
    JAPANESE("Японская"),
    GEORGIAN("Грузинская"),
    ITALIAN("Итальянская"),
    MIXED("Смешанная"),
    CONTINENTAL("Континентальная");

    private final String label;

    Cuisine(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }
}
