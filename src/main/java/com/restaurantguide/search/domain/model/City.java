package com.restaurantguide.search.domain.model;

/**
 * Cities the guide covers.
 */
public enum City implements LabeledValue {
    MINSK("Минск"),
    GRODNO("Гродно"),
    BREST("Брест"),
    GOMEL("Гомель"),
    VITEBSK("Витебск"),
    MOGILEV("Могилев"),
    BOBRUISK("Бобруйск");

    private final String label;

    City(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }
}
