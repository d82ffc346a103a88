package com.restaurantguide.search.domain.model;

/**
 * Establishment categories accepted by the search filters.
 */
public enum Category implements LabeledValue {
    RESTAURANT("Ресторан"),
    COFFEE_SHOP("Кофейня"),
    FAST_FOOD("Фаст-фуд"),
    BAR("Бар"),
    CONFECTIONERY("Кондитерская"),
    PIZZERIA("Пиццерия"),
    BAKERY("Пекарня"),
    PUB("Паб"),
    CANTEEN("Столовая"),
    HOOKAH_LOUNGE("Кальянная"),
    BOWLING("Боулинг"),
    KARAOKE("Караоке"),
    BILLIARDS("Бильярд");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }
}
