package com.restaurantguide.search.domain.model;

/**
 * Operating-hours windows a user can filter by.
 * <ul>
 *   <li>{@code until_22}: still open at 22:00</li>
 *   <li>{@code until_morning}: closes after midnight</li>
 *   <li>{@code 24_hours}: never closes</li>
 * </ul>
 */
public enum HoursFilter implements LabeledValue {
    UNTIL_22("until_22"),
    UNTIL_MORNING("until_morning"),
    ALL_DAY("24_hours");

    private final String label;

    HoursFilter(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }
}
