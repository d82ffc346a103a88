package com.restaurantguide.search.domain.model;

/**
 * Amenity flags. An establishment matches a feature filter only when it has
 * every requested feature.
 */
public enum Feature implements LabeledValue {
    DELIVERY("delivery"),
    WIFI("wifi"),
    BANQUET("banquet"),
    TERRACE("terrace"),
    SMOKING_AREA("smoking_area"),
    KIDS_ZONE("kids_zone"),
    PET_FRIENDLY("pet_friendly"),
    PARKING("parking");

    private final String label;

    Feature(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }
}
