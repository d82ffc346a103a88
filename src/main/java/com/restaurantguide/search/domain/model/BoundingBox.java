package com.restaurantguide.search.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Latitude/longitude envelope for map view searches.
 * West and east are stored normalized so that {@code west <= east}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class BoundingBox {

    private final double north;
    private final double south;
    private final double east;
    private final double west;

    public BoundingBox(double north, double south, double east, double west) {
        if (north <= south) {
            throw new IllegalArgumentException("North boundary must be greater than south boundary");
        }
        if (north > 90 || south < -90) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (Math.abs(east) > 180 || Math.abs(west) > 180) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
        this.north = north;
        this.south = south;
        this.east = Math.max(east, west);
        this.west = Math.min(east, west);
    }

    public GeoPoint center() {
        return new GeoPoint((north + south) / 2, (east + west) / 2);
    }

    /**
     * Distance from the center to the farthest corner, which bounds every point inside the box.
     * The corners nearer the equator are the farther ones, since a degree of longitude is longer there.
     */
    public double halfDiagonalMeters() {
        GeoPoint center = center();
        double northern = Math.max(
                center.distanceTo(new GeoPoint(north, east)), center.distanceTo(new GeoPoint(north, west)));
        double southern = Math.max(
                center.distanceTo(new GeoPoint(south, east)), center.distanceTo(new GeoPoint(south, west)));
        return Math.max(northern, southern);
    }

    public boolean contains(double lat, double lng) {
        return lat >= south && lat <= north && lng >= west && lng <= east;
    }
}
