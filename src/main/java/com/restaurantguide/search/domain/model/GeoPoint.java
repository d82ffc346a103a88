package com.restaurantguide.search.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing a WGS84 coordinate pair.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GeoPoint {

    private static final double EARTH_RADIUS_METERS = 6_371_008.8;

    private final double lat;
    private final double lng;

    public GeoPoint(double lat, double lng) {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (Double.isNaN(lng) || lng < -180 || lng > 180) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
        this.lat = lat;
        this.lng = lng;
    }

    /**
     * Great-circle distance on the mean-radius sphere (haversine).
     *
     * @param other target point
     * @return distance in meters
     */
    public double distanceTo(GeoPoint other) {
        double phi1 = Math.toRadians(lat);
        double phi2 = Math.toRadians(other.lat);
        double dPhi = Math.toRadians(other.lat - lat);
        double dLambda = Math.toRadians(other.lng - lng);

        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }
}
