package com.restaurantguide.search.domain.model;

import com.restaurantguide.search.domain.policy.RankingPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BoundingBoxTest {

    @Test
    void testConstructor_EastWestSwapped_NormalizesOrder() {
        BoundingBox box = new BoundingBox(54.0, 53.8, 27.4, 27.7);

        assertThat(box.getWest()).isEqualTo(27.4);
        assertThat(box.getEast()).isEqualTo(27.7);
    }

    @Test
    void testConstructor_NorthNotAboveSouth_Throws() {
        assertThatThrownBy(() -> new BoundingBox(53.9, 53.9, 27.7, 27.4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("North boundary must be greater than south boundary");
    }

    @Test
    void testConstructor_LongitudeOutOfRange_Throws() {
        assertThatThrownBy(() -> new BoundingBox(54.0, 53.8, 181.0, 27.4))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCenter_ReturnsMidpoint() {
        BoundingBox box = new BoundingBox(54.0, 53.8, 27.7, 27.4);

        GeoPoint center = box.center();

        assertThat(center.getLat()).isCloseTo(53.9, within(1e-9));
        assertThat(center.getLng()).isCloseTo(27.55, within(1e-9));
    }

    @Test
    void testHalfDiagonal_IsFarthestPointFromCenter() {
        BoundingBox box = new BoundingBox(54.0, 53.8, 27.7, 27.4);
        double halfDiagonal = box.halfDiagonalMeters();

        assertThat(box.center().distanceTo(new GeoPoint(53.8, 27.7))).isCloseTo(halfDiagonal, within(1e-6));
        assertThat(box.center().distanceTo(new GeoPoint(54.0, 27.7))).isLessThanOrEqualTo(halfDiagonal);
        assertThat(box.center().distanceTo(new GeoPoint(53.9, 27.7))).isLessThan(halfDiagonal);
        // ~11.1 km south and ~9.8 km east of the center at 53.9N
        assertThat(halfDiagonal).isBetween(14_000.0, 15_500.0);
    }

    @Test
    void testHalfDiagonal_TallBox_CoversSouthernCorners() {
        BoundingBox box = new BoundingBox(60.0, 50.0, 10.0, 0.0);
        GeoPoint center = box.center();
        double halfDiagonal = box.halfDiagonalMeters();

        double toNorthEast = center.distanceTo(new GeoPoint(60.0, 10.0));
        double toSouthEast = center.distanceTo(new GeoPoint(50.0, 10.0));
        double toSouthWest = center.distanceTo(new GeoPoint(50.0, 0.0));

        assertThat(toSouthEast).isGreaterThan(toNorthEast + 10_000);
        assertThat(halfDiagonal).isCloseTo(toSouthEast, within(1e-6));
        assertThat(halfDiagonal).isGreaterThanOrEqualTo(toSouthWest);
        // only the farthest corner reaches the zero floor of the distance term
        assertThat(RankingPolicy.distanceComponent(toSouthEast, halfDiagonal)).isCloseTo(0.0, within(1e-9));
        assertThat(RankingPolicy.distanceComponent(toNorthEast, halfDiagonal)).isGreaterThan(0.0);
    }

    @Test
    void testContains_EdgesInclusive() {
        BoundingBox box = new BoundingBox(54.0, 53.8, 27.7, 27.4);

        assertThat(box.contains(54.0, 27.4)).isTrue();
        assertThat(box.contains(53.9, 27.55)).isTrue();
        assertThat(box.contains(54.0001, 27.55)).isFalse();
        assertThat(box.contains(53.9, 27.3999)).isFalse();
    }
}
