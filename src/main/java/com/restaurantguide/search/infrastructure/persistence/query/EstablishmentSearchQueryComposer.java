package com.restaurantguide.search.infrastructure.persistence.query;

import com.restaurantguide.search.domain.model.BoundingBox;
import com.restaurantguide.search.domain.model.CategoricalFilters;
import com.restaurantguide.search.domain.model.EstablishmentStatus;
import com.restaurantguide.search.domain.model.GeoPoint;
import com.restaurantguide.search.domain.model.HoursFilter;
import com.restaurantguide.search.domain.model.LabeledValue;
import com.restaurantguide.search.domain.model.ListSearchFilter;
import com.restaurantguide.search.domain.model.MapSearchFilter;
import com.restaurantguide.search.domain.model.SearchCursor;
import com.restaurantguide.search.domain.model.SubscriptionTier;
import com.restaurantguide.search.domain.policy.RankingPolicy;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the parameterized PostGIS statements behind list and map search.
 *
 * Every statement filters, scores, orders and limits in one round trip. The
 * score is rounded to {@link SearchCursor#SCORE_SCALE} decimals in SQL so that
 * keyset comparisons against a cursor are exact.
 *
 * Filter values are always bound as parameters; only constants from
 * {@link RankingPolicy} and {@link SubscriptionTier} are inlined.
 */
@Component
public class EstablishmentSearchQueryComposer {

    static final LocalTime LATE_CLOSING_TIME = LocalTime.of(22, 0);

    private static final String ORIGIN =
            "CAST(ST_SetSRID(ST_MakePoint(:originLng, :originLat), 4326) AS geography)";

    private static final String LIST_COLUMNS = String.join(", ",
            "e.id", "e.name", "e.latitude", "e.longitude", "e.city", "e.address",
            "e.categories", "e.cuisines", "e.price_range", "e.average_rating",
            "e.review_count", "e.subscription_tier", "e.primary_image_url");

    private static final String MAP_COLUMNS = String.join(", ",
            "e.id", "e.name", "e.latitude", "e.longitude", "e.categories", "e.average_rating");

    /**
     * Radius search around the filter's center. Rows carry {@code distance_meters}
     * and {@code score}; at most {@code fetchSize} rows are returned.
     */
    public ComposedQuery composeListQuery(ListSearchFilter filter, int fetchSize) {
        Map<String, Object> params = new LinkedHashMap<>();
        GeoPoint center = filter.getCenter();
        params.put("originLat", center.getLat());
        params.put("originLng", center.getLng());
        params.put("radius", filter.getRadiusMeters());
        params.put("reference", (double) filter.getRadiusMeters());

        List<String> predicates = new ArrayList<>();
        predicates.add("ST_DWithin(e.location, " + ORIGIN + ", :radius)");
        addSharedPredicates(filter.getFilters(), predicates, params);

        StringBuilder sql = new StringBuilder()
                .append("SELECT * FROM (SELECT ").append(LIST_COLUMNS)
                .append(", ST_Distance(e.location, ").append(ORIGIN).append(") AS distance_meters")
                .append(", ").append(scoreExpression()).append(" AS score")
                .append(" FROM establishments e WHERE ")
                .append(String.join(" AND ", predicates))
                .append(") ranked");

        filter.cursor().ifPresent(cursor -> {
            sql.append(" WHERE (ranked.score < :cursorScore"
                    + " OR (ranked.score = :cursorScore AND ranked.id > :cursorId))");
            params.put("cursorScore", cursor.getScore());
            params.put("cursorId", cursor.getId());
        });

        sql.append(" ORDER BY ranked.score DESC, ranked.id ASC LIMIT :limit");
        params.put("limit", fetchSize);
        return new ComposedQuery(sql.toString(), params);
    }

    /**
     * Bounding-box search. Distance is measured from the box center and
     * normalized by the center-to-corner distance.
     */
    public ComposedQuery composeMapQuery(MapSearchFilter filter) {
        Map<String, Object> params = new LinkedHashMap<>();
        BoundingBox bounds = filter.getBounds();
        GeoPoint center = bounds.center();
        params.put("north", bounds.getNorth());
        params.put("south", bounds.getSouth());
        params.put("east", bounds.getEast());
        params.put("west", bounds.getWest());
        params.put("originLat", center.getLat());
        params.put("originLng", center.getLng());
        params.put("reference", bounds.halfDiagonalMeters());

        List<String> predicates = new ArrayList<>();
        predicates.add("ST_Intersects(CAST(e.location AS geometry),"
                + " ST_MakeEnvelope(:west, :south, :east, :north, 4326))");
        addSharedPredicates(filter.getFilters(), predicates, params);

        String sql = "SELECT * FROM (SELECT " + MAP_COLUMNS
                + ", " + scoreExpression() + " AS score"
                + " FROM establishments e WHERE "
                + String.join(" AND ", predicates)
                + ") ranked ORDER BY ranked.score DESC, ranked.id ASC LIMIT :limit";
        params.put("limit", filter.getLimit());
        return new ComposedQuery(sql, params);
    }

    private void addSharedPredicates(CategoricalFilters filters, List<String> predicates,
            Map<String, Object> params) {
        predicates.add("e.status = :status");
        params.put("status", EstablishmentStatus.ACTIVE.name());

        if (!filters.getCategories().isEmpty()) {
            predicates.add("e.categories && CAST(ARRAY[:categories] AS varchar[])");
            params.put("categories", labels(filters.getCategories()));
        }
        if (!filters.getCuisines().isEmpty()) {
            predicates.add("e.cuisines && CAST(ARRAY[:cuisines] AS varchar[])");
            params.put("cuisines", labels(filters.getCuisines()));
        }
        if (!filters.getPriceRanges().isEmpty()) {
            predicates.add("e.price_range IN (:priceRanges)");
            params.put("priceRanges", labels(filters.getPriceRanges()));
        }
        if (!filters.getFeatures().isEmpty()) {
            predicates.add("e.features @> CAST(ARRAY[:features] AS varchar[])");
            params.put("features", labels(filters.getFeatures()));
        }
        if (filters.getHoursFilter() != null) {
            predicates.add(hoursPredicate(filters.getHoursFilter()));
            if (filters.getHoursFilter() == HoursFilter.UNTIL_22) {
                params.put("lateClosingTime", LATE_CLOSING_TIME);
            }
        }
        if (filters.getCity() != null) {
            predicates.add("e.city = :city");
            params.put("city", filters.getCity().getLabel());
        }
        if (filters.getMinRating() != null) {
            predicates.add("e.average_rating >= :minRating");
            params.put("minRating", filters.getMinRating());
        }
    }

    static String hoursPredicate(HoursFilter hoursFilter) {
        String closesAfterMidnight = "(e.opens_at IS NOT NULL AND e.closes_at IS NOT NULL"
                + " AND e.closes_at < e.opens_at)";
        switch (hoursFilter) {
            case ALL_DAY:
                return "e.open_24_hours = TRUE";
            case UNTIL_MORNING:
                return "(e.open_24_hours = TRUE OR " + closesAfterMidnight + ")";
            case UNTIL_22:
                return "(e.open_24_hours = TRUE OR " + closesAfterMidnight
                        + " OR e.closes_at >= :lateClosingTime)";
            default:
                throw new IllegalArgumentException("Unsupported hours filter: " + hoursFilter);
        }
    }

    /**
     * Ranking score as SQL. Expects {@code :originLat}, {@code :originLng} and
     * {@code :reference} to be bound.
     */
    static String scoreExpression() {
        String distance = "GREATEST(0, 1 - ST_Distance(e.location, " + ORIGIN + ") / :reference)";
        String ratingTerm = "CASE WHEN e.review_count > 0 AND e.average_rating IS NOT NULL"
                + " THEN e.average_rating / " + literal(RankingPolicy.MAX_RATING)
                + " ELSE " + literal(RankingPolicy.NEUTRAL_RATING_TERM) + " END";
        String volumeTerm = "LEAST(1, LN(1 + e.review_count) / LN("
                + (1 + RankingPolicy.REVIEW_VOLUME_SATURATION) + "))";
        String quality = "(" + literal(RankingPolicy.RATING_SHARE) + " * " + ratingTerm
                + " + " + literal(RankingPolicy.VOLUME_SHARE) + " * " + volumeTerm + ")";

        StringBuilder subscription = new StringBuilder("CASE e.subscription_tier");
        for (SubscriptionTier tier : SubscriptionTier.values()) {
            subscription.append(" WHEN '").append(tier.name()).append("' THEN ")
                    .append(literal(tier.getRankingWeight()));
        }
        subscription.append(" ELSE 0 END");

        return "ROUND(CAST("
                + literal(RankingPolicy.DISTANCE_WEIGHT) + " * " + distance
                + " + " + literal(RankingPolicy.QUALITY_WEIGHT) + " * " + quality
                + " + " + literal(RankingPolicy.SUBSCRIPTION_WEIGHT) + " * " + subscription
                + " AS numeric), " + SearchCursor.SCORE_SCALE + ")";
    }

    private static String literal(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static <E extends Enum<E> & LabeledValue> List<String> labels(Set<E> values) {
        return values.stream()
                .sorted()
                .map(LabeledValue::getLabel)
                .toList();
    }
}
