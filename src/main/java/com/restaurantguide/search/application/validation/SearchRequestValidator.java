package com.restaurantguide.search.application.validation;

import com.restaurantguide.search.application.dto.ListSearchQuery;
import com.restaurantguide.search.application.dto.MapSearchQuery;
import com.restaurantguide.search.application.dto.SearchFilterParams;
import com.restaurantguide.search.application.pagination.CursorCodec;
import com.restaurantguide.search.domain.model.BoundingBox;
import com.restaurantguide.search.domain.model.CategoricalFilters;
import com.restaurantguide.search.domain.model.Category;
import com.restaurantguide.search.domain.model.City;
import com.restaurantguide.search.domain.model.Cuisine;
import com.restaurantguide.search.domain.model.Feature;
import com.restaurantguide.search.domain.model.GeoPoint;
import com.restaurantguide.search.domain.model.HoursFilter;
import com.restaurantguide.search.domain.model.LabeledValue;
import com.restaurantguide.search.domain.model.ListSearchFilter;
import com.restaurantguide.search.domain.model.MapSearchFilter;
import com.restaurantguide.search.domain.model.PriceRange;
import com.restaurantguide.search.domain.model.SearchCursor;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validates and normalizes raw search parameters before any query runs.
 *
 * Parsing, Bean Validation range checks, enumeration membership and
 * bounding-box rules all report into one list, so a client sees every
 * problem with its request at once.
 */
@Component
public class SearchRequestValidator {

    static final BigDecimal MAX_BOX_SPAN_DEGREES = BigDecimal.TEN;

    private static final List<String> FIELD_ORDER = List.of(
            "lat", "lon", "north", "south", "east", "west", "radius",
            "category", "cuisine", "price_range", "features", "hours_filter", "city", "min_rating",
            "cursor", "page_size", "limit");

    private final Validator validator;
    private final CursorCodec cursorCodec;
    private final int defaultRadiusMeters;
    private final int defaultPageSize;
    private final int defaultMapLimit;

    public SearchRequestValidator(
            Validator validator,
            CursorCodec cursorCodec,
            @Value("${app.search.default-radius-meters:10000}") int defaultRadiusMeters,
            @Value("${app.search.default-page-size:20}") int defaultPageSize,
            @Value("${app.search.default-map-limit:100}") int defaultMapLimit) {
        this.validator = validator;
        this.cursorCodec = cursorCodec;
        this.defaultRadiusMeters = defaultRadiusMeters;
        this.defaultPageSize = defaultPageSize;
        this.defaultMapLimit = defaultMapLimit;
    }

    /**
     * Validate a list view request.
     *
     * @throws SearchValidationException listing every failing field
     */
    public ListSearchFilter validateListSearch(ListSearchQuery query) {
        Violations violations = new Violations();
        SearchFilterParams params = query.getFilters() == null ? SearchFilterParams.EMPTY : query.getFilters();

        ListSearchCriteria criteria = new ListSearchCriteria();
        parseDecimal(violations, "lat", query.getLat(), "Latitude must be a number").ifPresent(criteria::setLat);
        parseDecimal(violations, "lon", query.getLon(), "Longitude must be a number").ifPresent(criteria::setLon);
        parseInteger(violations, "radius", query.getRadius(), "Radius must be an integer number of meters")
                .ifPresent(criteria::setRadius);
        parseInteger(violations, "page_size", query.getPageSize(), "Page size must be an integer")
                .ifPresent(criteria::setPageSize);
        parseDecimal(violations, "min_rating", params.getMinRating(), "Minimum rating must be a number")
                .ifPresent(criteria::setMinRating);
        violations.addBeanViolations(validator.validate(criteria));

        CategoricalFilters filters = parseFilters(violations, params, criteria.getMinRating());

        SearchCursor cursor = null;
        if (!isBlank(query.getCursor())) {
            try {
                cursor = cursorCodec.decode(query.getCursor());
            } catch (CursorCodec.InvalidCursorException e) {
                violations.add("cursor", e.getMessage(), query.getCursor());
            }
        }

        violations.throwIfAny();

        return new ListSearchFilter(
                new GeoPoint(criteria.getLat().doubleValue(), criteria.getLon().doubleValue()),
                criteria.getRadius() != null ? criteria.getRadius() : defaultRadiusMeters,
                criteria.getPageSize() != null ? criteria.getPageSize() : defaultPageSize,
                filters,
                cursor);
    }

    /**
     * Validate a map view request.
     *
     * @throws SearchValidationException listing every failing field
     */
    public MapSearchFilter validateMapSearch(MapSearchQuery query) {
        Violations violations = new Violations();
        SearchFilterParams params = query.getFilters() == null ? SearchFilterParams.EMPTY : query.getFilters();

        MapSearchCriteria criteria = new MapSearchCriteria();
        parseDecimal(violations, "north", query.getNorth(), "North boundary must be a number")
                .ifPresent(criteria::setNorth);
        parseDecimal(violations, "south", query.getSouth(), "South boundary must be a number")
                .ifPresent(criteria::setSouth);
        parseDecimal(violations, "east", query.getEast(), "East boundary must be a number")
                .ifPresent(criteria::setEast);
        parseDecimal(violations, "west", query.getWest(), "West boundary must be a number")
                .ifPresent(criteria::setWest);
        parseInteger(violations, "limit", query.getLimit(), "Limit must be an integer")
                .ifPresent(criteria::setLimit);
        parseDecimal(violations, "min_rating", params.getMinRating(), "Minimum rating must be a number")
                .ifPresent(criteria::setMinRating);
        violations.addBeanViolations(validator.validate(criteria));

        if (!violations.has("north") && !violations.has("south")) {
            BigDecimal latSpan = criteria.getNorth().subtract(criteria.getSouth());
            if (latSpan.signum() <= 0) {
                violations.add("north", "North boundary must be greater than south boundary", query.getNorth());
            } else if (latSpan.compareTo(MAX_BOX_SPAN_DEGREES) > 0) {
                violations.add("north", "Bounding box too large (maximum 10 degrees latitude span)", query.getNorth());
            }
        }
        if (!violations.has("east") && !violations.has("west")) {
            BigDecimal lonSpan = criteria.getEast().subtract(criteria.getWest()).abs();
            if (lonSpan.compareTo(MAX_BOX_SPAN_DEGREES) > 0) {
                violations.add("east", "Bounding box too large (maximum 10 degrees longitude span)", query.getEast());
            }
        }

        CategoricalFilters filters = parseFilters(violations, params, criteria.getMinRating());

        violations.throwIfAny();

        BoundingBox bounds = new BoundingBox(
                criteria.getNorth().doubleValue(),
                criteria.getSouth().doubleValue(),
                criteria.getEast().doubleValue(),
                criteria.getWest().doubleValue());
        return new MapSearchFilter(
                bounds,
                criteria.getLimit() != null ? criteria.getLimit() : defaultMapLimit,
                filters);
    }

    private CategoricalFilters parseFilters(Violations violations, SearchFilterParams params, BigDecimal minRating) {
        Set<Category> categories = parseLabels(violations, "category", params.getCategory(), Category.class,
                invalid -> "Invalid categories: " + invalid);
        Set<Cuisine> cuisines = parseLabels(violations, "cuisine", params.getCuisine(), Cuisine.class,
                invalid -> "Invalid cuisines: " + invalid);
        Set<PriceRange> priceRanges = parseLabels(violations, "price_range", params.getPriceRange(), PriceRange.class,
                invalid -> "Invalid price ranges: " + invalid + ". Valid options: " + options(PriceRange.class));
        Set<Feature> features = parseLabels(violations, "features", params.getFeatures(), Feature.class,
                invalid -> "Invalid features: " + invalid);
        HoursFilter hoursFilter = parseSingle(violations, "hours_filter", params.getHoursFilter(), HoursFilter.class,
                "Hours filter must be one of: " + options(HoursFilter.class));
        City city = parseSingle(violations, "city", params.getCity(), City.class,
                "City must be one of: " + options(City.class));

        return new CategoricalFilters(categories, cuisines, priceRanges, features, hoursFilter, city, minRating);
    }

    /**
     * Split a comma-separated filter and check every value on its own. Blank
     * entries are ignored; the violation names only the values that failed.
     */
    private <E extends Enum<E> & LabeledValue> Set<E> parseLabels(
            Violations violations, String field, String raw, Class<E> type,
            Function<String, String> message) {
        Set<E> values = EnumSet.noneOf(type);
        if (isBlank(raw)) {
            return values;
        }
        List<String> invalid = new ArrayList<>();
        for (String token : raw.split(",")) {
            String label = token.trim();
            if (label.isEmpty()) {
                continue;
            }
            Optional<E> value = LabeledValue.fromLabel(type, label);
            if (value.isPresent()) {
                values.add(value.get());
            } else {
                invalid.add(label);
            }
        }
        if (!invalid.isEmpty()) {
            violations.add(new FieldViolation(field, message.apply(String.join(", ", invalid)), raw, invalid));
        }
        return values;
    }

    private <E extends Enum<E> & LabeledValue> E parseSingle(
            Violations violations, String field, String raw, Class<E> type, String message) {
        if (isBlank(raw)) {
            return null;
        }
        Optional<E> value = LabeledValue.fromLabel(type, raw.trim());
        if (value.isEmpty()) {
            violations.add(new FieldViolation(field, message, raw, List.of(raw.trim())));
            return null;
        }
        return value.get();
    }

    private Optional<BigDecimal> parseDecimal(Violations violations, String field, String raw, String message) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(raw.trim()));
        } catch (NumberFormatException e) {
            violations.add(field, message, raw);
            return Optional.empty();
        }
    }

    private Optional<Integer> parseInteger(Violations violations, String field, String raw, String message) {
        if (isBlank(raw)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(raw.trim()).intValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            violations.add(field, message, raw);
            return Optional.empty();
        }
    }

    private static <E extends Enum<E> & LabeledValue> String options(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(LabeledValue::getLabel)
                .collect(Collectors.joining(", "));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String toWireName(String propertyName) {
        StringBuilder wire = new StringBuilder();
        for (char c : propertyName.toCharArray()) {
            if (Character.isUpperCase(c)) {
                wire.append('_').append(Character.toLowerCase(c));
            } else {
                wire.append(c);
            }
        }
        return wire.toString();
    }

    /**
     * Violations collected for one request, reported in a stable field order.
     */
    private static final class Violations {

        private final List<FieldViolation> items = new ArrayList<>();

        void add(String field, String message, String rejectedValue) {
            add(new FieldViolation(field, message, rejectedValue));
        }

        void add(FieldViolation violation) {
            items.add(violation);
        }

        boolean has(String field) {
            return items.stream().anyMatch(v -> v.getField().equals(field));
        }

        /**
         * Add Bean Validation results, skipping fields that already failed to parse.
         */
        void addBeanViolations(Set<? extends ConstraintViolation<?>> constraintViolations) {
            constraintViolations.stream()
                    .map(cv -> new FieldViolation(
                            toWireName(cv.getPropertyPath().toString()),
                            cv.getMessage(),
                            cv.getInvalidValue() == null ? null : cv.getInvalidValue().toString()))
                    .filter(v -> !has(v.getField()))
                    .sorted(Comparator.comparing(FieldViolation::getField))
                    .toList()
                    .forEach(items::add);
        }

        void throwIfAny() {
            if (!items.isEmpty()) {
                List<FieldViolation> ordered = new ArrayList<>(items);
                ordered.sort(Comparator.comparingInt(v -> position(v.getField())));
                throw new SearchValidationException(ordered);
            }
        }

        private static int position(String field) {
            int index = FIELD_ORDER.indexOf(field);
            return index < 0 ? FIELD_ORDER.size() : index;
        }
    }
}
