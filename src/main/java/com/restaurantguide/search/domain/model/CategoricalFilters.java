package com.restaurantguide.search.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Filter dimensions shared by the list and map searches. Empty sets and null
 * values mean "no constraint".
 */
@Getter
@EqualsAndHashCode
@ToString
public class CategoricalFilters {

    public static final CategoricalFilters NONE = new CategoricalFilters(
            Set.of(), Set.of(), Set.of(), Set.of(), null, null, null);

    private final Set<Category> categories;
    private final Set<Cuisine> cuisines;
    private final Set<PriceRange> priceRanges;
    private final Set<Feature> features;
    private final HoursFilter hoursFilter;
    private final City city;
    private final BigDecimal minRating;

    public CategoricalFilters(
            Collection<Category> categories,
            Collection<Cuisine> cuisines,
            Collection<PriceRange> priceRanges,
            Collection<Feature> features,
            HoursFilter hoursFilter,
            City city,
            BigDecimal minRating) {
        this.categories = copy(categories, Category.class);
        this.cuisines = copy(cuisines, Cuisine.class);
        this.priceRanges = copy(priceRanges, PriceRange.class);
        this.features = copy(features, Feature.class);
        this.hoursFilter = hoursFilter;
        this.city = city;
        this.minRating = minRating;
    }

    /**
     * Stable textual form, independent of the order values were supplied in.
     */
    public String canonicalForm() {
        StringJoiner joiner = new StringJoiner(";");
        joiner.add("category=" + labels(categories));
        joiner.add("cuisine=" + labels(cuisines));
        joiner.add("price=" + labels(priceRanges));
        joiner.add("features=" + labels(features));
        joiner.add("hours=" + (hoursFilter == null ? "" : hoursFilter.getLabel()));
        joiner.add("city=" + (city == null ? "" : city.getLabel()));
        joiner.add("minRating=" + (minRating == null ? "" : minRating.stripTrailingZeros().toPlainString()));
        return joiner.toString();
    }

    private static <E extends Enum<E> & LabeledValue> Set<E> copy(Collection<E> values, Class<E> type) {
        EnumSet<E> set = EnumSet.noneOf(type);
        if (values != null) {
            set.addAll(values);
        }
        return Set.copyOf(set);
    }

    private static <E extends Enum<E> & LabeledValue> String labels(Set<E> values) {
        return values.stream()
                .sorted()
                .map(LabeledValue::getLabel)
                .collect(Collectors.joining(","));
    }
}
