package com.restaurantguide.search.application.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw, unvalidated filter parameters shared by list and map searches,
 * exactly as they arrived on the query string.
 */
@Getter
@Builder
@ToString
public class SearchFilterParams {

    public static final SearchFilterParams EMPTY = SearchFilterParams.builder().build();

    private final String category;
    private final String cuisine;
    private final String priceRange;
    private final String features;
    private final String hoursFilter;
    private final String city;
    private final String minRating;
}
