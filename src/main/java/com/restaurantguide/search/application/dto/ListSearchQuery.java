package com.restaurantguide.search.application.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw list view request.
 */
@Getter
@Builder
@ToString
public class ListSearchQuery {

    private final String lat;
    private final String lon;
    private final String radius;
    private final String cursor;
    private final String pageSize;
    private final SearchFilterParams filters;
}
