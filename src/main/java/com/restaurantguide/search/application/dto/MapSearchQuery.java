package com.restaurantguide.search.application.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw map view request.
 */
@Getter
@Builder
@ToString
public class MapSearchQuery {

    private final String north;
    private final String south;
    private final String east;
    private final String west;
    private final String limit;
    private final SearchFilterParams filters;
}
