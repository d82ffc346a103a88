package com.restaurantguide.search.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Validated bounding-box search. Map view is a single bounded fetch, so there is no cursor.
 */
@Getter
@ToString
public class MapSearchFilter {

    private final BoundingBox bounds;
    private final int limit;
    private final CategoricalFilters filters;

    public MapSearchFilter(BoundingBox bounds, int limit, CategoricalFilters filters) {
        this.bounds = bounds;
        this.limit = limit;
        this.filters = filters == null ? CategoricalFilters.NONE : filters;
    }
}
