package com.restaurantguide.search.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Validated radius search. Request-scoped, never persisted.
 */
@Getter
@ToString
public class ListSearchFilter {

    private final GeoPoint center;
    private final int radiusMeters;
    private final int pageSize;
    private final CategoricalFilters filters;
    private final SearchCursor cursor;

    public ListSearchFilter(GeoPoint center, int radiusMeters, int pageSize,
            CategoricalFilters filters, SearchCursor cursor) {
        this.center = center;
        this.radiusMeters = radiusMeters;
        this.pageSize = pageSize;
        this.filters = filters == null ? CategoricalFilters.NONE : filters;
        this.cursor = cursor;
    }

    public Optional<SearchCursor> cursor() {
        return Optional.ofNullable(cursor);
    }

    /**
     * Same search without a resume position.
     */
    public ListSearchFilter firstPage() {
        return new ListSearchFilter(center, radiusMeters, pageSize, filters, null);
    }

    /**
     * Everything that determines the result sequence. Page size is excluded:
     * a client may change it between pages without invalidating its cursor.
     */
    public String canonicalForm() {
        return "list;lat=" + center.getLat()
                + ";lng=" + center.getLng()
                + ";radius=" + radiusMeters
                + ";" + filters.canonicalForm();
    }
}
