package com.restaurantguide.search.application.port.out;

import com.restaurantguide.search.domain.model.ListSearchFilter;
import com.restaurantguide.search.domain.model.MapSearchFilter;
import com.restaurantguide.search.domain.model.RankedResult;

import java.util.List;

/**
 * Output port for ranked spatial queries. Each call is a single round trip
 * with the ranking score computed by the store.
 */
public interface EstablishmentSearchRepository {

  /**
   * Active establishments within the filter's radius, ordered by score
   * descending then id ascending, starting strictly after the filter's cursor
   * when it has one.
   *
   * @param filter    validated list search
   * @param fetchSize maximum rows to return
   */
  List<RankedResult> searchWithinRadius(ListSearchFilter filter, int fetchSize);

  /**
   * Active establishments inside the filter's bounding box, same ordering,
   * at most {@code filter.getLimit()} rows.
   */
  List<RankedResult> searchWithinBounds(MapSearchFilter filter);

  /**
   * Version string reported by PostGIS.
   */
  String postgisVersion();
}
