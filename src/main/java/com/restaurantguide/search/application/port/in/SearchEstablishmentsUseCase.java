package com.restaurantguide.search.application.port.in;

import com.restaurantguide.search.api.dto.ListSearchResponseDto;
import com.restaurantguide.search.api.dto.MapSearchResponseDto;
import com.restaurantguide.search.api.dto.SearchHealthDto;
import com.restaurantguide.search.application.dto.ListSearchQuery;
import com.restaurantguide.search.application.dto.MapSearchQuery;

/**
 * Input port for geospatial establishment search.
 */
public interface SearchEstablishmentsUseCase {

  /**
   * Radius search around a center point, ranked and cursor-paged.
   *
   * @param query raw request parameters
   * @return one page of ranked results and the cursor for the next page, if any
   */
  ListSearchResponseDto searchList(ListSearchQuery query);

  /**
   * Bounding-box search returning compact markers, ranked, not paged.
   *
   * @param query raw request parameters
   * @return ranked markers inside the box, at most {@code limit}
   */
  MapSearchResponseDto searchMap(MapSearchQuery query);

  /**
   * Probe the spatial store.
   */
  SearchHealthDto checkHealth();
}
