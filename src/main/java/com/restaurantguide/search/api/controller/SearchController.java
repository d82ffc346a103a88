package com.restaurantguide.search.api.controller;

import com.restaurantguide.search.api.dto.EstablishmentDetailDto;
import com.restaurantguide.search.api.dto.ListSearchResponseDto;
import com.restaurantguide.search.api.dto.MapSearchResponseDto;
import com.restaurantguide.search.api.dto.SearchHealthDto;
import com.restaurantguide.search.application.dto.ListSearchQuery;
import com.restaurantguide.search.application.dto.MapSearchQuery;
import com.restaurantguide.search.application.dto.SearchFilterParams;
import com.restaurantguide.search.application.port.in.GetEstablishmentUseCase;
import com.restaurantguide.search.application.port.in.SearchEstablishmentsUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Controller for establishment search.
 *
 * Query parameters arrive as raw strings; parsing and validation happen in
 * the application layer so that every invalid parameter is reported together.
 */
@RestController
@RequestMapping("/api/v1/search")
public class SearchController {

    private static final Logger logger = LoggerFactory.getLogger(SearchController.class);

    private final SearchEstablishmentsUseCase searchEstablishmentsUseCase;
    private final GetEstablishmentUseCase getEstablishmentUseCase;

    public SearchController(
            SearchEstablishmentsUseCase searchEstablishmentsUseCase,
            GetEstablishmentUseCase getEstablishmentUseCase) {
        this.searchEstablishmentsUseCase = searchEstablishmentsUseCase;
        this.getEstablishmentUseCase = getEstablishmentUseCase;
    }

    /**
     * GET /api/v1/search/establishments?lat=X&lon=Y
     *
     * Radius search ranked by distance, quality and subscription, paged with
     * an opaque cursor.
     */
    @GetMapping("/establishments")
    public ResponseEntity<ListSearchResponseDto> searchEstablishments(
            @RequestParam(required = false) String lat,
            @RequestParam(required = false) String lon,
            @RequestParam(required = false) String radius,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String cuisine,
            @RequestParam(name = "price_range", required = false) String priceRange,
            @RequestParam(required = false) String features,
            @RequestParam(name = "hours_filter", required = false) String hoursFilter,
            @RequestParam(required = false) String city,
            @RequestParam(name = "min_rating", required = false) String minRating,
            @RequestParam(required = false) String cursor,
            @RequestParam(name = "page_size", required = false) String pageSize) {
        logger.info("List search: lat={}, lon={}, radius={}, pageSize={}, cursor={}",
                lat, lon, radius, pageSize, cursor != null);

        ListSearchQuery query = ListSearchQuery.builder()
                .lat(lat)
                .lon(lon)
                .radius(radius)
                .cursor(cursor)
                .pageSize(pageSize)
                .filters(filters(category, cuisine, priceRange, features, hoursFilter, city, minRating))
                .build();
        return ResponseEntity.ok(searchEstablishmentsUseCase.searchList(query));
    }

    /**
     * GET /api/v1/search/map?north=N&south=S&east=E&west=W
     *
     * Markers inside the visible map area, best ranked first.
     */
    @GetMapping("/map")
    public ResponseEntity<MapSearchResponseDto> searchMap(
            @RequestParam(required = false) String north,
            @RequestParam(required = false) String south,
            @RequestParam(required = false) String east,
            @RequestParam(required = false) String west,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String cuisine,
            @RequestParam(name = "price_range", required = false) String priceRange,
            @RequestParam(required = false) String features,
            @RequestParam(name = "hours_filter", required = false) String hoursFilter,
            @RequestParam(required = false) String city,
            @RequestParam(name = "min_rating", required = false) String minRating,
            @RequestParam(required = false) String limit) {
        logger.info("Map search: north={}, south={}, east={}, west={}, limit={}",
                north, south, east, west, limit);

        MapSearchQuery query = MapSearchQuery.builder()
                .north(north)
                .south(south)
                .east(east)
                .west(west)
                .limit(limit)
                .filters(filters(category, cuisine, priceRange, features, hoursFilter, city, minRating))
                .build();
        return ResponseEntity.ok(searchEstablishmentsUseCase.searchMap(query));
    }

    @GetMapping("/establishments/{id}")
    public ResponseEntity<EstablishmentDetailDto> getEstablishment(@PathVariable UUID id) {
        logger.info("Establishment detail: id={}", id);
        return ResponseEntity.ok(getEstablishmentUseCase.getEstablishment(id));
    }

    /**
     * GET /api/v1/search/health
     *
     * @return 200 when PostGIS answers, 503 otherwise
     */
    @GetMapping("/health")
    public ResponseEntity<SearchHealthDto> health() {
        SearchHealthDto health = searchEstablishmentsUseCase.checkHealth();
        HttpStatus status = health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    private static SearchFilterParams filters(String category, String cuisine, String priceRange,
            String features, String hoursFilter, String city, String minRating) {
        return SearchFilterParams.builder()
                .category(category)
                .cuisine(cuisine)
                .priceRange(priceRange)
                .features(features)
                .hoursFilter(hoursFilter)
                .city(city)
                .minRating(minRating)
                .build();
    }
}
