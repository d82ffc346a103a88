package com.restaurantguide.search.application.service;

import com.restaurantguide.search.api.dto.ListSearchResponseDto;
import com.restaurantguide.search.api.dto.MapMarkerDto;
import com.restaurantguide.search.api.dto.MapSearchResponseDto;
import com.restaurantguide.search.api.dto.RankedEstablishmentDto;
import com.restaurantguide.search.api.dto.SearchHealthDto;
import com.restaurantguide.search.application.dto.ListSearchQuery;
import com.restaurantguide.search.application.dto.MapSearchQuery;
import com.restaurantguide.search.application.mapper.EstablishmentMapper;
import com.restaurantguide.search.application.pagination.CursorCodec;
import com.restaurantguide.search.application.port.in.SearchEstablishmentsUseCase;
import com.restaurantguide.search.application.port.out.EstablishmentSearchRepository;
import com.restaurantguide.search.application.validation.SearchRequestValidator;
import com.restaurantguide.search.domain.model.BoundingBox;
import com.restaurantguide.search.domain.model.ListSearchFilter;
import com.restaurantguide.search.domain.model.MapSearchFilter;
import com.restaurantguide.search.domain.model.RankedResult;
import com.restaurantguide.search.domain.model.SearchCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.Supplier;

/**
 * Application service for list and map search.
 *
 * List view uses keyset pagination: the store returns {@code pageSize + 1}
 * rows, the extra row only signals that a next page exists, and the next
 * cursor points at the last row actually served.
 */
@Service
public class EstablishmentSearchService implements SearchEstablishmentsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(EstablishmentSearchService.class);

    private final SearchRequestValidator requestValidator;
    private final EstablishmentSearchRepository searchRepository;
    private final CursorCodec cursorCodec;
    private final EstablishmentMapper establishmentMapper;

    public EstablishmentSearchService(
            SearchRequestValidator requestValidator,
            EstablishmentSearchRepository searchRepository,
            CursorCodec cursorCodec,
            EstablishmentMapper establishmentMapper) {
        this.requestValidator = requestValidator;
        this.searchRepository = searchRepository;
        this.cursorCodec = cursorCodec;
        this.establishmentMapper = establishmentMapper;
    }

    /**
     * Radius search.
     *
     * A cursor issued for different filters, or one whose page has vanished
     * since it was issued, restarts the search from the first page and the
     * response is flagged with {@code cursorReset}.
     */
    @Override
    public ListSearchResponseDto searchList(ListSearchQuery query) {
        ListSearchFilter filter = requestValidator.validateListSearch(query);
        long fingerprint = cursorCodec.fingerprint(filter.canonicalForm());
        boolean cursorReset = false;

        if (filter.cursor().map(cursor -> !cursor.belongsTo(fingerprint)).orElse(false)) {
            logger.debug("Cursor was issued for different filters, restarting from first page");
            filter = filter.firstPage();
            cursorReset = true;
        }

        List<RankedResult> rows = fetchPage(filter);
        if (rows.isEmpty() && filter.cursor().isPresent()) {
            logger.debug("Cursor page is empty, restarting from first page");
            filter = filter.firstPage();
            cursorReset = true;
            rows = fetchPage(filter);
        }

        int pageSize = filter.getPageSize();
        boolean hasNextPage = rows.size() > pageSize;
        List<RankedResult> page = hasNextPage ? rows.subList(0, pageSize) : rows;

        String nextCursor = null;
        if (hasNextPage) {
            RankedResult last = page.get(page.size() - 1);
            nextCursor = cursorCodec.encode(new SearchCursor(last.getScore(), last.getId(), fingerprint));
        }

        List<RankedEstablishmentDto> results = page.stream()
                .map(establishmentMapper::toRankedDto)
                .toList();

        logger.debug("Radius search returned {} results (next page: {}, cursor reset: {})",
                results.size(), hasNextPage, cursorReset);

        ListSearchResponseDto.CenterDto center = new ListSearchResponseDto.CenterDto(
                filter.getCenter().getLat(),
                filter.getCenter().getLng(),
                filter.getRadiusMeters());
        return new ListSearchResponseDto(center, pageSize, results, nextCursor, cursorReset);
    }

    /**
     * Bounding-box search. Returns at most {@code limit} markers in one response.
     */
    @Override
    public MapSearchResponseDto searchMap(MapSearchQuery query) {
        MapSearchFilter filter = requestValidator.validateMapSearch(query);

        List<MapMarkerDto> results = callStore(() -> searchRepository.searchWithinBounds(filter))
                .stream()
                .map(establishmentMapper::toMarkerDto)
                .toList();

        logger.debug("Bounding box search returned {} markers", results.size());

        BoundingBox bounds = filter.getBounds();
        MapSearchResponseDto.BoundsDto boundsDto = new MapSearchResponseDto.BoundsDto(
                bounds.getNorth(), bounds.getSouth(), bounds.getEast(), bounds.getWest());
        return new MapSearchResponseDto(boundsDto, results.size(), results);
    }

    @Override
    public SearchHealthDto checkHealth() {
        String timestamp = OffsetDateTime.now().toString();
        try {
            String version = searchRepository.postgisVersion();
            return new SearchHealthDto(true, version, null, timestamp);
        } catch (DataAccessException e) {
            logger.error("PostGIS health check failed", e);
            return new SearchHealthDto(false, null, e.getMostSpecificCause().getMessage(), timestamp);
        }
    }

    private List<RankedResult> fetchPage(ListSearchFilter filter) {
        return callStore(() -> searchRepository.searchWithinRadius(filter, filter.getPageSize() + 1));
    }

    private <T> T callStore(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            logger.error("Spatial store query failed", e);
            throw new SearchUnavailableException("Search is temporarily unavailable, please retry", e);
        }
    }

    /**
     * Raised when the spatial store cannot answer (timeout, pool exhaustion,
     * connection loss). Safe to retry.
     */
    public static class SearchUnavailableException extends RuntimeException {
        public SearchUnavailableException(String message) {
            super(message);
        }

        public SearchUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
