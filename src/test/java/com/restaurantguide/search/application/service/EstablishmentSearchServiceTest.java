package com.restaurantguide.search.application.service;

import com.restaurantguide.search.api.dto.ListSearchResponseDto;
import com.restaurantguide.search.api.dto.MapSearchResponseDto;
import com.restaurantguide.search.api.dto.SearchHealthDto;
import com.restaurantguide.search.application.dto.ListSearchQuery;
import com.restaurantguide.search.application.dto.MapSearchQuery;
import com.restaurantguide.search.application.mapper.EstablishmentMapper;
import com.restaurantguide.search.application.pagination.CursorCodec;
import com.restaurantguide.search.application.port.out.EstablishmentSearchRepository;
import com.restaurantguide.search.application.validation.SearchRequestValidator;
import com.restaurantguide.search.application.validation.SearchValidationException;
import com.restaurantguide.search.domain.model.ListSearchFilter;
import com.restaurantguide.search.domain.model.MapSearchFilter;
import com.restaurantguide.search.domain.model.RankedResult;
import com.restaurantguide.search.domain.model.SearchCursor;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static com.restaurantguide.search.support.TestFixtures.rankedResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EstablishmentSearchServiceTest {

    @Mock
    private EstablishmentSearchRepository searchRepository;

    private ValidatorFactory validatorFactory;
    private CursorCodec cursorCodec;
    private EstablishmentSearchService searchService;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        cursorCodec = new CursorCodec("test-cursor-secret");
        SearchRequestValidator requestValidator = new SearchRequestValidator(
                validatorFactory.getValidator(), cursorCodec, 10000, 20, 100);
        searchService = new EstablishmentSearchService(
                requestValidator, searchRepository, cursorCodec, new EstablishmentMapper());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void testSearchList_MoreRowsThanPage_ReturnsCursorForLastServedRow() {
        List<RankedResult> rows = List.of(
                rankedResult("0.900000"), rankedResult("0.800000"), rankedResult("0.700000"));
        when(searchRepository.searchWithinRadius(any(), eq(3))).thenReturn(rows);

        ListSearchResponseDto response = searchService.searchList(query().pageSize("2").build());

        assertThat(response.getResults()).hasSize(2);
        assertThat(response.getPageSize()).isEqualTo(2);
        assertThat(response.isCursorReset()).isFalse();
        assertThat(response.getNextCursor()).isNotNull();

        SearchCursor next = cursorCodec.decode(response.getNextCursor());
        assertThat(next.getId()).isEqualTo(rows.get(1).getId());
        assertThat(next.getScore()).isEqualByComparingTo("0.800000");
    }

    @Test
    void testSearchList_LastPage_HasNoCursor() {
        when(searchRepository.searchWithinRadius(any(), anyInt()))
                .thenReturn(List.of(rankedResult("0.900000"), rankedResult("0.800000")));

        ListSearchResponseDto response = searchService.searchList(query().pageSize("2").build());

        assertThat(response.getResults()).hasSize(2);
        assertThat(response.getNextCursor()).isNull();
    }

    @Test
    void testSearchList_CursorFromFirstPage_ResumesSameSearch() {
        when(searchRepository.searchWithinRadius(any(), anyInt()))
                .thenReturn(List.of(rankedResult("0.900000"), rankedResult("0.800000")))
                .thenReturn(List.of(rankedResult("0.700000")));

        ListSearchResponseDto first = searchService.searchList(query().pageSize("1").build());
        ListSearchResponseDto second = searchService.searchList(
                query().pageSize("1").cursor(first.getNextCursor()).build());

        ArgumentCaptor<ListSearchFilter> captor = ArgumentCaptor.forClass(ListSearchFilter.class);
        verify(searchRepository, times(2)).searchWithinRadius(captor.capture(), anyInt());
        assertThat(captor.getAllValues().get(1).cursor()).isPresent();
        assertThat(second.isCursorReset()).isFalse();
        assertThat(second.getResults()).hasSize(1);
    }

    @Test
    void testSearchList_CursorForOtherFilters_ResetsToFirstPage() {
        String cursorForWiderRadius = cursorCodec.encode(new SearchCursor(
                new BigDecimal("0.5"), UUID.randomUUID(), cursorCodec.fingerprint("some other search")));
        when(searchRepository.searchWithinRadius(any(), anyInt())).thenReturn(List.of(rankedResult("0.900000")));

        ListSearchResponseDto response = searchService.searchList(query().cursor(cursorForWiderRadius).build());

        ArgumentCaptor<ListSearchFilter> captor = ArgumentCaptor.forClass(ListSearchFilter.class);
        verify(searchRepository).searchWithinRadius(captor.capture(), anyInt());
        assertThat(captor.getValue().cursor()).isEmpty();
        assertThat(response.isCursorReset()).isTrue();
        assertThat(response.getResults()).hasSize(1);
    }

    @Test
    void testSearchList_CursorPageVanished_ResetsToFirstPage() {
        when(searchRepository.searchWithinRadius(any(), anyInt()))
                .thenReturn(List.of(rankedResult("0.900000"), rankedResult("0.800000")))
                .thenReturn(List.of())
                .thenReturn(List.of(rankedResult("0.950000")));

        ListSearchResponseDto first = searchService.searchList(query().pageSize("1").build());
        ListSearchResponseDto resumed = searchService.searchList(
                query().pageSize("1").cursor(first.getNextCursor()).build());

        assertThat(resumed.isCursorReset()).isTrue();
        assertThat(resumed.getResults()).extracting("score").containsExactly(new BigDecimal("0.950000"));
        verify(searchRepository, times(3)).searchWithinRadius(any(), anyInt());
    }

    @Test
    void testSearchList_NoMatches_ReturnsEmptyPage() {
        when(searchRepository.searchWithinRadius(any(), anyInt())).thenReturn(List.of());

        ListSearchResponseDto response = searchService.searchList(query().build());

        assertThat(response.getResults()).isEmpty();
        assertThat(response.getNextCursor()).isNull();
        assertThat(response.isCursorReset()).isFalse();
        assertThat(response.getCenter().getRadiusMeters()).isEqualTo(10000);
    }

    @Test
    void testSearchList_InvalidRequest_NeverQueriesStore() {
        assertThatThrownBy(() -> searchService.searchList(query().radius("50001").build()))
                .isInstanceOf(SearchValidationException.class);

        verify(searchRepository, never()).searchWithinRadius(any(), anyInt());
    }

    @Test
    void testSearchList_StoreTimeout_SurfacesAsUnavailable() {
        when(searchRepository.searchWithinRadius(any(), anyInt()))
                .thenThrow(new QueryTimeoutException("canceling statement due to statement timeout"));

        assertThatThrownBy(() -> searchService.searchList(query().build()))
                .isInstanceOf(EstablishmentSearchService.SearchUnavailableException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }

    @Test
    void testSearchMap_SwappedLongitudes_ReturnsNormalizedBoundsAndMarkers() {
        RankedResult row = RankedResult.builder()
                .id(UUID.randomUUID())
                .name("Васильки")
                .lat(53.9023)
                .lng(27.5618)
                .categories(List.of("Ресторан", "Бар"))
                .averageRating(new BigDecimal("4.60"))
                .score(new BigDecimal("0.812000"))
                .build();
        when(searchRepository.searchWithinBounds(any())).thenReturn(List.of(row));

        MapSearchResponseDto response = searchService.searchMap(MapSearchQuery.builder()
                .north("54.0").south("53.8").east("27.4").west("27.7").limit("50").build());

        ArgumentCaptor<MapSearchFilter> captor = ArgumentCaptor.forClass(MapSearchFilter.class);
        verify(searchRepository).searchWithinBounds(captor.capture());
        assertThat(captor.getValue().getLimit()).isEqualTo(50);

        assertThat(response.getCount()).isEqualTo(1);
        assertThat(response.getBounds().getWest()).isEqualTo(27.4);
        assertThat(response.getBounds().getEast()).isEqualTo(27.7);
        assertThat(response.getResults().get(0).getCategory()).isEqualTo("Ресторан");
        assertThat(response.getResults().get(0).getScore()).isEqualByComparingTo("0.812");
    }

    @Test
    void testSearchMap_ConnectionFailure_SurfacesAsUnavailable() {
        when(searchRepository.searchWithinBounds(any()))
                .thenThrow(new CannotGetJdbcConnectionException("pool exhausted"));

        assertThatThrownBy(() -> searchService.searchMap(MapSearchQuery.builder()
                .north("54.0").south("53.8").east("27.7").west("27.4").build()))
                .isInstanceOf(EstablishmentSearchService.SearchUnavailableException.class);
    }

    @Test
    void testCheckHealth_ReportsVersionOrError() {
        when(searchRepository.postgisVersion())
                .thenReturn("3.4 USE_GEOS=1 USE_PROJ=1 USE_STATS=1")
                .thenThrow(new CannotGetJdbcConnectionException("connection refused"));

        SearchHealthDto healthy = searchService.checkHealth();
        SearchHealthDto unhealthy = searchService.checkHealth();

        assertThat(healthy.isHealthy()).isTrue();
        assertThat(healthy.getPostgisVersion()).startsWith("3.4");
        assertThat(unhealthy.isHealthy()).isFalse();
        assertThat(unhealthy.getError()).isEqualTo("connection refused");
        assertThat(unhealthy.getTimestamp()).isNotBlank();
    }

    private static ListSearchQuery.ListSearchQueryBuilder query() {
        return ListSearchQuery.builder().lat("53.9").lon("27.5667");
    }
}
