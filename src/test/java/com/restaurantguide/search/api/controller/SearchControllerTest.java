package com.restaurantguide.search.api.controller;

import com.restaurantguide.search.api.dto.EstablishmentDetailDto;
import com.restaurantguide.search.api.dto.ListSearchResponseDto;
import com.restaurantguide.search.api.dto.SearchHealthDto;
import com.restaurantguide.search.application.dto.ListSearchQuery;
import com.restaurantguide.search.application.dto.MapSearchQuery;
import com.restaurantguide.search.application.port.in.GetEstablishmentUseCase;
import com.restaurantguide.search.application.port.in.SearchEstablishmentsUseCase;
import com.restaurantguide.search.application.service.EstablishmentDetailService;
import com.restaurantguide.search.application.service.EstablishmentSearchService;
import com.restaurantguide.search.application.validation.FieldViolation;
import com.restaurantguide.search.application.validation.SearchValidationException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SearchEstablishmentsUseCase searchEstablishmentsUseCase;

    @MockBean
    private GetEstablishmentUseCase getEstablishmentUseCase;

    @Test
    void testSearchEstablishments_SnakeCaseParams_ReachQuery() throws Exception {
        when(searchEstablishmentsUseCase.searchList(any())).thenReturn(new ListSearchResponseDto(
                new ListSearchResponseDto.CenterDto(53.9, 27.5667, 1000), 5, List.of(), null, false));

        mockMvc.perform(get("/api/v1/search/establishments")
                        .param("lat", "53.9")
                        .param("lon", "27.5667")
                        .param("radius", "1000")
                        .param("category", "Ресторан,Бар")
                        .param("price_range", "$$")
                        .param("hours_filter", "24_hours")
                        .param("min_rating", "4.0")
                        .param("page_size", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.center.radiusMeters").value(1000))
                .andExpect(jsonPath("$.pageSize").value(5))
                .andExpect(jsonPath("$.results").isArray())
                .andExpect(jsonPath("$.nextCursor").doesNotExist())
                .andExpect(jsonPath("$.cursorReset").value(false));

        ArgumentCaptor<ListSearchQuery> captor = ArgumentCaptor.forClass(ListSearchQuery.class);
        verify(searchEstablishmentsUseCase).searchList(captor.capture());
        ListSearchQuery query = captor.getValue();
        assertThat(query.getLat()).isEqualTo("53.9");
        assertThat(query.getPageSize()).isEqualTo("5");
        assertThat(query.getFilters().getCategory()).isEqualTo("Ресторан,Бар");
        assertThat(query.getFilters().getPriceRange()).isEqualTo("$$");
        assertThat(query.getFilters().getHoursFilter()).isEqualTo("24_hours");
        assertThat(query.getFilters().getMinRating()).isEqualTo("4.0");
    }

    @Test
    void testSearchEstablishments_ValidationFailure_Returns422WithEveryField() throws Exception {
        when(searchEstablishmentsUseCase.searchList(any())).thenThrow(new SearchValidationException(List.of(
                new FieldViolation("lat", "Latitude is required", null),
                new FieldViolation("category", "Invalid categories: Бистро", "Бистро", List.of("Бистро")))));

        mockMvc.perform(get("/api/v1/search/establishments")
                        .param("lon", "27.5667")
                        .param("category", "Бистро"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fieldErrors.length()").value(2))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("lat"))
                .andExpect(jsonPath("$.fieldErrors[1].field").value("category"))
                .andExpect(jsonPath("$.fieldErrors[1].invalidValues[0]").value("Бистро"));
    }

    @Test
    void testSearchEstablishments_StoreUnavailable_Returns503Retryable() throws Exception {
        when(searchEstablishmentsUseCase.searchList(any())).thenThrow(
                new EstablishmentSearchService.SearchUnavailableException("Search is temporarily unavailable, please retry"));

        mockMvc.perform(get("/api/v1/search/establishments")
                        .param("lat", "53.9")
                        .param("lon", "27.5667"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("SEARCH_UNAVAILABLE"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void testSearchMap_PassesBoundsAndLimit() throws Exception {
        when(searchEstablishmentsUseCase.searchMap(any())).thenReturn(null);

        mockMvc.perform(get("/api/v1/search/map")
                        .param("north", "54.0")
                        .param("south", "53.8")
                        .param("east", "27.7")
                        .param("west", "27.4")
                        .param("limit", "50")
                        .param("city", "Минск"))
                .andExpect(status().isOk());

        ArgumentCaptor<MapSearchQuery> captor = ArgumentCaptor.forClass(MapSearchQuery.class);
        verify(searchEstablishmentsUseCase).searchMap(captor.capture());
        assertThat(captor.getValue().getNorth()).isEqualTo("54.0");
        assertThat(captor.getValue().getWest()).isEqualTo("27.4");
        assertThat(captor.getValue().getLimit()).isEqualTo("50");
        assertThat(captor.getValue().getFilters().getCity()).isEqualTo("Минск");
    }

    @Test
    void testGetEstablishment_Found_Returns200() throws Exception {
        UUID id = UUID.randomUUID();
        EstablishmentDetailDto detail = new EstablishmentDetailDto();
        detail.setId(id);
        detail.setName("Васильки");
        detail.setRating(new BigDecimal("4.60"));
        when(getEstablishmentUseCase.getEstablishment(id)).thenReturn(detail);

        mockMvc.perform(get("/api/v1/search/establishments/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.name").value("Васильки"));
    }

    @Test
    void testGetEstablishment_Unknown_Returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(getEstablishmentUseCase.getEstablishment(id))
                .thenThrow(new EstablishmentDetailService.EstablishmentNotFoundException(id));

        mockMvc.perform(get("/api/v1/search/establishments/" + id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void testGetEstablishment_MalformedId_Returns400() throws Exception {
        mockMvc.perform(get("/api/v1/search/establishments/not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PARAMETER"))
                .andExpect(jsonPath("$.parameter").value("id"));
    }

    @Test
    void testHealth_PostgisAnswers_Returns200() throws Exception {
        when(searchEstablishmentsUseCase.checkHealth())
                .thenReturn(new SearchHealthDto(true, "3.4 USE_GEOS=1", null, "2026-01-01T00:00:00Z"));

        mockMvc.perform(get("/api/v1/search/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(true))
                .andExpect(jsonPath("$.postgis").value("3.4 USE_GEOS=1"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void testHealth_PostgisDown_Returns503() throws Exception {
        when(searchEstablishmentsUseCase.checkHealth())
                .thenReturn(new SearchHealthDto(false, null, "connection refused", "2026-01-01T00:00:00Z"));

        mockMvc.perform(get("/api/v1/search/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.healthy").value(false))
                .andExpect(jsonPath("$.error").value("connection refused"));
    }

    @Test
    void testUnexpectedFailure_Returns500WithoutDetails() throws Exception {
        when(searchEstablishmentsUseCase.checkHealth()).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/v1/search/health"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
