package com.restaurantguide.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ListSearchResponseDto {

    @JsonProperty("center")
    private CenterDto center;

    @JsonProperty("pageSize")
    private int pageSize;

    @JsonProperty("results")
    private List<RankedEstablishmentDto> results;

    /** Omitted on the last page. */
    @JsonProperty("nextCursor")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String nextCursor;

    @JsonProperty("cursorReset")
    private boolean cursorReset;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CenterDto {
        @JsonProperty("lat")
        private double lat;

        @JsonProperty("lng")
        private double lng;

        @JsonProperty("radiusMeters")
        private int radiusMeters;
    }
}
