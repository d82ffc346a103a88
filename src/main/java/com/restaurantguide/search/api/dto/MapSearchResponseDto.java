package com.restaurantguide.search.api.dto;

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
public class MapSearchResponseDto {

    @JsonProperty("bounds")
    private BoundsDto bounds;

    @JsonProperty("count")
    private int count;

    @JsonProperty("results")
    private List<MapMarkerDto> results;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BoundsDto {
        @JsonProperty("north")
        private double north;

        @JsonProperty("south")
        private double south;

        @JsonProperty("east")
        private double east;

        @JsonProperty("west")
        private double west;
    }
}
