package com.restaurantguide.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchHealthDto {

    @JsonProperty("healthy")
    private boolean healthy;

    @JsonProperty("postgis")
    private String postgisVersion;

    @JsonProperty("error")
    private String error;

    @JsonProperty("timestamp")
    private String timestamp;
}
