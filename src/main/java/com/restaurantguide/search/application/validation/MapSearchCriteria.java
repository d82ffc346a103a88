package com.restaurantguide.search.application.validation;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Typed map view parameters. Cross-field rules on the box are checked by the validator.
 */
@Getter
@Setter
class MapSearchCriteria {

    @NotNull(message = "North boundary is required")
    @DecimalMin(value = "-90.0", message = "North boundary must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "North boundary must be between -90 and 90")
    private BigDecimal north;

    @NotNull(message = "South boundary is required")
    @DecimalMin(value = "-90.0", message = "South boundary must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "South boundary must be between -90 and 90")
    private BigDecimal south;

    @NotNull(message = "East boundary is required")
    @DecimalMin(value = "-180.0", message = "East boundary must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "East boundary must be between -180 and 180")
    private BigDecimal east;

    @NotNull(message = "West boundary is required")
    @DecimalMin(value = "-180.0", message = "West boundary must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "West boundary must be between -180 and 180")
    private BigDecimal west;

    @Min(value = 1, message = "Limit must be between 1 and 500")
    @Max(value = 500, message = "Limit must be between 1 and 500")
    private Integer limit;

    @DecimalMin(value = "1.0", message = "Minimum rating must be between 1 and 5")
    @DecimalMax(value = "5.0", message = "Minimum rating must be between 1 and 5")
    private BigDecimal minRating;
}
