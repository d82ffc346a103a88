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
 * Typed list view parameters, range-checked with Bean Validation after parsing.
 */
@Getter
@Setter
class ListSearchCriteria {

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
    private BigDecimal lat;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
    private BigDecimal lon;

    @Min(value = 100, message = "Radius must be between 100 meters and 50 kilometers")
    @Max(value = 50000, message = "Radius must be between 100 meters and 50 kilometers")
    private Integer radius;

    @Min(value = 1, message = "Page size must be between 1 and 100")
    @Max(value = 100, message = "Page size must be between 1 and 100")
    private Integer pageSize;

    @DecimalMin(value = "1.0", message = "Minimum rating must be between 1 and 5")
    @DecimalMax(value = "5.0", message = "Minimum rating must be between 1 and 5")
    private BigDecimal minRating;
}
