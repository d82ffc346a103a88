package com.restaurantguide.search.application.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One failed check on one request parameter.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class FieldViolation {

    @JsonProperty("field")
    private final String field;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("rejectedValue")
    private final String rejectedValue;

    /** For enumerated filters: the individual values that are not part of the set. */
    @JsonProperty("invalidValues")
    private final List<String> invalidValues;

    public FieldViolation(String field, String message, String rejectedValue) {
        this(field, message, rejectedValue, List.of());
    }
}
