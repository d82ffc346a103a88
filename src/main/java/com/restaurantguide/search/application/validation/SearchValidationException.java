package com.restaurantguide.search.application.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a search request fails validation. Carries every violation
 * found, not just the first.
 */
public class SearchValidationException extends RuntimeException {

    private final transient List<FieldViolation> violations;

    public SearchValidationException(List<FieldViolation> violations) {
        super("Request validation failed: " + violations.stream()
                .map(v -> v.getField() + " - " + v.getMessage())
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
