package com.restaurantguide.search.infrastructure.persistence.query;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single SQL statement with its named parameters, ready for
 * {@code NamedParameterJdbcTemplate}.
 */
@Getter
@ToString
public class ComposedQuery {

    private final String sql;
    private final Map<String, Object> parameters;

    public ComposedQuery(String sql, Map<String, Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
