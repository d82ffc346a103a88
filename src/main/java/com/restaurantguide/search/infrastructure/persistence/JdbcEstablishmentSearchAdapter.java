package com.restaurantguide.search.infrastructure.persistence;

import com.restaurantguide.search.application.port.out.EstablishmentSearchRepository;
import com.restaurantguide.search.domain.model.ListSearchFilter;
import com.restaurantguide.search.domain.model.MapSearchFilter;
import com.restaurantguide.search.domain.model.RankedResult;
import com.restaurantguide.search.domain.model.SubscriptionTier;
import com.restaurantguide.search.infrastructure.persistence.query.ComposedQuery;
import com.restaurantguide.search.infrastructure.persistence.query.EstablishmentSearchQueryComposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * JDBC implementation of the EstablishmentSearchRepository output port.
 * Runs the statements built by {@link EstablishmentSearchQueryComposer}.
 */
@Repository
public class JdbcEstablishmentSearchAdapter implements EstablishmentSearchRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEstablishmentSearchAdapter.class);

    private static final RowMapper<RankedResult> LIST_ROW_MAPPER = (rs, rowNum) -> RankedResult.builder()
            .id(rs.getObject("id", UUID.class))
            .name(rs.getString("name"))
            .lat(rs.getBigDecimal("latitude").doubleValue())
            .lng(rs.getBigDecimal("longitude").doubleValue())
            .city(rs.getString("city"))
            .address(rs.getString("address"))
            .categories(stringList(rs, "categories"))
            .cuisines(stringList(rs, "cuisines"))
            .priceRange(rs.getString("price_range"))
            .averageRating(rs.getBigDecimal("average_rating"))
            .reviewCount(rs.getInt("review_count"))
            .subscriptionTier(SubscriptionTier.valueOf(rs.getString("subscription_tier")))
            .primaryImageUrl(rs.getString("primary_image_url"))
            .distanceMeters(rs.getDouble("distance_meters"))
            .score(rs.getBigDecimal("score"))
            .build();

    private static final RowMapper<RankedResult> MAP_ROW_MAPPER = (rs, rowNum) -> RankedResult.builder()
            .id(rs.getObject("id", UUID.class))
            .name(rs.getString("name"))
            .lat(rs.getBigDecimal("latitude").doubleValue())
            .lng(rs.getBigDecimal("longitude").doubleValue())
            .categories(stringList(rs, "categories"))
            .averageRating(rs.getBigDecimal("average_rating"))
            .score(rs.getBigDecimal("score"))
            .build();

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final EstablishmentSearchQueryComposer queryComposer;

    public JdbcEstablishmentSearchAdapter(
            NamedParameterJdbcTemplate jdbcTemplate,
            EstablishmentSearchQueryComposer queryComposer) {
        this.jdbcTemplate = jdbcTemplate;
        this.queryComposer = queryComposer;
    }

    @Override
    @Transactional(readOnly = true)
    public List<RankedResult> searchWithinRadius(ListSearchFilter filter, int fetchSize) {
        ComposedQuery query = queryComposer.composeListQuery(filter, fetchSize);
        logger.debug("Executing radius search: {}", query.getParameters());
        return jdbcTemplate.query(query.getSql(), query.getParameters(), LIST_ROW_MAPPER);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RankedResult> searchWithinBounds(MapSearchFilter filter) {
        ComposedQuery query = queryComposer.composeMapQuery(filter);
        logger.debug("Executing bounding box search: {}", query.getParameters());
        return jdbcTemplate.query(query.getSql(), query.getParameters(), MAP_ROW_MAPPER);
    }

    @Override
    public String postgisVersion() {
        return jdbcTemplate.getJdbcTemplate().queryForObject("SELECT PostGIS_Version()", String.class);
    }

    private static List<String> stringList(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) {
            return List.of();
        }
        try {
            return Arrays.asList((String[]) array.getArray());
        } finally {
            array.free();
        }
    }
}
