package com.restaurantguide.search.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Resume position for keyset pagination: the sort key of the last row served
 * plus a fingerprint of the search it belongs to.
 */
@Getter
@EqualsAndHashCode
@ToString
public class SearchCursor {

    public static final int SCORE_SCALE = 6;

    private final BigDecimal score;
    private final UUID id;
    private final long filterFingerprint;

    public SearchCursor(BigDecimal score, UUID id, long filterFingerprint) {
        if (score == null || id == null) {
            throw new IllegalArgumentException("Cursor score and id must not be null");
        }
        this.score = score.setScale(SCORE_SCALE, RoundingMode.HALF_UP);
        this.id = id;
        this.filterFingerprint = filterFingerprint;
    }

    public boolean belongsTo(long fingerprint) {
        return filterFingerprint == fingerprint;
    }
}
