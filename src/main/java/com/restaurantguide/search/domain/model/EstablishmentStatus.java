package com.restaurantguide.search.domain.model;

/**
 * Moderation lifecycle status. Only {@link #ACTIVE} establishments are visible to search.
 */
public enum EstablishmentStatus {
    DRAFT,
    PENDING,
    ACTIVE,
    REJECTED,
    SUSPENDED,
    ARCHIVED
}
