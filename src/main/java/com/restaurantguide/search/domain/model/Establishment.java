package com.restaurantguide.search.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A place of business listed in the guide.
 *
 * The {@code location} geography column is generated by the database from
 * latitude/longitude and is not mapped here.
 */
@Entity
@Table(name = "establishments")
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class Establishment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "city", nullable = false, length = 50)
    private String city;

    @Column(name = "address")
    private String address;

    @Column(name = "latitude", nullable = false, precision = 9, scale = 6)
    private BigDecimal latitude;

    @Column(name = "longitude", nullable = false, precision = 9, scale = 6)
    private BigDecimal longitude;

    @Column(name = "categories", nullable = false, columnDefinition = "varchar(50)[]")
    private String[] categories = new String[0];

    @Column(name = "cuisines", nullable = false, columnDefinition = "varchar(50)[]")
    private String[] cuisines = new String[0];

    @Column(name = "features", nullable = false, columnDefinition = "varchar(50)[]")
    private String[] features = new String[0];

    @Column(name = "price_range", length = 5)
    private String priceRange;

    @Column(name = "opens_at")
    private LocalTime opensAt;

    @Column(name = "closes_at")
    private LocalTime closesAt;

    @Column(name = "open_24_hours", nullable = false)
    private boolean open24Hours;

    @Column(name = "average_rating", precision = 3, scale = 2)
    private BigDecimal averageRating;

    @Column(name = "review_count", nullable = false)
    private int reviewCount;

    @Column(name = "subscription_tier", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private SubscriptionTier subscriptionTier = SubscriptionTier.FREE;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private EstablishmentStatus status = EstablishmentStatus.DRAFT;

    @Column(name = "primary_image_url", length = 1000)
    private String primaryImageUrl;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    // Constructor for creating new establishments
    public Establishment(String name, City city, BigDecimal latitude, BigDecimal longitude) {
        this.name = name;
        this.city = city.getLabel();
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Fallback for environments where auditing is not wired.
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
