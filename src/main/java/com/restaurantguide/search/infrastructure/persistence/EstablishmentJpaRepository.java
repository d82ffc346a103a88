package com.restaurantguide.search.infrastructure.persistence;

import com.restaurantguide.search.application.port.out.EstablishmentRepository;
import com.restaurantguide.search.domain.model.Establishment;
import com.restaurantguide.search.domain.model.EstablishmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * JPA implementation of EstablishmentRepository output port.
 */
@Repository
public interface EstablishmentJpaRepository extends JpaRepository<Establishment, UUID>, EstablishmentRepository {

    Optional<Establishment> findByIdAndStatus(UUID id, EstablishmentStatus status);

    @Override
    default Optional<Establishment> findActiveById(UUID id) {
        return findByIdAndStatus(id, EstablishmentStatus.ACTIVE);
    }
}
