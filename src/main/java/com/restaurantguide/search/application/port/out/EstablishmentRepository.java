package com.restaurantguide.search.application.port.out;

import com.restaurantguide.search.domain.model.Establishment;

import java.util.Optional;
import java.util.UUID;

/**
 * Output port for establishment persistence.
 */
public interface EstablishmentRepository {

  /**
   * Find an establishment visible to the public (status ACTIVE).
   */
  Optional<Establishment> findActiveById(UUID id);

  /**
   * Save an establishment.
   */
  <S extends Establishment> S save(S establishment);

  /**
   * Count all establishments.
   */
  long count();
}
