package com.restaurantguide.search.application.port.in;

import com.restaurantguide.search.api.dto.EstablishmentDetailDto;

import java.util.UUID;

/**
 * Input port for the public establishment detail view.
 */
public interface GetEstablishmentUseCase {

  /**
   * Load an active establishment and record the view.
   * Strategy: Cache-first → DB fallback → populate cache
   *
   * @param id establishment identifier
   * @return full establishment detail
   */
  EstablishmentDetailDto getEstablishment(UUID id);
}
