package com.restaurantguide.search.application.service;

import com.restaurantguide.search.api.dto.EstablishmentDetailDto;
import com.restaurantguide.search.application.mapper.EstablishmentMapper;
import com.restaurantguide.search.application.port.in.GetEstablishmentUseCase;
import com.restaurantguide.search.application.port.out.EstablishmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Application service for the establishment detail view.
 * Implements cache-first strategy with database fallback. Lookups never write
 * to the establishments table.
 *
 * <p>Status is checked only when the cache is filled. Status changes happen outside
 * this service and nothing here evicts on them, so an establishment that is suspended
 * or archived after its detail was cached stays visible until the entry expires
 * ({@code CACHE_TTL_SECONDS}, 600 seconds by default). Search results are not affected:
 * they always read status from the database.
 */
@Service
public class EstablishmentDetailService implements GetEstablishmentUseCase {

    public static final String CACHE_NAME = "establishments";

    private static final Logger logger = LoggerFactory.getLogger(EstablishmentDetailService.class);

    private final EstablishmentRepository establishmentRepository;
    private final CacheManager cacheManager;
    private final EstablishmentMapper establishmentMapper;

    public EstablishmentDetailService(
            EstablishmentRepository establishmentRepository,
            CacheManager cacheManager,
            EstablishmentMapper establishmentMapper) {
        this.establishmentRepository = establishmentRepository;
        this.cacheManager = cacheManager;
        this.establishmentMapper = establishmentMapper;
    }

    /**
     * Load an establishment detail.
     * Strategy: Cache-first → DB fallback → populate cache
     *
     * @param id establishment identifier
     * @return detail of an ACTIVE establishment
     * @throws EstablishmentNotFoundException if no active establishment has this id
     */
    @Override
    public EstablishmentDetailDto getEstablishment(UUID id) {
        String cacheKey = id.toString();

        EstablishmentDetailDto detail = getFromCache(cacheKey).orElse(null);
        if (detail == null) {
            logger.debug("Establishment cache miss for key: {}", cacheKey);
            detail = establishmentRepository.findActiveById(id)
                    .map(establishmentMapper::toDetailDto)
                    .orElseThrow(() -> new EstablishmentNotFoundException(id));
            putInCache(cacheKey, detail);
        } else {
            logger.debug("Establishment cache hit for key: {}", cacheKey);
        }

        return detail;
    }

    /**
     * Gracefully handles cache unavailability (e.g., Redis connection failures).
     */
    private Optional<EstablishmentDetailDto> getFromCache(String cacheKey) {
        try {
            Cache cache = cacheManager.getCache(CACHE_NAME);
            if (cache != null) {
                Cache.ValueWrapper wrapper = cache.get(cacheKey);
                if (wrapper != null && wrapper.get() instanceof EstablishmentDetailDto cached) {
                    return Optional.of(cached);
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to get establishment from cache, continuing without cache: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void putInCache(String cacheKey, EstablishmentDetailDto detail) {
        try {
            Cache cache = cacheManager.getCache(CACHE_NAME);
            if (cache != null) {
                cache.put(cacheKey, detail);
                logger.debug("Establishment cache populated for key: {}", cacheKey);
            }
        } catch (Exception e) {
            logger.warn("Failed to populate establishment cache, continuing without cache: {}", e.getMessage());
        }
    }

    public static class EstablishmentNotFoundException extends RuntimeException {
        public EstablishmentNotFoundException(UUID id) {
            super("Establishment not found: " + id);
        }
    }
}
