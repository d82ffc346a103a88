package com.restaurantguide.search.infrastructure.cache;

import com.restaurantguide.search.application.service.EstablishmentDetailService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis cache for the establishment detail endpoint.
 *
 * <p>Entries live under {@code search:establishments::<uuid>} as JSON and expire after
 * {@code CACHE_TTL_SECONDS} (600 by default). Nothing evicts them when an establishment is
 * edited or deactivated, so the TTL is the longest a stale detail can be served.
 * Unknown ids are not cached. Search results are never cached: they depend on the caller's
 * position and filters and are always computed by PostGIS.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    @Value("${CACHE_TTL_SECONDS:600}")
    private long cacheTtlSeconds;

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory redisConnectionFactory) {
        RedisCacheConfiguration cacheConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofSeconds(cacheTtlSeconds))
            .prefixCacheNameWith("search:")
            .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
            .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(new GenericJackson2JsonRedisSerializer()))
            .disableCachingNullValues();

        return RedisCacheManager.builder(redisConnectionFactory)
            .cacheDefaults(cacheConfig)
            .withCacheConfiguration(EstablishmentDetailService.CACHE_NAME, cacheConfig)
            .build();
    }
}
