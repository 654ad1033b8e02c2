package com.hostelbooking.inventory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostelbooking.common.util.Constants;
import com.hostelbooking.inventory.domain.availability.AvailabilityResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;

import java.time.Duration;

/**
 * Short-lived Redis cache for availability answers. Every ledger write evicts it; the TTL bounds
 * staleness in between.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory,
                                     ObjectMapper objectMapper,
                                     @Value("${inventory.availability.cache-ttl-seconds:30}") long ttlSeconds) {
        RedisCacheConfiguration availability = RedisCacheConfiguration.defaultCacheConfig()
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(
                        new Jackson2JsonRedisSerializer<>(objectMapper, AvailabilityResult.class)))
                .entryTtl(Duration.ofSeconds(ttlSeconds))
                .disableCachingNullValues();

        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(availability)
                .withCacheConfiguration(Constants.AVAILABILITY_CACHE, availability)
                .build();
    }
}
