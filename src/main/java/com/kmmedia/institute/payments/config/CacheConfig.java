package com.kmmedia.institute.payments.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmmedia.institute.payments.service.dto.CachedIdempotencyResponse;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Cache configuration.
 *
 * <p>Only completed payment-initialization responses are cached. Balances, plan state and
 * dashboard figures are always read from Postgres.</p>
 */
@EnableCaching
@Configuration
public class CacheConfig {

    /**
     * Cache name for initialization replay responses.
     */
    public static final String IDEMPOTENCY_CACHE = "initiationResponse";

    /**
     * Redis cache manager with JSON values and a 30 minute TTL for replay responses.
     *
     * <p>Skipped when {@code spring.cache.type} is set to anything but redis, so tests can run
     * with {@code none}.</p>
     *
     * @param factory      redis connection factory
     * @param objectMapper object mapper used for JSON serialization
     * @return cache manager
     */
    @Bean
    @ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
    public RedisCacheManager cacheManager(
            RedisConnectionFactory factory,
            @Qualifier("canonicalObjectMapper") ObjectMapper objectMapper
    ) {
        var typedSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, CachedIdempotencyResponse.class);

        var defaultCfg = RedisCacheConfiguration.defaultCacheConfig()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        var idempotencyCfg = defaultCfg
                .entryTtl(Duration.ofMinutes(30))
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(typedSerializer));

        return RedisCacheManager.builder(factory)
                .cacheDefaults(defaultCfg)
                .withCacheConfiguration(IDEMPOTENCY_CACHE, idempotencyCfg)
                .build();
    }
}
