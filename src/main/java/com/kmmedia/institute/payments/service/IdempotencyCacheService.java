package com.kmmedia.institute.payments.service;

import static com.kmmedia.institute.payments.config.CacheConfig.IDEMPOTENCY_CACHE;

import com.kmmedia.institute.payments.service.dto.CachedIdempotencyResponse;
import org.springframework.cache.annotation.CachePut;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Redis-backed cache of completed initialization responses.
 *
 * <p>Postgres remains the source of truth; cache misses fall back to the idempotency table.
 * Entries are keyed by scope, student and idempotency key.</p>
 */
@Service
public class IdempotencyCacheService {

    /**
     * @param scope          operation scope
     * @param ownerId        student id
     * @param idempotencyKey idempotency key
     * @return cached response or null
     */
    @Cacheable(cacheNames = IDEMPOTENCY_CACHE, key = "#scope + ':' + #ownerId + ':' + #idempotencyKey", unless = "#result == null")
    public CachedIdempotencyResponse get(String scope, String ownerId, String idempotencyKey) {
        return null; // body only runs on a cache miss
    }

    /**
     * @param scope          operation scope
     * @param ownerId        student id
     * @param idempotencyKey idempotency key
     * @param response       response to cache
     * @return response
     */
    @CachePut(cacheNames = IDEMPOTENCY_CACHE, key = "#scope + ':' + #ownerId + ':' + #idempotencyKey")
    public CachedIdempotencyResponse put(String scope, String ownerId, String idempotencyKey, CachedIdempotencyResponse response) {
        return response;
    }
}
