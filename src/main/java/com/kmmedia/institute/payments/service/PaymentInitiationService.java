package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.service.dto.CachedIdempotencyResponse;
import com.kmmedia.institute.payments.service.dto.IdempotentResult;
import com.kmmedia.institute.payments.web.dto.InitiatePaymentRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Idempotent payment initialization.
 *
 * <ol>
 *   <li>Compute the request hash</li>
 *   <li>Check the Redis cache</li>
 *   <li>Otherwise run {@link InitiationTxService} under Postgres locks: replay a completed record,
 *       reject a different body with 409, or create the payment and store the response</li>
 * </ol>
 */
@Service
public class PaymentInitiationService {

    private final RequestHashService requestHashService;
    private final IdempotencyCacheService cacheService;
    private final InitiationTxService txService;
    private final AppProperties properties;

    private final Counter replayCounter;
    private final Counter conflictCounter;

    public PaymentInitiationService(
            RequestHashService requestHashService,
            IdempotencyCacheService cacheService,
            InitiationTxService txService,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.requestHashService = requestHashService;
        this.cacheService = cacheService;
        this.txService = txService;
        this.properties = properties;

        this.replayCounter = Counter.builder("payments.initiation.replayed").register(meterRegistry);
        this.conflictCounter = Counter.builder("payments.initiation.conflict").register(meterRegistry);
    }

    /**
     * Initializes a payment idempotently.
     *
     * @param userId         student
     * @param idempotencyKey key
     * @param request        request payload
     * @return result containing HTTP status, response JSON and replay flag
     */
    public IdempotentResult initiate(String userId, String idempotencyKey, InitiatePaymentRequest request) {
        String scope = properties.getIdempotency().getInitiationScope();
        String requestHash = requestHashService.hash(request);

        CachedIdempotencyResponse cached = cacheService.get(scope, userId, idempotencyKey);
        if (cached != null) {
            if (!cached.requestHash().equals(requestHash)) {
                conflictCounter.increment();
                throw InitiationTxService.conflict(idempotencyKey);
            }
            replayCounter.increment();
            return new IdempotentResult(cached.httpStatus(), cached.responseBodyJson(), true);
        }

        return txService.initiateWithDbLock(scope, userId, idempotencyKey, requestHash, request);
    }
}
