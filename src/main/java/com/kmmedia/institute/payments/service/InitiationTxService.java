package com.kmmedia.institute.payments.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.IdempotencyRecord;
import com.kmmedia.institute.payments.domain.IdempotencyStatus;
import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.repo.IdempotencyRecordRepository;
import com.kmmedia.institute.payments.repo.PaymentRecordRepository;
import com.kmmedia.institute.payments.service.dto.CachedIdempotencyResponse;
import com.kmmedia.institute.payments.service.dto.IdempotentResult;
import com.kmmedia.institute.payments.web.dto.InitiatePaymentRequest;
import com.kmmedia.institute.payments.web.dto.PaymentResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.ErrorResponseException;

/**
 * Transactional executor for idempotent payment initialization.
 *
 * <p>{@code @Transactional} is applied through a proxy, so a call from inside the same bean would
 * not start a transaction. {@link PaymentInitiationService} calls this bean instead.</p>
 *
 * <p>Within one transaction:
 * <ul>
 *   <li>advisory lock on (scope, student, key)</li>
 *   <li>idempotency row locked {@code FOR UPDATE} when present</li>
 *   <li>payment record, outbox event and stored response committed together</li>
 * </ul>
 * </p>
 */
@Slf4j
@Service
public class InitiationTxService {

    private final IdempotencyRecordRepository idempotencyRecordRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final PaymentService paymentService;
    private final ObjectMapper objectMapper;
    private final IdempotencyCacheService cacheService;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final AppProperties properties;

    private final Counter createdCounter;
    private final Counter replayCounter;
    private final Counter conflictCounter;

    public InitiationTxService(
            IdempotencyRecordRepository idempotencyRecordRepository,
            PaymentRecordRepository paymentRecordRepository,
            PaymentService paymentService,
            ObjectMapper objectMapper,
            IdempotencyCacheService cacheService,
            PostgresAdvisoryLockService advisoryLockService,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.idempotencyRecordRepository = idempotencyRecordRepository;
        this.paymentRecordRepository = paymentRecordRepository;
        this.paymentService = paymentService;
        this.objectMapper = objectMapper;
        this.cacheService = cacheService;
        this.advisoryLockService = advisoryLockService;
        this.properties = properties;

        this.createdCounter = Counter.builder("payments.initiation.created").register(meterRegistry);
        this.replayCounter = Counter.builder("payments.initiation.replayed").register(meterRegistry);
        this.conflictCounter = Counter.builder("payments.initiation.conflict").register(meterRegistry);
    }

    /**
     * Initializes a payment under advisory lock and row lock.
     *
     * @param scope          idempotency scope
     * @param userId         student, owner of the key
     * @param idempotencyKey idempotency key
     * @param requestHash    request hash
     * @param request        request payload
     * @return idempotent result
     */
    @Transactional
    public IdempotentResult initiateWithDbLock(String scope, String userId, String idempotencyKey,
                                               String requestHash, InitiatePaymentRequest request) {
        advisoryLockService.lock(scope, userId + "|" + idempotencyKey);

        Optional<IdempotencyRecord> existingLocked = idempotencyRecordRepository.findForUpdate(scope, userId, idempotencyKey);

        if (existingLocked.isPresent()) {
            IdempotencyRecord record = existingLocked.get();

            if (!record.isSameHash(requestHash)) {
                conflictCounter.increment();
                throw conflict(idempotencyKey);
            }

            if (record.getStatus() == IdempotencyStatus.COMPLETED) {
                cacheService.put(scope, userId, idempotencyKey,
                        new CachedIdempotencyResponse(requestHash, record.getHttpStatus(), record.getResponseBody()));
                replayCounter.increment();
                return new IdempotentResult(record.getHttpStatus(), record.getResponseBody(), true);
            }

            if (!record.isStaleInProgress(properties.getIdempotency().getStaleInProgressAfter())) {
                throw inProgress(idempotencyKey);
            }

            log.warn("Recovering stale IN_PROGRESS idempotency record. scope={} userId={} key={}", scope, userId, idempotencyKey);
            record.touch();
            PaymentRecord existingPayment = record.getPaymentReference() == null ? null
                    : paymentRecordRepository.findByReference(record.getPaymentReference()).orElse(null);
            if (existingPayment != null) {
                String responseJson = toJson(PaymentResponse.from(existingPayment));
                record.complete(HttpStatus.CREATED.value(), responseJson, existingPayment.getReference());
                idempotencyRecordRepository.save(record);

                cacheService.put(scope, userId, idempotencyKey,
                        new CachedIdempotencyResponse(requestHash, HttpStatus.CREATED.value(), responseJson));
                replayCounter.increment();
                return new IdempotentResult(HttpStatus.CREATED.value(), responseJson, true);
            }
            // nothing was created, safe to run again
        }

        IdempotencyRecord record = existingLocked.orElseGet(() ->
                idempotencyRecordRepository.saveAndFlush(IdempotencyRecord.inProgress(scope, userId, idempotencyKey, requestHash)));

        PaymentResponse response = paymentService.initiate(userId, request);

        String responseJson = toJson(response);
        record.complete(HttpStatus.CREATED.value(), responseJson, response.reference());
        idempotencyRecordRepository.save(record);

        cacheService.put(scope, userId, idempotencyKey,
                new CachedIdempotencyResponse(requestHash, HttpStatus.CREATED.value(), responseJson));
        createdCounter.increment();
        log.info("Payment initialized. userId={} key={} reference={} type={}",
                userId, idempotencyKey, response.reference(), response.paymentType());
        return new IdempotentResult(HttpStatus.CREATED.value(), responseJson, false);
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize response for idempotency storage", e);
        }
    }

    static ErrorResponseException conflict(String idempotencyKey) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT,
                "Idempotency key '" + idempotencyKey + "' was already used with a different request payload.");
        return new ErrorResponseException(HttpStatus.CONFLICT, pd, null);
    }

    private ErrorResponseException inProgress(String idempotencyKey) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT,
                "Idempotency key '" + idempotencyKey + "' is currently being processed. Please retry with the same key.");
        return new ErrorResponseException(HttpStatus.CONFLICT, pd, null);
    }
}
