package com.kmmedia.institute.payments.service.dto;

/**
 * Completed initialization response kept in Redis.
 *
 * @param requestHash      request hash used for validation
 * @param httpStatus       http status code
 * @param responseBodyJson stored response body
 */
public record CachedIdempotencyResponse(String requestHash, int httpStatus, String responseBodyJson) {}
