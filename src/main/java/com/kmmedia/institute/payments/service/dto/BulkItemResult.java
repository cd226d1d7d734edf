package com.kmmedia.institute.payments.service.dto;

import com.kmmedia.institute.payments.domain.RegistrationStatus;

/**
 * Outcome of one id in a bulk registration status change.
 *
 * @param registrationId registration id
 * @param success        whether the change was applied
 * @param status         status after the attempt, null when the registration does not exist
 * @param errorCode      failure code, null on success
 * @param message        failure message, null on success
 */
public record BulkItemResult(
        String registrationId,
        boolean success,
        RegistrationStatus status,
        String errorCode,
        String message
) {
    public static BulkItemResult ok(String registrationId, RegistrationStatus status) {
        return new BulkItemResult(registrationId, true, status, null, null);
    }

    public static BulkItemResult failed(String registrationId, RegistrationStatus status, String errorCode, String message) {
        return new BulkItemResult(registrationId, false, status, errorCode, message);
    }
}
