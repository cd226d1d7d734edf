package com.kmmedia.institute.payments.service.dto;

import com.kmmedia.institute.payments.domain.PaymentStatus;

/**
 * What handling a webhook did.
 *
 * @param reference payment reference
 * @param status    payment status after handling
 * @param applied   true when this delivery changed state
 * @param replayed  true when the record was already in the reported terminal status
 */
public record WebhookOutcome(String reference, PaymentStatus status, boolean applied, boolean replayed) {

    public static WebhookOutcome applied(String reference, PaymentStatus status) {
        return new WebhookOutcome(reference, status, true, false);
    }

    public static WebhookOutcome replayed(String reference, PaymentStatus status) {
        return new WebhookOutcome(reference, status, false, true);
    }

    public static WebhookOutcome acknowledged(String reference, PaymentStatus status) {
        return new WebhookOutcome(reference, status, false, false);
    }
}
