package com.kmmedia.institute.payments.service.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted when a gateway webhook moves a payment record to a terminal status.
 */
public record PaymentReconciledEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String paymentId,
        String reference,
        String userId,
        String courseId,
        BigDecimal amount,
        String currency,
        String paymentType,
        String previousStatus,
        String status,
        String gateway
) {}
