package com.kmmedia.institute.payments.service.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted when a PENDING payment record is created for a gateway charge.
 *
 * <p>Stored in the outbox and later published to Kafka.</p>
 */
public record PaymentInitiatedEvent(
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
        Integer installmentNumber
) {}
