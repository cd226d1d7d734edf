package com.kmmedia.institute.payments.service.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Completion signal of an installment plan.
 *
 * <p>Written to the outbox and also published in-process, inside the transaction that paid the
 * last installment, so the registration can complete atomically with the payment.</p>
 */
public record InstallmentPlanCompletedEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String planId,
        String userId,
        String courseId,
        BigDecimal totalCourseFee,
        int paidInstallments
) {}
