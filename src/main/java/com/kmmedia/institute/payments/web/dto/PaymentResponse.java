package com.kmmedia.institute.payments.web.dto;

import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.domain.PaymentType;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment record as returned by the student and admin APIs.
 */
public record PaymentResponse(
        String id,
        String reference,
        String userId,
        String courseId,
        BigDecimal amount,
        String currency,
        PaymentType paymentType,
        PaymentStatus status,
        String paymentMethod,
        Integer installmentNumber,
        Integer totalInstallments,
        Instant paidAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static PaymentResponse from(PaymentRecord p) {
        return new PaymentResponse(
                p.getId(),
                p.getReference(),
                p.getUserId(),
                p.getCourseId(),
                p.getAmount(),
                p.getCurrency(),
                p.getPaymentType(),
                p.getStatus(),
                p.getPaymentMethod(),
                p.getInstallmentNumber(),
                p.getTotalInstallments(),
                p.getPaidAt(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
