package com.kmmedia.institute.payments.web.dto;

import com.kmmedia.institute.payments.domain.Registration;
import com.kmmedia.institute.payments.domain.RegistrationStatus;
import java.time.Instant;

public record RegistrationResponse(
        String id,
        String userId,
        String courseId,
        RegistrationStatus status,
        boolean paymentSettled,
        String notes,
        Instant createdAt,
        Instant updatedAt
) {
    public static RegistrationResponse from(Registration r) {
        return new RegistrationResponse(
                r.getId(),
                r.getUserId(),
                r.getCourseId(),
                r.getStatus(),
                r.isPaymentSettled(),
                r.getNotes(),
                r.getCreatedAt(),
                r.getUpdatedAt()
        );
    }
}
