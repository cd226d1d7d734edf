package com.kmmedia.institute.payments.service.dto;

import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.domain.PaymentType;
import java.time.LocalDate;

/**
 * Admin payment list filter; null fields are ignored.
 *
 * @param status      payment status
 * @param paymentType payment type
 * @param userId      student id
 * @param courseId    course id
 * @param from        first creation day (UTC), inclusive
 * @param to          last creation day (UTC), inclusive
 */
public record PaymentFilter(
        PaymentStatus status,
        PaymentType paymentType,
        String userId,
        String courseId,
        LocalDate from,
        LocalDate to
) {
    public static PaymentFilter none() {
        return new PaymentFilter(null, null, null, null, null, null);
    }
}
