package com.kmmedia.institute.payments.web.dto;

import com.kmmedia.institute.payments.domain.PaymentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request payload for starting a gateway charge. The amount is never taken from the client.
 */
public record InitiatePaymentRequest(
        @NotBlank @Size(max = 64) String courseId,
        @NotNull PaymentType paymentType,
        @Size(max = 32) String paymentMethod
) {}
