package com.kmmedia.institute.payments.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Closed set of failures raised by the payment core, each with the HTTP status it maps to.
 */
@Getter
@RequiredArgsConstructor
public enum PaymentErrorCode {

    DUPLICATE_REFERENCE(HttpStatus.CONFLICT, "Payment reference already exists"),
    INVALID_TRANSITION(HttpStatus.CONFLICT, "Status transition is not allowed"),
    UNKNOWN_REFERENCE(HttpStatus.NOT_FOUND, "No payment record for gateway reference"),
    CONFLICTING_TRANSITION(HttpStatus.CONFLICT, "Gateway status conflicts with recorded terminal status"),
    AMOUNT_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY, "Gateway amount does not match expected amount"),
    PLAN_NOT_ACTIVE(HttpStatus.CONFLICT, "Installment plan is not active"),
    PLAN_ALREADY_EXISTS(HttpStatus.CONFLICT, "An active installment plan already exists"),
    OVERPAYMENT_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, "Payment would exceed the remaining balance"),
    ALREADY_PAID(HttpStatus.CONFLICT, "Fee has already been paid"),
    CONCURRENT_UPDATE(HttpStatus.SERVICE_UNAVAILABLE, "Payment is being updated concurrently, retry later"),
    INSTALLMENTS_NOT_OFFERED(HttpStatus.UNPROCESSABLE_ENTITY, "Course does not offer installment plans"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
    UNKNOWN_GATEWAY(HttpStatus.NOT_FOUND, "Payment gateway is not configured"),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED, "Webhook signature is invalid"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Caller identity is missing"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, "Caller is not allowed to perform this operation");

    private final HttpStatus httpStatus;
    private final String defaultMessage;
}
