package com.kmmedia.institute.payments.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Status reported by the payment gateway in a webhook event.
 */
public enum GatewayStatus {
    SUCCESS,
    FAILED,
    CANCELLED,
    /** Informational; the charge is still in flight. */
    PENDING;

    /**
     * @return the payment status this event asks for
     */
    public PaymentStatus toPaymentStatus() {
        return switch (this) {
            case SUCCESS -> PaymentStatus.SUCCESS;
            case FAILED -> PaymentStatus.FAILED;
            case CANCELLED -> PaymentStatus.CANCELLED;
            case PENDING -> PaymentStatus.PENDING;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GatewayStatus fromWire(String value) {
        return WireEnums.parse(GatewayStatus.class, value);
    }
}
