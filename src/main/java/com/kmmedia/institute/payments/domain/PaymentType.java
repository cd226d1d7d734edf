package com.kmmedia.institute.payments.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * What a payment attempt pays for.
 */
public enum PaymentType {
    /** One-time upfront charge required before enrollment. */
    APPLICATION_FEE,

    /** The whole course fee in a single charge. */
    COURSE_FEE,

    /** One installment of an {@link InstallmentPlan}. */
    INSTALLMENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PaymentType fromWire(String value) {
        return WireEnums.parse(PaymentType.class, value);
    }
}
