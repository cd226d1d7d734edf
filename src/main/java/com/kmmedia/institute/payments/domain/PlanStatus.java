package com.kmmedia.institute.payments.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Installment plan lifecycle. DEFAULTED and CANCELLED are set by processes outside this service.
 */
public enum PlanStatus {
    ACTIVE,
    COMPLETED,
    DEFAULTED,
    CANCELLED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PlanStatus fromWire(String value) {
        return WireEnums.parse(PlanStatus.class, value);
    }
}
