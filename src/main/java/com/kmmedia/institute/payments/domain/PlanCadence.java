package com.kmmedia.institute.payments.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.LocalDate;
import java.time.Period;
import java.util.Locale;

/**
 * How often installments fall due.
 */
public enum PlanCadence {
    WEEKLY(Period.ofWeeks(1)),
    MONTHLY(Period.ofMonths(1)),
    QUARTERLY(Period.ofMonths(3));

    private final Period period;

    PlanCadence(Period period) {
        this.period = period;
    }

    /**
     * @param from current due date
     * @return the following due date
     */
    public LocalDate advance(LocalDate from) {
        return from.plus(period);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PlanCadence fromWire(String value) {
        return WireEnums.parse(PlanCadence.class, value);
    }
}
