package com.kmmedia.institute.payments.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import java.util.Locale;

/**
 * Status of a single payment attempt.
 *
 * <p>Stored as its name; exposed on the wire in lower case ({@code "success"}).</p>
 */
public enum PaymentStatus {
    /** Created, waiting for the gateway. */
    PENDING,

    /** Gateway confirmed the charge. */
    SUCCESS,

    /** Gateway reported a failed charge. */
    FAILED,

    /** Payer or gateway abandoned the charge. */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * The only place payment status transitions are decided: PENDING may move to any terminal
     * status, terminal statuses never move.
     *
     * @param target requested status
     * @return {@code target}
     * @throws PaymentException {@link PaymentErrorCode#INVALID_TRANSITION} otherwise
     */
    public PaymentStatus transitionTo(PaymentStatus target) {
        if (this != PENDING || target == PENDING) {
            throw PaymentException.of(PaymentErrorCode.INVALID_TRANSITION,
                    "Payment cannot move from " + wireName() + " to " + target.wireName());
        }
        return target;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PaymentStatus fromWire(String value) {
        return WireEnums.parse(PaymentStatus.class, value);
    }
}
