package com.kmmedia.institute.payments.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Course registration lifecycle.
 *
 * <p>Admins move registrations between PENDING, APPROVED and REJECTED; only settled payments move
 * an APPROVED registration to COMPLETED.</p>
 */
public enum RegistrationStatus {
    PENDING,
    APPROVED,
    REJECTED,
    COMPLETED;

    /**
     * @return statuses an admin may move a registration to from this one
     */
    public Set<RegistrationStatus> adminTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED -> EnumSet.of(REJECTED);
            case REJECTED, COMPLETED -> EnumSet.noneOf(RegistrationStatus.class);
        };
    }

    /**
     * Validates an admin-driven change.
     *
     * @param target requested status
     * @return {@code target}
     * @throws PaymentException {@link PaymentErrorCode#INVALID_TRANSITION} when not allowed
     */
    public RegistrationStatus adminTransitionTo(RegistrationStatus target) {
        if (!adminTargets().contains(target)) {
            throw PaymentException.of(PaymentErrorCode.INVALID_TRANSITION,
                    "Registration cannot move from " + wireName() + " to " + target.wireName());
        }
        return target;
    }

    /**
     * Validates the payment-driven change to COMPLETED.
     *
     * @return {@link #COMPLETED}
     */
    public RegistrationStatus complete() {
        if (this != APPROVED) {
            throw PaymentException.of(PaymentErrorCode.INVALID_TRANSITION,
                    "Only approved registrations can complete, current status is " + wireName());
        }
        return COMPLETED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RegistrationStatus fromWire(String value) {
        return WireEnums.parse(RegistrationStatus.class, value);
    }
}
