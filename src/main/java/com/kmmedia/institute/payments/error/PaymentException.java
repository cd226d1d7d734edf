package com.kmmedia.institute.payments.error;

import lombok.Getter;

/**
 * Business failure of the payment core.
 *
 * <p>Unchecked so it rolls back the surrounding transaction.</p>
 */
@Getter
public class PaymentException extends RuntimeException {

    private final PaymentErrorCode code;

    public PaymentException(PaymentErrorCode code) {
        this(code, code.getDefaultMessage());
    }

    public PaymentException(PaymentErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public PaymentException(PaymentErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static PaymentException of(PaymentErrorCode code, String message) {
        return new PaymentException(code, message);
    }
}
