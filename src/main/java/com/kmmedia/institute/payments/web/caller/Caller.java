package com.kmmedia.institute.payments.web.caller;

import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;

/**
 * Identity of the authenticated caller, forwarded by the upstream auth gateway.
 *
 * @param userId user id
 * @param role   role
 */
public record Caller(String userId, CallerRole role) {

    /** Request attribute holding the caller. */
    public static final String ATTRIBUTE = "enrollmentPayments.caller";

    public boolean isAdmin() {
        return role == CallerRole.ADMIN;
    }

    /**
     * @param caller caller resolved by {@link CallerContextFilter}, may be null
     * @return the caller
     * @throws PaymentException UNAUTHENTICATED
     */
    public static Caller require(Caller caller) {
        if (caller == null) {
            throw new PaymentException(PaymentErrorCode.UNAUTHENTICATED);
        }
        return caller;
    }

    /**
     * @param caller caller, may be null
     * @return the admin caller
     * @throws PaymentException UNAUTHENTICATED or ACCESS_DENIED
     */
    public static Caller requireAdmin(Caller caller) {
        Caller c = require(caller);
        if (!c.isAdmin()) {
            throw PaymentException.of(PaymentErrorCode.ACCESS_DENIED, "Admin role required");
        }
        return c;
    }

    /**
     * Lets the owner of a resource or an admin through.
     *
     * @param caller  caller, may be null
     * @param ownerId owner of the resource
     * @return the caller
     */
    public static Caller requireOwnerOrAdmin(Caller caller, String ownerId) {
        Caller c = require(caller);
        if (!c.isAdmin() && !c.userId().equals(ownerId)) {
            throw new PaymentException(PaymentErrorCode.ACCESS_DENIED);
        }
        return c;
    }
}
