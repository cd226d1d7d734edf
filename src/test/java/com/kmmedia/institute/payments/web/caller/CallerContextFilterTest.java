package com.kmmedia.institute.payments.web.caller;

import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CallerContextFilterTest {

    private final CallerContextFilter filter = new CallerContextFilter();

    private Caller filtered(String userId, String role) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/payments/history");
        if (userId != null) {
            request.addHeader(CallerContextFilter.USER_ID_HEADER, userId);
        }
        if (role != null) {
            request.addHeader(CallerContextFilter.USER_ROLE_HEADER, role);
        }
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        Assertions.assertNotNull(chain.getRequest());
        return (Caller) request.getAttribute(Caller.ATTRIBUTE);
    }

    @Test
    void headersBecomeCaller() throws Exception {
        Caller caller = filtered(" u1 ", "admin");

        Assertions.assertEquals(new Caller("u1", CallerRole.ADMIN), caller);
        Assertions.assertTrue(caller.isAdmin());
    }

    @Test
    void missingOrUnknownIdentityLeavesNoCaller() throws Exception {
        Assertions.assertNull(filtered(null, "student"));
        Assertions.assertNull(filtered("u1", null));
        Assertions.assertNull(filtered("u1", "superuser"));
    }

    @Test
    void ownershipChecks() {
        Caller student = new Caller("u1", CallerRole.STUDENT);

        Assertions.assertSame(student, Caller.requireOwnerOrAdmin(student, "u1"));
        Assertions.assertEquals(PaymentErrorCode.ACCESS_DENIED, Assertions.assertThrows(PaymentException.class,
                () -> Caller.requireOwnerOrAdmin(student, "u2")).getCode());
        Assertions.assertEquals(PaymentErrorCode.ACCESS_DENIED, Assertions.assertThrows(PaymentException.class,
                () -> Caller.requireAdmin(student)).getCode());
        Assertions.assertEquals(PaymentErrorCode.UNAUTHENTICATED, Assertions.assertThrows(PaymentException.class,
                () -> Caller.require(null)).getCode());
    }
}
