package com.kmmedia.institute.payments.service.catalog;

import com.kmmedia.institute.payments.error.PaymentException;

/**
 * Read-only view of the course catalog. Fees are inputs to payments, never owned here.
 */
public interface CourseCatalog {

    /**
     * @param courseId course id
     * @return fee terms
     * @throws PaymentException NOT_FOUND for an unknown course
     */
    CourseFeeTerms feeTerms(String courseId);
}
