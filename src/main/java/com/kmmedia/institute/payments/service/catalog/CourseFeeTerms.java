package com.kmmedia.institute.payments.service.catalog;

import java.math.BigDecimal;

/**
 * Fee facts about a course, owned by the course catalog.
 *
 * @param courseId            course id
 * @param courseFee           full course fee
 * @param installmentsOffered whether the course can be paid by installment plan
 */
public record CourseFeeTerms(String courseId, BigDecimal courseFee, boolean installmentsOffered) {}
