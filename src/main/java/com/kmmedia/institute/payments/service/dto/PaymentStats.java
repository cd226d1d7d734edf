package com.kmmedia.institute.payments.service.dto;

import com.kmmedia.institute.payments.domain.PaymentType;
import com.kmmedia.institute.payments.web.dto.PaymentResponse;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Payment dashboard figures.
 *
 * @param totalPayments      all records
 * @param successfulPayments SUCCESS records
 * @param failedPayments     FAILED records
 * @param pendingPayments    PENDING records
 * @param cancelledPayments  CANCELLED records
 * @param totalRevenue       sum of SUCCESS amounts
 * @param monthlyRevenue     sum of SUCCESS amounts paid since the first day of the current month (UTC)
 * @param revenueByType      sum of SUCCESS amounts per payment type
 * @param recentPayments     newest records
 */
public record PaymentStats(
        long totalPayments,
        long successfulPayments,
        long failedPayments,
        long pendingPayments,
        long cancelledPayments,
        BigDecimal totalRevenue,
        BigDecimal monthlyRevenue,
        Map<PaymentType, BigDecimal> revenueByType,
        List<PaymentResponse> recentPayments
) {}
