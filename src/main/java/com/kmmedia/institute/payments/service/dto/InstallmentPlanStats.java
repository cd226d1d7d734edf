package com.kmmedia.institute.payments.service.dto;

import com.kmmedia.institute.payments.domain.PlanCadence;
import com.kmmedia.institute.payments.domain.PlanStatus;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Installment plan dashboard figures.
 *
 * @param totalPlans         all plans
 * @param byStatus           plan count per status, every status present
 * @param byCadence          plan count per cadence, every cadence present
 * @param outstandingBalance remaining balance summed over ACTIVE plans
 * @param overduePlans       ACTIVE plans past their next due date
 */
public record InstallmentPlanStats(
        long totalPlans,
        Map<PlanStatus, Long> byStatus,
        Map<PlanCadence, Long> byCadence,
        BigDecimal outstandingBalance,
        long overduePlans
) {}
