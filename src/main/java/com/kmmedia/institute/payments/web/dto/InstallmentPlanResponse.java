package com.kmmedia.institute.payments.web.dto;

import com.kmmedia.institute.payments.domain.InstallmentPlan;
import com.kmmedia.institute.payments.domain.PlanCadence;
import com.kmmedia.institute.payments.domain.PlanStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Installment plan view, including the amount the next installment will be charged at.
 */
public record InstallmentPlanResponse(
        String id,
        String userId,
        String courseId,
        BigDecimal totalCourseFee,
        BigDecimal applicationFeeAmount,
        boolean applicationFeePaid,
        int totalInstallments,
        BigDecimal installmentAmount,
        int paidInstallments,
        BigDecimal remainingBalance,
        BigDecimal nextInstallmentAmount,
        LocalDate nextDueDate,
        PlanCadence paymentPlan,
        PlanStatus status,
        Instant createdAt,
        Instant updatedAt
) {
    public static InstallmentPlanResponse from(InstallmentPlan p) {
        return new InstallmentPlanResponse(
                p.getId(),
                p.getUserId(),
                p.getCourseId(),
                p.getTotalCourseFee(),
                p.getApplicationFeeAmount(),
                p.isApplicationFeePaid(),
                p.getTotalInstallments(),
                p.getInstallmentAmount(),
                p.getPaidInstallments(),
                p.getRemainingBalance(),
                p.nextInstallmentAmount(),
                p.getNextDueDate(),
                p.getPaymentPlan(),
                p.getStatus(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
