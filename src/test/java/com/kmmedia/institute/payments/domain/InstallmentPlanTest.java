package com.kmmedia.institute.payments.domain;

import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InstallmentPlanTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 1, 15);
    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private static InstallmentPlan plan(String fee, String credit, int installments) {
        return InstallmentPlan.open("u1", "video-production", new BigDecimal(fee), new BigDecimal(credit),
                installments, PlanCadence.MONTHLY, TODAY, NOW);
    }

    @Test
    void fourEqualInstallmentsCompleteThePlan() {
        InstallmentPlan plan = plan("1000.00", "0", 4);
        Assertions.assertEquals(new BigDecimal("250.00"), plan.getInstallmentAmount());

        for (int i = 0; i < 4; i++) {
            plan.applyInstallment(plan.nextInstallmentAmount(), NOW);
        }

        Assertions.assertEquals(4, plan.getPaidInstallments());
        Assertions.assertEquals(0, plan.getRemainingBalance().signum());
        Assertions.assertEquals(PlanStatus.COMPLETED, plan.getStatus());
        Assertions.assertNull(plan.getNextDueDate());
    }

    @Test
    void lastInstallmentAbsorbsRoundingRemainder() {
        InstallmentPlan plan = plan("1000.00", "0", 3);
        Assertions.assertEquals(new BigDecimal("333.34"), plan.getInstallmentAmount());

        plan.applyInstallment(plan.nextInstallmentAmount(), NOW);
        plan.applyInstallment(plan.nextInstallmentAmount(), NOW);
        Assertions.assertEquals(new BigDecimal("333.32"), plan.nextInstallmentAmount());
        plan.applyInstallment(plan.nextInstallmentAmount(), NOW);

        Assertions.assertEquals(new BigDecimal("0.00"), plan.getRemainingBalance());
        Assertions.assertTrue(plan.isCompleted());
        Assertions.assertEquals(new BigDecimal("0.00"), plan.nextInstallmentAmount());
    }

    @Test
    void overpaymentIsRejectedWithoutTouchingThePlan() {
        InstallmentPlan plan = plan("1000.00", "0", 4);
        plan.applyInstallment(new BigDecimal("250.00"), NOW);
        LocalDate due = plan.getNextDueDate();

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> plan.applyInstallment(new BigDecimal("750.01"), NOW));

        Assertions.assertEquals(PaymentErrorCode.OVERPAYMENT_REJECTED, ex.getCode());
        Assertions.assertEquals(new BigDecimal("750.00"), plan.getRemainingBalance());
        Assertions.assertEquals(1, plan.getPaidInstallments());
        Assertions.assertEquals(due, plan.getNextDueDate());
        Assertions.assertEquals(PlanStatus.ACTIVE, plan.getStatus());
    }

    @Test
    void completedPlanRejectsFurtherInstallments() {
        InstallmentPlan plan = plan("500.00", "0", 1);
        plan.applyInstallment(new BigDecimal("500.00"), NOW);

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> plan.applyInstallment(new BigDecimal("1.00"), NOW));
        Assertions.assertEquals(PaymentErrorCode.PLAN_NOT_ACTIVE, ex.getCode());
    }

    @Test
    void dueDateAdvancesOnePeriodPerInstallment() {
        InstallmentPlan plan = plan("900.00", "0", 3);
        Assertions.assertEquals(LocalDate.of(2026, 2, 15), plan.getNextDueDate());

        plan.applyInstallment(new BigDecimal("300.00"), NOW);
        Assertions.assertEquals(LocalDate.of(2026, 3, 15), plan.getNextDueDate());
    }

    @Test
    void applicationFeeCreditIsNeverPaidByInstallments() {
        InstallmentPlan plan = plan("1000.00", "100.00", 3);
        Assertions.assertEquals(new BigDecimal("300.00"), plan.getInstallmentAmount());
        Assertions.assertEquals(new BigDecimal("1000.00"), plan.getRemainingBalance());

        for (int i = 0; i < 3; i++) {
            plan.applyInstallment(new BigDecimal("300.00"), NOW);
        }

        Assertions.assertEquals(new BigDecimal("100.00"), plan.getRemainingBalance());
        Assertions.assertEquals(PlanStatus.ACTIVE, plan.getStatus());
        Assertions.assertEquals(new BigDecimal("0.00"), plan.nextInstallmentAmount());

        Assertions.assertTrue(plan.markApplicationFeePaid("KM_MEDIA_APP", NOW));
        Assertions.assertFalse(plan.markApplicationFeePaid("KM_MEDIA_APP", NOW));
        Assertions.assertEquals(new BigDecimal("0.00"), plan.getRemainingBalance());
        Assertions.assertEquals(PlanStatus.COMPLETED, plan.getStatus());
        Assertions.assertEquals("KM_MEDIA_APP", plan.getApplicationFeeReference());
    }

    @Test
    void closedPlanKeepsItsBalanceWhenApplicationFeeArrives() {
        InstallmentPlan plan = plan("1000.00", "100.00", 3);
        plan.applyInstallment(new BigDecimal("300.00"), NOW);
        plan.setStatus(PlanStatus.CANCELLED);

        Assertions.assertFalse(plan.markApplicationFeePaid("KM_MEDIA_APP", NOW));

        Assertions.assertFalse(plan.isApplicationFeePaid());
        Assertions.assertNull(plan.getApplicationFeeReference());
        Assertions.assertEquals(new BigDecimal("700.00"), plan.getRemainingBalance());
        Assertions.assertEquals(PlanStatus.CANCELLED, plan.getStatus());
    }

    @Test
    void rejectsInvalidTerms() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> plan("1000.00", "0", 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> plan("0.00", "0", 2));
        Assertions.assertThrows(IllegalArgumentException.class, () -> plan("100.00", "100.00", 2));
    }
}
