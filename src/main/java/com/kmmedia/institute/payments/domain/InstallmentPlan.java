package com.kmmedia.institute.payments.domain;

import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Course fee installment plan for one (student, course) pair.
 *
 * <p>Balance invariant, kept by every mutator:
 * {@code remainingBalance = totalCourseFee - (applicationFeePaid ? applicationFeeAmount : 0) - sum(paid installments)}.
 * All installments except possibly the last are {@code installmentAmount}; the last one is what is
 * left, so the rounding remainder never leaves the balance above zero.</p>
 *
 * <p>{@code applicationFeeAmount} is the share of the application fee credited toward the course
 * fee; it is zero when the application fee is a separate charge.</p>
 */
@Entity
@Table(
        name = "installment_plans",
        indexes = {
                @Index(name = "idx_installment_plans_user_course", columnList = "user_id,course_id"),
                @Index(name = "idx_installment_plans_status_due", columnList = "status,next_due_date")
        }
)
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
public class InstallmentPlan {

    private static final int MONEY_SCALE = 2;

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "course_id", nullable = false, updatable = false, length = 64)
    private String courseId;

    @Column(name = "total_course_fee", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalCourseFee;

    @Column(name = "application_fee_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal applicationFeeAmount;

    @Column(name = "application_fee_paid", nullable = false)
    private boolean applicationFeePaid;

    @Column(name = "application_fee_reference", length = 128)
    private String applicationFeeReference;

    @Column(name = "total_installments", nullable = false, updatable = false)
    private int totalInstallments;

    @Column(name = "installment_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal installmentAmount;

    @Column(name = "paid_installments", nullable = false)
    private int paidInstallments;

    @Column(name = "remaining_balance", nullable = false, precision = 12, scale = 2)
    private BigDecimal remainingBalance;

    @Column(name = "next_due_date")
    private LocalDate nextDueDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_plan", nullable = false, length = 16)
    private PlanCadence paymentPlan;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PlanStatus status;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Opens an ACTIVE plan.
     *
     * @param userId               student
     * @param courseId             course
     * @param totalCourseFee       full course fee
     * @param applicationFeeCredit part of the application fee counted toward the course fee
     * @param totalInstallments    number of installments, at least 1
     * @param cadence              due-date cadence
     * @param today                plan start; the first installment falls due one period later
     * @param createdAt            creation time
     * @return plan
     */
    public static InstallmentPlan open(String userId, String courseId, BigDecimal totalCourseFee,
                                       BigDecimal applicationFeeCredit, int totalInstallments,
                                       PlanCadence cadence, LocalDate today, Instant createdAt) {
        Objects.requireNonNull(totalCourseFee, "totalCourseFee");
        Objects.requireNonNull(cadence, "cadence");
        BigDecimal credit = applicationFeeCredit == null ? BigDecimal.ZERO : applicationFeeCredit;
        if (totalInstallments < 1) {
            throw new IllegalArgumentException("totalInstallments must be at least 1");
        }
        if (totalCourseFee.signum() <= 0 || credit.signum() < 0 || credit.compareTo(totalCourseFee) >= 0) {
            throw new IllegalArgumentException("Course fee must be positive and greater than the application fee credit");
        }

        InstallmentPlan plan = new InstallmentPlan();
        plan.id = UUID.randomUUID().toString();
        plan.userId = userId;
        plan.courseId = courseId;
        plan.totalCourseFee = money(totalCourseFee);
        plan.applicationFeeAmount = money(credit);
        plan.applicationFeePaid = false;
        plan.totalInstallments = totalInstallments;
        plan.installmentAmount = totalCourseFee.subtract(credit)
                .divide(BigDecimal.valueOf(totalInstallments), MONEY_SCALE, RoundingMode.CEILING);
        plan.paidInstallments = 0;
        plan.remainingBalance = plan.totalCourseFee;
        plan.paymentPlan = cadence;
        plan.nextDueDate = cadence.advance(today);
        plan.status = PlanStatus.ACTIVE;
        plan.createdAt = createdAt;
        plan.updatedAt = plan.createdAt;
        return plan;
    }

    /**
     * Application-fee credit not yet received. Installments never pay this part.
     *
     * @return outstanding credit
     */
    public BigDecimal outstandingApplicationFeeCredit() {
        return applicationFeePaid ? BigDecimal.ZERO : applicationFeeAmount;
    }

    /**
     * @return amount the next installment must be charged at; zero when none is due
     */
    public BigDecimal nextInstallmentAmount() {
        if (paidInstallments >= totalInstallments) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }
        BigDecimal coverable = remainingBalance.subtract(outstandingApplicationFeeCredit());
        return installmentAmount.min(coverable).max(BigDecimal.ZERO);
    }

    /**
     * Records one paid installment.
     *
     * @param amount paid amount
     * @param now    event time
     * @throws PaymentException PLAN_NOT_ACTIVE or OVERPAYMENT_REJECTED, leaving the plan untouched
     */
    public void applyInstallment(BigDecimal amount, Instant now) {
        requireActive();
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Installment amount must be positive");
        }
        BigDecimal coverable = remainingBalance.subtract(outstandingApplicationFeeCredit());
        if (paidInstallments >= totalInstallments || amount.compareTo(coverable) > 0) {
            throw PaymentException.of(PaymentErrorCode.OVERPAYMENT_REJECTED,
                    "Installment of " + amount + " exceeds the payable balance " + coverable.max(BigDecimal.ZERO)
                            + " of plan " + id + " (" + paidInstallments + "/" + totalInstallments + " paid)");
        }
        this.remainingBalance = money(remainingBalance.subtract(amount));
        this.paidInstallments++;
        this.nextDueDate = nextDueDate == null ? null : paymentPlan.advance(nextDueDate);
        this.updatedAt = now;
        completeIfSettled();
    }

    /**
     * One-way flag flip on an ACTIVE plan; repeated calls and closed plans change nothing, so the
     * balance invariant holds for every status.
     *
     * @param reference reference of the application fee payment
     * @param now       event time
     * @return true if this call changed the plan
     */
    public boolean markApplicationFeePaid(String reference, Instant now) {
        if (applicationFeePaid || status != PlanStatus.ACTIVE) {
            return false;
        }
        this.applicationFeePaid = true;
        this.applicationFeeReference = reference;
        this.remainingBalance = money(remainingBalance.subtract(applicationFeeAmount));
        this.updatedAt = now;
        completeIfSettled();
        return true;
    }

    public boolean isCompleted() {
        return status == PlanStatus.COMPLETED;
    }

    private void requireActive() {
        if (status != PlanStatus.ACTIVE) {
            throw PaymentException.of(PaymentErrorCode.PLAN_NOT_ACTIVE,
                    "Installment plan " + id + " is " + status.wireName());
        }
    }

    private void completeIfSettled() {
        if (remainingBalance.signum() == 0) {
            this.status = PlanStatus.COMPLETED;
            this.nextDueDate = null;
        }
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
    }
}
