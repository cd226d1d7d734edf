package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.InstallmentPlan;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.domain.PaymentType;
import com.kmmedia.institute.payments.domain.PlanCadence;
import com.kmmedia.institute.payments.domain.PlanStatus;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.repo.InstallmentPlanRepository;
import com.kmmedia.institute.payments.repo.PaymentRecordRepository;
import com.kmmedia.institute.payments.service.events.InstallmentPlanCompletedEvent;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single source of truth for a student's remaining course balance.
 *
 * <p>Every mutation loads the plan {@code FOR UPDATE}; the balance rules themselves live in
 * {@link InstallmentPlan}. When a plan completes, an {@link InstallmentPlanCompletedEvent} is
 * written to the outbox and published in-process within the same transaction.</p>
 */
@Slf4j
@Service
public class InstallmentPlanTracker {

    private final InstallmentPlanRepository planRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final OutboxWriter outboxWriter;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties properties;
    private final Clock clock;

    public InstallmentPlanTracker(
            InstallmentPlanRepository planRepository,
            PaymentRecordRepository paymentRecordRepository,
            OutboxWriter outboxWriter,
            ApplicationEventPublisher eventPublisher,
            AppProperties properties,
            Clock clock
    ) {
        this.planRepository = planRepository;
        this.paymentRecordRepository = paymentRecordRepository;
        this.outboxWriter = outboxWriter;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Opens an ACTIVE plan for a (student, course) pair.
     *
     * @param userId            student
     * @param courseId          course
     * @param totalFee          full course fee
     * @param totalInstallments number of installments
     * @param cadence           due-date cadence
     * @return new plan
     * @throws PaymentException ALREADY_PAID when the course fee was paid in full or a plan was
     *                          completed; PLAN_ALREADY_EXISTS when the pair has an ACTIVE plan or a
     *                          course fee charge is still pending
     */
    @Transactional
    public InstallmentPlan createPlan(String userId, String courseId, BigDecimal totalFee,
                                      int totalInstallments, PlanCadence cadence) {
        int max = properties.getFees().getMaxInstallments();
        if (totalInstallments < 1 || totalInstallments > max) {
            throw new IllegalArgumentException("totalInstallments must be between 1 and " + max);
        }
        if (paymentRecordRepository.existsByUserIdAndCourseIdAndPaymentTypeAndStatus(
                userId, courseId, PaymentType.COURSE_FEE, PaymentStatus.SUCCESS)
                || planRepository.existsByUserIdAndCourseIdAndStatus(userId, courseId, PlanStatus.COMPLETED)) {
            throw PaymentException.of(PaymentErrorCode.ALREADY_PAID,
                    "Course fee for " + courseId + " is already paid by student " + userId);
        }
        if (planRepository.existsByUserIdAndCourseIdAndStatus(userId, courseId, PlanStatus.ACTIVE)) {
            throw alreadyExists(userId, courseId);
        }
        if (paymentRecordRepository.existsByUserIdAndCourseIdAndPaymentTypeAndStatus(
                userId, courseId, PaymentType.COURSE_FEE, PaymentStatus.PENDING)) {
            throw PaymentException.of(PaymentErrorCode.PLAN_ALREADY_EXISTS,
                    "Student " + userId + " has a course fee payment in progress for course " + courseId);
        }

        InstallmentPlan plan = InstallmentPlan.open(userId, courseId, totalFee,
                properties.getFees().getApplicationFeeCredit(), totalInstallments, cadence, LocalDate.now(clock), clock.instant());

        // Application fee settled before the plan existed.
        paymentRecordRepository.findFirstByUserIdAndCourseIdAndPaymentTypeAndStatusOrderByCreatedAtAsc(
                        userId, courseId, PaymentType.APPLICATION_FEE, PaymentStatus.SUCCESS)
                .ifPresent(fee -> plan.markApplicationFeePaid(fee.getReference(), clock.instant()));

        InstallmentPlan saved;
        try {
            saved = planRepository.saveAndFlush(plan);
        } catch (DataIntegrityViolationException e) {
            // partial unique index on ACTIVE plans lost a race
            throw alreadyExists(userId, courseId);
        }

        log.info("Installment plan created. planId={} userId={} courseId={} total={} installments={} amount={} cadence={}",
                saved.getId(), userId, courseId, saved.getTotalCourseFee(), totalInstallments,
                saved.getInstallmentAmount(), cadence);
        return saved;
    }

    /**
     * Records a paid installment against the plan.
     *
     * @param planId plan id
     * @param amount paid amount
     * @return updated plan
     * @throws PaymentException NOT_FOUND, PLAN_NOT_ACTIVE or OVERPAYMENT_REJECTED
     */
    @Transactional
    public InstallmentPlan applyInstallmentPayment(String planId, BigDecimal amount) {
        return applyInstallment(lock(planId), amount);
    }

    /**
     * Records a paid installment against the pair's ACTIVE plan, locked on first read.
     *
     * @param userId   student
     * @param courseId course
     * @param amount   paid amount
     * @return updated plan
     * @throws PaymentException PLAN_NOT_ACTIVE or OVERPAYMENT_REJECTED
     */
    @Transactional
    public InstallmentPlan applyInstallmentToActivePlan(String userId, String courseId, BigDecimal amount) {
        InstallmentPlan plan = planRepository.findActiveForUpdate(userId, courseId)
                .orElseThrow(() -> PaymentException.of(PaymentErrorCode.PLAN_NOT_ACTIVE,
                        "No active installment plan for student " + userId + " and course " + courseId));
        return applyInstallment(plan, amount);
    }

    private InstallmentPlan applyInstallment(InstallmentPlan plan, BigDecimal amount) {
        String planId = plan.getId();
        plan.applyInstallment(amount, clock.instant());
        planRepository.save(plan);

        log.info("Installment applied. planId={} amount={} paid={}/{} remaining={}",
                planId, amount, plan.getPaidInstallments(), plan.getTotalInstallments(), plan.getRemainingBalance());
        if (plan.isCompleted()) {
            publishCompleted(plan);
        }
        return plan;
    }

    /**
     * Flags the application fee as paid. Redeliveries are no-ops.
     *
     * @param planId    plan id
     * @param reference application fee payment reference
     * @return plan
     */
    @Transactional
    public InstallmentPlan markApplicationFeePaid(String planId, String reference) {
        return markFeePaid(lock(planId), reference);
    }

    /**
     * Flags the application fee as paid on the pair's ACTIVE plan, if there is one.
     *
     * @param userId    student
     * @param courseId  course
     * @param reference application fee payment reference
     * @return the plan, empty when the pair has no ACTIVE plan
     */
    @Transactional
    public Optional<InstallmentPlan> markApplicationFeePaidOnActivePlan(String userId, String courseId, String reference) {
        return planRepository.findActiveForUpdate(userId, courseId)
                .map(plan -> markFeePaid(plan, reference));
    }

    private InstallmentPlan markFeePaid(InstallmentPlan plan, String reference) {
        String planId = plan.getId();
        if (!plan.markApplicationFeePaid(reference, clock.instant())) {
            log.debug("Application fee not applied, already paid or plan closed. planId={} reference={}", planId, reference);
            return plan;
        }
        planRepository.save(plan);
        log.info("Application fee marked paid. planId={} reference={} remaining={}",
                planId, reference, plan.getRemainingBalance());
        if (plan.isCompleted()) {
            publishCompleted(plan);
        }
        return plan;
    }

    @Transactional(readOnly = true)
    public Optional<InstallmentPlan> findActive(String userId, String courseId) {
        return planRepository.findFirstByUserIdAndCourseIdAndStatus(userId, courseId, PlanStatus.ACTIVE);
    }

    /**
     * The student's current plan for a course: the ACTIVE one, else the most recent.
     *
     * @param userId   student
     * @param courseId course
     * @return plan
     * @throws PaymentException NOT_FOUND
     */
    @Transactional(readOnly = true)
    public InstallmentPlan findForStudent(String userId, String courseId) {
        return findActive(userId, courseId)
                .or(() -> planRepository.findFirstByUserIdAndCourseIdOrderByCreatedAtDesc(userId, courseId))
                .orElseThrow(() -> PaymentException.of(PaymentErrorCode.NOT_FOUND,
                        "No installment plan for course " + courseId));
    }

    @Transactional(readOnly = true)
    public Page<InstallmentPlan> listForAdmin(PlanStatus status, PlanCadence cadence, Pageable pageable) {
        if (status != null && cadence != null) {
            return planRepository.findByStatusAndPaymentPlan(status, cadence, pageable);
        }
        if (status != null) {
            return planRepository.findByStatus(status, pageable);
        }
        if (cadence != null) {
            return planRepository.findByPaymentPlan(cadence, pageable);
        }
        return planRepository.findAll(pageable);
    }

    private InstallmentPlan lock(String planId) {
        return planRepository.findByIdForUpdate(planId)
                .orElseThrow(() -> PaymentException.of(PaymentErrorCode.NOT_FOUND, "Installment plan " + planId + " not found"));
    }

    private void publishCompleted(InstallmentPlan plan) {
        InstallmentPlanCompletedEvent event = new InstallmentPlanCompletedEvent(
                OutboxWriter.SCHEMA_VERSION,
                UUID.randomUUID().toString(),
                clock.instant(),
                plan.getId(),
                plan.getUserId(),
                plan.getCourseId(),
                plan.getTotalCourseFee(),
                plan.getPaidInstallments()
        );
        outboxWriter.append("InstallmentPlan", plan.getId(), "InstallmentPlanCompleted", plan.getUserId(), event);
        eventPublisher.publishEvent(event);
        log.info("Installment plan completed. planId={} userId={} courseId={}", plan.getId(), plan.getUserId(), plan.getCourseId());
    }

    private PaymentException alreadyExists(String userId, String courseId) {
        return PaymentException.of(PaymentErrorCode.PLAN_ALREADY_EXISTS,
                "Student " + userId + " already has an active installment plan for course " + courseId);
    }
}
