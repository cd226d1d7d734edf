package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.InstallmentPlan;
import com.kmmedia.institute.payments.domain.PaymentRecord;
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
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

class InstallmentPlanTrackerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private InstallmentPlanRepository planRepository;
    private PaymentRecordRepository paymentRecordRepository;
    private OutboxWriter outboxWriter;
    private ApplicationEventPublisher eventPublisher;
    private AppProperties properties;
    private InstallmentPlanTracker tracker;

    @BeforeEach
    void setUp() {
        planRepository = Mockito.mock(InstallmentPlanRepository.class);
        paymentRecordRepository = Mockito.mock(PaymentRecordRepository.class);
        outboxWriter = Mockito.mock(OutboxWriter.class);
        eventPublisher = Mockito.mock(ApplicationEventPublisher.class);
        properties = new AppProperties();
        tracker = new InstallmentPlanTracker(planRepository, paymentRecordRepository, outboxWriter, eventPublisher,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));

        Mockito.when(planRepository.saveAndFlush(Mockito.any(InstallmentPlan.class)))
                .thenAnswer(inv -> inv.getArgument(0));
        Mockito.when(paymentRecordRepository.findFirstByUserIdAndCourseIdAndPaymentTypeAndStatusOrderByCreatedAtAsc(
                        Mockito.anyString(), Mockito.anyString(), Mockito.any(), Mockito.any()))
                .thenReturn(Optional.empty());
    }

    @Test
    void createsActivePlanDueOneMonthFromToday() {
        InstallmentPlan plan = tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 4, PlanCadence.MONTHLY);

        Assertions.assertEquals(PlanStatus.ACTIVE, plan.getStatus());
        Assertions.assertEquals(new BigDecimal("250.00"), plan.getInstallmentAmount());
        Assertions.assertEquals(new BigDecimal("1000.00"), plan.getRemainingBalance());
        Assertions.assertEquals(LocalDate.of(2026, 2, 15), plan.getNextDueDate());
        Assertions.assertFalse(plan.isApplicationFeePaid());
        Assertions.assertEquals(NOW, plan.getCreatedAt());
    }

    @Test
    void secondActivePlanIsRejected() {
        Mockito.when(planRepository.existsByUserIdAndCourseIdAndStatus("u1", "video-production", PlanStatus.ACTIVE))
                .thenReturn(true);

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 4, PlanCadence.MONTHLY));

        Assertions.assertEquals(PaymentErrorCode.PLAN_ALREADY_EXISTS, ex.getCode());
        Mockito.verify(planRepository, Mockito.never()).saveAndFlush(Mockito.any());
    }

    @Test
    void courseFeePaidInFullBlocksANewPlan() {
        Mockito.when(paymentRecordRepository.existsByUserIdAndCourseIdAndPaymentTypeAndStatus(
                "u1", "video-production", PaymentType.COURSE_FEE, PaymentStatus.SUCCESS)).thenReturn(true);

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 4, PlanCadence.MONTHLY));

        Assertions.assertEquals(PaymentErrorCode.ALREADY_PAID, ex.getCode());
        Mockito.verify(planRepository, Mockito.never()).saveAndFlush(Mockito.any());
    }

    @Test
    void completedPlanBlocksANewPlan() {
        Mockito.when(planRepository.existsByUserIdAndCourseIdAndStatus("u1", "video-production", PlanStatus.COMPLETED))
                .thenReturn(true);

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 4, PlanCadence.MONTHLY));

        Assertions.assertEquals(PaymentErrorCode.ALREADY_PAID, ex.getCode());
        Mockito.verify(planRepository, Mockito.never()).saveAndFlush(Mockito.any());
    }

    @Test
    void pendingCourseFeeChargeBlocksANewPlan() {
        Mockito.when(paymentRecordRepository.existsByUserIdAndCourseIdAndPaymentTypeAndStatus(
                "u1", "video-production", PaymentType.COURSE_FEE, PaymentStatus.PENDING)).thenReturn(true);

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 4, PlanCadence.MONTHLY));

        Assertions.assertEquals(PaymentErrorCode.PLAN_ALREADY_EXISTS, ex.getCode());
        Mockito.verify(planRepository, Mockito.never()).saveAndFlush(Mockito.any());
    }

    @Test
    void lostRaceOnActivePlanIndexIsReportedAsExisting() {
        Mockito.when(planRepository.saveAndFlush(Mockito.any(InstallmentPlan.class)))
                .thenThrow(new DataIntegrityViolationException("uq_installment_plans_active_pair"));

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 4, PlanCadence.MONTHLY));

        Assertions.assertEquals(PaymentErrorCode.PLAN_ALREADY_EXISTS, ex.getCode());
    }

    @Test
    void installmentCountOutsideAllowedRangeIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 0, PlanCadence.MONTHLY));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 13, PlanCadence.MONTHLY));
    }

    @Test
    void applicationFeePaidBeforePlanIsCredited() {
        properties.getFees().setApplicationFeeCredit(new BigDecimal("100.00"));
        PaymentRecord fee = PaymentRecord.pending("u1", "video-production", "KM_MEDIA_APP", new BigDecimal("100.00"),
                "GHS", PaymentType.APPLICATION_FEE, "paystack", NOW);
        fee.settle(PaymentStatus.SUCCESS, NOW, null);
        Mockito.when(paymentRecordRepository.findFirstByUserIdAndCourseIdAndPaymentTypeAndStatusOrderByCreatedAtAsc(
                        "u1", "video-production", PaymentType.APPLICATION_FEE, PaymentStatus.SUCCESS))
                .thenReturn(Optional.of(fee));

        InstallmentPlan plan = tracker.createPlan("u1", "video-production", new BigDecimal("1000.00"), 3, PlanCadence.MONTHLY);

        Assertions.assertTrue(plan.isApplicationFeePaid());
        Assertions.assertEquals("KM_MEDIA_APP", plan.getApplicationFeeReference());
        Assertions.assertEquals(new BigDecimal("300.00"), plan.getInstallmentAmount());
        Assertions.assertEquals(new BigDecimal("900.00"), plan.getRemainingBalance());
    }

    @Test
    void finalInstallmentPublishesCompletion() {
        InstallmentPlan plan = InstallmentPlan.open("u1", "video-production", new BigDecimal("500.00"),
                BigDecimal.ZERO, 2, PlanCadence.WEEKLY, LocalDate.of(2026, 1, 15), NOW);
        plan.applyInstallment(new BigDecimal("250.00"), NOW);
        Mockito.when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));

        InstallmentPlan updated = tracker.applyInstallmentPayment(plan.getId(), new BigDecimal("250.00"));

        Assertions.assertEquals(PlanStatus.COMPLETED, updated.getStatus());
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        Mockito.verify(outboxWriter).append(Mockito.eq("InstallmentPlan"), Mockito.eq(plan.getId()),
                Mockito.eq("InstallmentPlanCompleted"), Mockito.eq("u1"), payload.capture());
        InstallmentPlanCompletedEvent event = (InstallmentPlanCompletedEvent) payload.getValue();
        Assertions.assertEquals(2, event.paidInstallments());
        Mockito.verify(eventPublisher).publishEvent(event);
    }

    @Test
    void partialInstallmentDoesNotPublish() {
        InstallmentPlan plan = InstallmentPlan.open("u1", "video-production", new BigDecimal("500.00"),
                BigDecimal.ZERO, 2, PlanCadence.WEEKLY, LocalDate.of(2026, 1, 15), NOW);
        Mockito.when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));

        tracker.applyInstallmentPayment(plan.getId(), new BigDecimal("250.00"));

        Assertions.assertEquals(new BigDecimal("250.00"), plan.getRemainingBalance());
        Mockito.verify(planRepository).save(plan);
        Mockito.verifyNoInteractions(outboxWriter, eventPublisher);
    }

    @Test
    void installmentForPairIsAppliedToTheRowLockedOnFirstRead() {
        InstallmentPlan plan = InstallmentPlan.open("u1", "video-production", new BigDecimal("1000.00"),
                BigDecimal.ZERO, 4, PlanCadence.MONTHLY, LocalDate.of(2026, 1, 15), NOW);
        Mockito.when(planRepository.findActiveForUpdate("u1", "video-production")).thenReturn(Optional.of(plan));

        InstallmentPlan updated = tracker.applyInstallmentToActivePlan("u1", "video-production", new BigDecimal("250.00"));

        Assertions.assertSame(plan, updated);
        Assertions.assertEquals(1, plan.getPaidInstallments());
        Assertions.assertEquals(new BigDecimal("750.00"), plan.getRemainingBalance());
        Mockito.verify(planRepository).save(plan);
        Mockito.verify(planRepository, Mockito.never())
                .findFirstByUserIdAndCourseIdAndStatus(Mockito.anyString(), Mockito.anyString(), Mockito.any());
        Mockito.verify(planRepository, Mockito.never()).findByIdForUpdate(Mockito.anyString());
    }

    @Test
    void installmentForPairWithoutActivePlanIsRejected() {
        Mockito.when(planRepository.findActiveForUpdate("u1", "video-production")).thenReturn(Optional.empty());

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> tracker.applyInstallmentToActivePlan("u1", "video-production", new BigDecimal("250.00")));

        Assertions.assertEquals(PaymentErrorCode.PLAN_NOT_ACTIVE, ex.getCode());
        Mockito.verify(planRepository, Mockito.never()).save(Mockito.any());
    }

    @Test
    void applicationFeeForPairCreditsOnlyAnActivePlan() {
        properties.getFees().setApplicationFeeCredit(new BigDecimal("100.00"));
        InstallmentPlan plan = InstallmentPlan.open("u1", "video-production", new BigDecimal("1000.00"),
                new BigDecimal("100.00"), 3, PlanCadence.MONTHLY, LocalDate.of(2026, 1, 15), NOW);
        Mockito.when(planRepository.findActiveForUpdate("u1", "video-production")).thenReturn(Optional.of(plan));
        Mockito.when(planRepository.findActiveForUpdate("u1", "photography-basics")).thenReturn(Optional.empty());

        Optional<InstallmentPlan> credited = tracker.markApplicationFeePaidOnActivePlan("u1", "video-production", "KM_MEDIA_APP");
        Optional<InstallmentPlan> none = tracker.markApplicationFeePaidOnActivePlan("u1", "photography-basics", "KM_MEDIA_APP2");

        Assertions.assertTrue(credited.isPresent());
        Assertions.assertEquals(new BigDecimal("900.00"), plan.getRemainingBalance());
        Assertions.assertTrue(none.isEmpty());
        Mockito.verify(planRepository, Mockito.times(1)).save(Mockito.any());
    }

    @Test
    void unknownPlanIsNotFound() {
        Mockito.when(planRepository.findByIdForUpdate("missing")).thenReturn(Optional.empty());

        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> tracker.applyInstallmentPayment("missing", BigDecimal.TEN));

        Assertions.assertEquals(PaymentErrorCode.NOT_FOUND, ex.getCode());
    }

    @Test
    void repeatedApplicationFeeFlagIsANoOp() {
        InstallmentPlan plan = InstallmentPlan.open("u1", "video-production", new BigDecimal("500.00"),
                BigDecimal.ZERO, 2, PlanCadence.WEEKLY, LocalDate.of(2026, 1, 15), NOW);
        plan.markApplicationFeePaid("KM_MEDIA_APP", NOW);
        Mockito.when(planRepository.findByIdForUpdate(plan.getId())).thenReturn(Optional.of(plan));

        tracker.markApplicationFeePaid(plan.getId(), "KM_MEDIA_APP");

        Mockito.verify(planRepository, Mockito.never()).save(Mockito.any());
        Mockito.verifyNoInteractions(outboxWriter);
    }

    @Test
    void studentPlanFallsBackToMostRecent() {
        InstallmentPlan completed = InstallmentPlan.open("u1", "video-production", new BigDecimal("500.00"),
                BigDecimal.ZERO, 1, PlanCadence.MONTHLY, LocalDate.of(2026, 1, 15), NOW);
        completed.applyInstallment(new BigDecimal("500.00"), NOW);
        Mockito.when(planRepository.findFirstByUserIdAndCourseIdAndStatus("u1", "video-production", PlanStatus.ACTIVE))
                .thenReturn(Optional.empty());
        Mockito.when(planRepository.findFirstByUserIdAndCourseIdOrderByCreatedAtDesc("u1", "video-production"))
                .thenReturn(Optional.of(completed));

        Assertions.assertSame(completed, tracker.findForStudent("u1", "video-production"));
        PaymentException ex = Assertions.assertThrows(PaymentException.class,
                () -> tracker.findForStudent("u1", "photography-basics"));
        Assertions.assertEquals(PaymentErrorCode.NOT_FOUND, ex.getCode());
    }
}
