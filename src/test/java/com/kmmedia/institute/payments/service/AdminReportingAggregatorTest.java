package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.InstallmentPlan;
import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.domain.PaymentType;
import com.kmmedia.institute.payments.domain.PlanCadence;
import com.kmmedia.institute.payments.domain.PlanStatus;
import com.kmmedia.institute.payments.domain.RegistrationStatus;
import com.kmmedia.institute.payments.repo.GroupCount;
import com.kmmedia.institute.payments.repo.GroupTotals;
import com.kmmedia.institute.payments.repo.InstallmentPlanRepository;
import com.kmmedia.institute.payments.repo.PaymentRecordRepository;
import com.kmmedia.institute.payments.repo.RegistrationRepository;
import com.kmmedia.institute.payments.service.dto.InstallmentPlanStats;
import com.kmmedia.institute.payments.service.dto.PaymentStats;
import com.kmmedia.institute.payments.service.dto.RegistrationStats;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.domain.Pageable;

class AdminReportingAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-03-18T09:30:00Z");

    private record Totals(Object getGroupKey, long getRowCount, BigDecimal getAmountTotal) implements GroupTotals {
    }

    private record Count(Object getGroupKey, long getRowCount) implements GroupCount {
    }

    private PaymentRecordRepository paymentRepository;
    private RegistrationRepository registrationRepository;
    private InstallmentPlanRepository planRepository;
    private AdminReportingAggregator aggregator;

    @BeforeEach
    void setUp() {
        paymentRepository = Mockito.mock(PaymentRecordRepository.class);
        registrationRepository = Mockito.mock(RegistrationRepository.class);
        planRepository = Mockito.mock(InstallmentPlanRepository.class);
        aggregator = new AdminReportingAggregator(paymentRepository, registrationRepository, planRepository,
                new AppProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void paymentFiguresAreZeroFilledAndRounded() {
        Mockito.when(paymentRepository.totalsByStatus()).thenReturn(List.of(
                new Totals(PaymentStatus.SUCCESS, 3, new BigDecimal("1350")),
                new Totals(PaymentStatus.PENDING, 2, new BigDecimal("500.00"))));
        Mockito.when(paymentRepository.successfulTotalsByType()).thenReturn(List.of(
                new Totals(PaymentType.APPLICATION_FEE, 1, new BigDecimal("100.00")),
                new Totals(PaymentType.INSTALLMENT, 2, new BigDecimal("1250.00"))));
        Mockito.when(paymentRepository.sumSuccessfulPaidSince(Instant.parse("2026-03-01T00:00:00Z")))
                .thenReturn(new BigDecimal("625.00"));
        PaymentRecord latest = PaymentRecord.pending("u1", "video-production", "KM_MEDIA_X", new BigDecimal("625.00"),
                "GHS", PaymentType.INSTALLMENT, "paystack", NOW);
        Mockito.when(paymentRepository.findByOrderByCreatedAtDesc(Mockito.any(Pageable.class))).thenReturn(List.of(latest));

        PaymentStats stats = aggregator.paymentStats();

        Assertions.assertEquals(5, stats.totalPayments());
        Assertions.assertEquals(3, stats.successfulPayments());
        Assertions.assertEquals(0, stats.failedPayments());
        Assertions.assertEquals(0, stats.cancelledPayments());
        Assertions.assertEquals(new BigDecimal("1350.00"), stats.totalRevenue());
        Assertions.assertEquals(new BigDecimal("625.00"), stats.monthlyRevenue());
        Assertions.assertEquals(new BigDecimal("0.00"), stats.revenueByType().get(PaymentType.COURSE_FEE));
        Assertions.assertEquals(new BigDecimal("1250.00"), stats.revenueByType().get(PaymentType.INSTALLMENT));
        Assertions.assertEquals("KM_MEDIA_X", stats.recentPayments().get(0).reference());
    }

    @Test
    void registrationFiguresCountEveryStatus() {
        Mockito.when(registrationRepository.countByStatus()).thenReturn(List.of(
                new Count(RegistrationStatus.PENDING, 4),
                new Count(RegistrationStatus.COMPLETED, 2)));
        Mockito.when(registrationRepository.countByCreatedAtGreaterThanEqual(Instant.parse("2026-03-11T09:30:00Z")))
                .thenReturn(3L);

        RegistrationStats stats = aggregator.registrationStats();

        Assertions.assertEquals(6, stats.totalRegistrations());
        Assertions.assertEquals(4, stats.pendingRegistrations());
        Assertions.assertEquals(0, stats.approvedRegistrations());
        Assertions.assertEquals(2, stats.completedRegistrations());
        Assertions.assertEquals(3, stats.recentRegistrations());
    }

    @Test
    void planFiguresIncludeOverdueAndOutstanding() {
        Mockito.when(planRepository.countByStatus()).thenReturn(List.of(
                new Count(PlanStatus.ACTIVE, 2), new Count(PlanStatus.COMPLETED, 1)));
        Mockito.when(planRepository.countByCadence()).thenReturn(List.of(new Count(PlanCadence.MONTHLY, 3)));
        Mockito.when(planRepository.sumOutstandingBalance()).thenReturn(new BigDecimal("1500"));
        InstallmentPlan overdue = InstallmentPlan.open("u1", "video-production", new BigDecimal("1000.00"),
                BigDecimal.ZERO, 4, PlanCadence.MONTHLY, LocalDate.of(2026, 1, 10), NOW);
        Mockito.when(planRepository.findByStatusAndNextDueDateBeforeOrderByNextDueDateAsc(PlanStatus.ACTIVE,
                LocalDate.of(2026, 3, 18))).thenReturn(List.of(overdue));

        InstallmentPlanStats stats = aggregator.installmentPlanStats();

        Assertions.assertEquals(3, stats.totalPlans());
        Assertions.assertEquals(0L, stats.byStatus().get(PlanStatus.DEFAULTED));
        Assertions.assertEquals(0L, stats.byCadence().get(PlanCadence.WEEKLY));
        Assertions.assertEquals(3L, stats.byCadence().get(PlanCadence.MONTHLY));
        Assertions.assertEquals(new BigDecimal("1500.00"), stats.outstandingBalance());
        Assertions.assertEquals(1, stats.overduePlans());
    }
}
