package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.InstallmentPlan;
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
import com.kmmedia.institute.payments.service.dto.AdminStats;
import com.kmmedia.institute.payments.service.dto.InstallmentPlanStats;
import com.kmmedia.institute.payments.service.dto.PaymentStats;
import com.kmmedia.institute.payments.service.dto.RegistrationStats;
import com.kmmedia.institute.payments.web.dto.PaymentResponse;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Dashboard figures, recomputed from the tables on every call. Nothing is cached or counted
 * incrementally, and nothing here takes locks.
 */
@Service
@Transactional(readOnly = true)
public class AdminReportingAggregator {

    private final PaymentRecordRepository paymentRecordRepository;
    private final RegistrationRepository registrationRepository;
    private final InstallmentPlanRepository planRepository;
    private final AppProperties properties;
    private final Clock clock;

    public AdminReportingAggregator(
            PaymentRecordRepository paymentRecordRepository,
            RegistrationRepository registrationRepository,
            InstallmentPlanRepository planRepository,
            AppProperties properties,
            Clock clock
    ) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.registrationRepository = registrationRepository;
        this.planRepository = planRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public AdminStats stats() {
        return new AdminStats(paymentStats(), registrationStats(), installmentPlanStats());
    }

    public PaymentStats paymentStats() {
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        Map<PaymentStatus, BigDecimal> amounts = new EnumMap<>(PaymentStatus.class);
        for (PaymentStatus s : PaymentStatus.values()) {
            counts.put(s, 0L);
            amounts.put(s, BigDecimal.ZERO);
        }
        for (GroupTotals row : paymentRecordRepository.totalsByStatus()) {
            PaymentStatus s = (PaymentStatus) row.getGroupKey();
            counts.put(s, row.getRowCount());
            amounts.put(s, row.getAmountTotal());
        }

        Map<PaymentType, BigDecimal> revenueByType = new EnumMap<>(PaymentType.class);
        for (PaymentType t : PaymentType.values()) {
            revenueByType.put(t, money(BigDecimal.ZERO));
        }
        for (GroupTotals row : paymentRecordRepository.successfulTotalsByType()) {
            revenueByType.put((PaymentType) row.getGroupKey(), money(row.getAmountTotal()));
        }

        LocalDate firstOfMonth = LocalDate.now(clock).withDayOfMonth(1);
        BigDecimal monthly = paymentRecordRepository.sumSuccessfulPaidSince(
                firstOfMonth.atStartOfDay().toInstant(ZoneOffset.UTC));

        List<PaymentResponse> recent = paymentRecordRepository
                .findByOrderByCreatedAtDesc(PageRequest.of(0, properties.getReporting().getRecentPaymentsLimit()))
                .stream()
                .map(PaymentResponse::from)
                .toList();

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return new PaymentStats(
                total,
                counts.get(PaymentStatus.SUCCESS),
                counts.get(PaymentStatus.FAILED),
                counts.get(PaymentStatus.PENDING),
                counts.get(PaymentStatus.CANCELLED),
                money(amounts.get(PaymentStatus.SUCCESS)),
                money(monthly),
                revenueByType,
                recent
        );
    }

    public RegistrationStats registrationStats() {
        Map<RegistrationStatus, Long> counts = countAll(RegistrationStatus.class, registrationRepository.countByStatus());
        long recent = registrationRepository.countByCreatedAtGreaterThanEqual(
                clock.instant().minus(properties.getReporting().getRecentRegistrationsWindow()));
        return new RegistrationStats(
                counts.values().stream().mapToLong(Long::longValue).sum(),
                counts.get(RegistrationStatus.PENDING),
                counts.get(RegistrationStatus.APPROVED),
                counts.get(RegistrationStatus.REJECTED),
                counts.get(RegistrationStatus.COMPLETED),
                recent
        );
    }

    public InstallmentPlanStats installmentPlanStats() {
        Map<PlanStatus, Long> byStatus = countAll(PlanStatus.class, planRepository.countByStatus());
        Map<PlanCadence, Long> byCadence = countAll(PlanCadence.class, planRepository.countByCadence());
        long overdue = overduePlans(LocalDate.now(clock)).size();
        return new InstallmentPlanStats(
                byStatus.values().stream().mapToLong(Long::longValue).sum(),
                byStatus,
                byCadence,
                money(planRepository.sumOutstandingBalance()),
                overdue
        );
    }

    /**
     * ACTIVE plans whose next installment fell due before {@code today}, oldest due date first.
     * Marking them DEFAULTED is left to an external process.
     *
     * @param today reference day
     * @return overdue plans
     */
    public List<InstallmentPlan> overduePlans(LocalDate today) {
        return planRepository.findByStatusAndNextDueDateBeforeOrderByNextDueDateAsc(PlanStatus.ACTIVE, today);
    }

    private static <E extends Enum<E>> Map<E, Long> countAll(Class<E> type, List<GroupCount> rows) {
        Map<E, Long> counts = new EnumMap<>(type);
        for (E e : type.getEnumConstants()) {
            counts.put(e, 0L);
        }
        for (GroupCount row : rows) {
            counts.put(type.cast(row.getGroupKey()), row.getRowCount());
        }
        return counts;
    }

    private static BigDecimal money(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(2, RoundingMode.HALF_UP);
    }
}
