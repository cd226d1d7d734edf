package com.kmmedia.institute.payments.web;

import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.domain.PaymentType;
import com.kmmedia.institute.payments.domain.PlanCadence;
import com.kmmedia.institute.payments.domain.PlanStatus;
import com.kmmedia.institute.payments.service.AdminReportingAggregator;
import com.kmmedia.institute.payments.service.InstallmentPlanTracker;
import com.kmmedia.institute.payments.service.PaymentRecordStore;
import com.kmmedia.institute.payments.service.dto.AdminStats;
import com.kmmedia.institute.payments.service.dto.PaymentFilter;
import com.kmmedia.institute.payments.web.caller.Caller;
import com.kmmedia.institute.payments.web.dto.InstallmentPlanResponse;
import com.kmmedia.institute.payments.web.dto.PageResponse;
import com.kmmedia.institute.payments.web.dto.PaymentResponse;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only admin views over payments and installment plans. Enum filters take the lower-case
 * wire names ({@code status=success}).
 */
@RestController
@RequestMapping("/payments/admin")
public class AdminPaymentsController {

    private final PaymentRecordStore paymentRecordStore;
    private final InstallmentPlanTracker planTracker;
    private final AdminReportingAggregator reportingAggregator;
    private final Clock clock;

    public AdminPaymentsController(
            PaymentRecordStore paymentRecordStore,
            InstallmentPlanTracker planTracker,
            AdminReportingAggregator reportingAggregator,
            Clock clock
    ) {
        this.paymentRecordStore = paymentRecordStore;
        this.planTracker = planTracker;
        this.reportingAggregator = reportingAggregator;
        this.clock = clock;
    }

    @GetMapping("/all")
    public PageResponse<PaymentResponse> all(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String courseId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        Caller.requireAdmin(caller);
        PaymentFilter filter = new PaymentFilter(
                PaymentStatus.fromWire(status), PaymentType.fromWire(type), userId, courseId, from, to);
        return PageResponse.of(paymentRecordStore.listForAdmin(filter, pageable), PaymentResponse::from);
    }

    @GetMapping("/installment-plans")
    public PageResponse<InstallmentPlanResponse> installmentPlans(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @RequestParam(required = false) String status,
            @RequestParam(name = "plan", required = false) String cadence,
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        Caller.requireAdmin(caller);
        return PageResponse.of(
                planTracker.listForAdmin(PlanStatus.fromWire(status), PlanCadence.fromWire(cadence), pageable),
                InstallmentPlanResponse::from);
    }

    @GetMapping("/installment-plans/overdue")
    public List<InstallmentPlanResponse> overdue(@RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller) {
        Caller.requireAdmin(caller);
        return reportingAggregator.overduePlans(LocalDate.now(clock)).stream()
                .map(InstallmentPlanResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public AdminStats stats(@RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller) {
        Caller.requireAdmin(caller);
        return reportingAggregator.stats();
    }
}
