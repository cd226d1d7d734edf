package com.kmmedia.institute.payments.web;

import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.service.AdminReportingAggregator;
import com.kmmedia.institute.payments.service.RegistrationAdminService;
import com.kmmedia.institute.payments.service.RegistrationStatusCoordinator;
import com.kmmedia.institute.payments.service.dto.RegistrationStats;
import com.kmmedia.institute.payments.web.caller.Caller;
import com.kmmedia.institute.payments.web.dto.BulkRegistrationStatusRequest;
import com.kmmedia.institute.payments.web.dto.BulkStatusResponse;
import com.kmmedia.institute.payments.web.dto.RegistrationResponse;
import com.kmmedia.institute.payments.web.dto.RegistrationStatusRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registration status API: admin decisions and the student's own registration.
 */
@RestController
@RequestMapping("/registrations")
public class RegistrationController {

    private final RegistrationStatusCoordinator coordinator;
    private final RegistrationAdminService adminService;
    private final AdminReportingAggregator reportingAggregator;

    public RegistrationController(
            RegistrationStatusCoordinator coordinator,
            RegistrationAdminService adminService,
            AdminReportingAggregator reportingAggregator
    ) {
        this.coordinator = coordinator;
        this.adminService = adminService;
        this.reportingAggregator = reportingAggregator;
    }

    @PatchMapping("/{id}/status")
    public RegistrationResponse setStatus(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @PathVariable String id,
            @Valid @RequestBody RegistrationStatusRequest request
    ) {
        Caller.requireAdmin(caller);
        return RegistrationResponse.from(coordinator.adminSetStatus(id, request.status(), request.note()));
    }

    /**
     * Bulk variant; always 200, with a result per id.
     */
    @PatchMapping("/status")
    public BulkStatusResponse setStatusBulk(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @Valid @RequestBody BulkRegistrationStatusRequest request
    ) {
        Caller.requireAdmin(caller);
        return BulkStatusResponse.of(adminService.setStatusBulk(request.registrationIds(), request.status(), request.note()));
    }

    @GetMapping("/admin/stats")
    public RegistrationStats stats(@RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller) {
        Caller.requireAdmin(caller);
        return reportingAggregator.registrationStats();
    }

    @GetMapping("/course/{courseId}")
    public RegistrationResponse mine(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @PathVariable String courseId
    ) {
        Caller student = Caller.require(caller);
        return coordinator.find(student.userId(), courseId)
                .map(RegistrationResponse::from)
                .orElseThrow(() -> PaymentException.of(PaymentErrorCode.NOT_FOUND,
                        "No registration for course " + courseId));
    }
}
