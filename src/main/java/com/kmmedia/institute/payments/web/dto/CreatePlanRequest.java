package com.kmmedia.institute.payments.web.dto;

import com.kmmedia.institute.payments.domain.PlanCadence;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request payload for opening an installment plan. The course fee comes from the catalog.
 */
public record CreatePlanRequest(
        @NotBlank @Size(max = 64) String courseId,
        @NotNull @Min(1) @Max(12) Integer totalInstallments,
        @NotNull PlanCadence paymentPlan
) {}
