package com.kmmedia.institute.payments.web.dto;

import com.kmmedia.institute.payments.domain.RegistrationStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Same status change for many registrations; each id succeeds or fails on its own.
 */
public record BulkRegistrationStatusRequest(
        @NotEmpty @Size(max = 500) List<@NotBlank String> registrationIds,
        @NotNull RegistrationStatus status,
        @Size(max = 1000) String note
) {}
