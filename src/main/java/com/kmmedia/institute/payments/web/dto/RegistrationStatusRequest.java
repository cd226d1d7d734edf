package com.kmmedia.institute.payments.web.dto;

import com.kmmedia.institute.payments.domain.RegistrationStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegistrationStatusRequest(
        @NotNull RegistrationStatus status,
        @Size(max = 1000) String note
) {}
