package com.kmmedia.institute.payments.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.kmmedia.institute.payments.domain.GatewayStatus;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Gateway callback body. {@code amount} is in major currency units.
 */
public record WebhookRequest(
        @NotBlank @Size(max = 128) String reference,
        @NotNull GatewayStatus status,
        @NotNull @Positive @Digits(integer = 10, fraction = 2) BigDecimal amount,
        @NotBlank @Size(max = 8) String currency,
        JsonNode metadata
) {}
