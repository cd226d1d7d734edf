package com.kmmedia.institute.payments.service.dto;

import com.kmmedia.institute.payments.domain.GatewayStatus;
import java.math.BigDecimal;

/**
 * A gateway callback after signature verification and parsing.
 *
 * @param gateway   gateway name from the callback URL
 * @param reference payment reference
 * @param status    reported status
 * @param amount    charged amount in major units
 * @param currency  charged currency
 * @param metadata  raw gateway metadata as JSON, may be null
 */
public record WebhookEvent(
        String gateway,
        String reference,
        GatewayStatus status,
        BigDecimal amount,
        String currency,
        String metadata
) {}
