package com.kmmedia.institute.payments.service.events;

import java.time.Instant;

/**
 * Event emitted on every registration status change.
 *
 * @param previousStatus status before the change, null when the registration was just created
 * @param trigger        {@code admin} or {@code payment}
 */
public record RegistrationStatusChangedEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String registrationId,
        String userId,
        String courseId,
        String previousStatus,
        String status,
        String trigger
) {}
