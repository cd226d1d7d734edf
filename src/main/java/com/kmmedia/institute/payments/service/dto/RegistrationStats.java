package com.kmmedia.institute.payments.service.dto;

/**
 * Registration dashboard figures.
 */
public record RegistrationStats(
        long totalRegistrations,
        long pendingRegistrations,
        long approvedRegistrations,
        long rejectedRegistrations,
        long completedRegistrations,
        long recentRegistrations
) {}
