package com.kmmedia.institute.payments.service.dto;

/**
 * Everything the admin dashboard shows, computed in one call.
 */
public record AdminStats(PaymentStats payments, RegistrationStats registrations, InstallmentPlanStats installmentPlans) {}
