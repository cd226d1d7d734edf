package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.domain.PlanStatus;
import com.kmmedia.institute.payments.domain.Registration;
import com.kmmedia.institute.payments.domain.RegistrationStatus;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.repo.InstallmentPlanRepository;
import com.kmmedia.institute.payments.repo.RegistrationRepository;
import com.kmmedia.institute.payments.service.events.InstallmentPlanCompletedEvent;
import com.kmmedia.institute.payments.service.events.RegistrationStatusChangedEvent;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps a registration's status consistent with admin decisions and payment completeness.
 *
 * <p>Admins approve or reject; payments complete. An APPROVED registration becomes COMPLETED as
 * soon as its course fee is settled, either in one COURSE_FEE charge or through a COMPLETED
 * installment plan, whichever of approval and settlement happens last.</p>
 */
@Slf4j
@Service
public class RegistrationStatusCoordinator {

    private static final String REGISTRATION_LOCK_SCOPE = "registrations:pair";

    private final RegistrationRepository registrationRepository;
    private final InstallmentPlanRepository planRepository;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final OutboxWriter outboxWriter;
    private final Clock clock;

    public RegistrationStatusCoordinator(
            RegistrationRepository registrationRepository,
            InstallmentPlanRepository planRepository,
            PostgresAdvisoryLockService advisoryLockService,
            OutboxWriter outboxWriter,
            Clock clock
    ) {
        this.registrationRepository = registrationRepository;
        this.planRepository = planRepository;
        this.advisoryLockService = advisoryLockService;
        this.outboxWriter = outboxWriter;
        this.clock = clock;
    }

    /**
     * Re-evaluates the pair's registration after a payment settled. Idempotent.
     *
     * @param userId   student
     * @param courseId course
     * @return the registration when one exists
     */
    @Transactional
    public Optional<Registration> onPaymentCompleted(String userId, String courseId) {
        Optional<Registration> found = registrationRepository.findByUserIdAndCourseIdForUpdate(userId, courseId);
        found.ifPresent(this::completeIfSettled);
        return found;
    }

    @EventListener
    public void onInstallmentPlanCompleted(InstallmentPlanCompletedEvent event) {
        onPaymentCompleted(event.userId(), event.courseId());
    }

    /**
     * Admin status change. A note, when given, is appended to the registration notes.
     *
     * @param registrationId registration id
     * @param target         requested status
     * @param note           optional note
     * @return updated registration
     * @throws PaymentException NOT_FOUND or INVALID_TRANSITION
     */
    @Transactional
    public Registration adminSetStatus(String registrationId, RegistrationStatus target, String note) {
        if (target == null) {
            throw new IllegalArgumentException("status is required");
        }
        Registration registration = registrationRepository.findByIdForUpdate(registrationId)
                .orElseThrow(() -> PaymentException.of(PaymentErrorCode.NOT_FOUND,
                        "Registration " + registrationId + " not found"));

        RegistrationStatus previous = registration.getStatus();
        registration.changeByAdmin(target, note, clock.instant());
        registrationRepository.save(registration);
        statusChanged(registration, previous, "admin");
        log.info("Registration status changed by admin. registrationId={} {} -> {}",
                registrationId, previous, target);

        if (target == RegistrationStatus.APPROVED) {
            completeIfSettled(registration);
        }
        return registration;
    }

    /**
     * Returns the pair's registration, creating a PENDING one when there is none.
     *
     * @param userId   student
     * @param courseId course
     * @param note     note stored on a newly created registration
     * @return registration, locked for the rest of the transaction
     */
    @Transactional
    public Registration ensureRegistration(String userId, String courseId, String note) {
        advisoryLockService.lock(REGISTRATION_LOCK_SCOPE, userId + "|" + courseId);
        Optional<Registration> existing = registrationRepository.findByUserIdAndCourseIdForUpdate(userId, courseId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Registration created = registrationRepository.saveAndFlush(
                Registration.pending(userId, courseId, note, clock.instant()));
        statusChanged(created, null, "payment");
        log.info("Registration created from payment. registrationId={} userId={} courseId={}",
                created.getId(), userId, courseId);
        return created;
    }

    /**
     * Records that the full course fee was paid in one charge.
     *
     * @param userId    student
     * @param courseId  course
     * @param reference payment reference
     * @return registration
     */
    @Transactional
    public Registration markPaymentSettled(String userId, String courseId, String reference) {
        Registration registration = ensureRegistration(userId, courseId,
                "Course fee paid with payment reference " + reference);
        registration.markPaymentSettled(reference, clock.instant());
        return registrationRepository.save(registration);
    }

    @Transactional(readOnly = true)
    public Optional<Registration> find(String userId, String courseId) {
        return registrationRepository.findByUserIdAndCourseId(userId, courseId);
    }

    private void completeIfSettled(Registration registration) {
        if (registration.getStatus() != RegistrationStatus.APPROVED || !isSettled(registration)) {
            return;
        }
        registration.complete(clock.instant());
        registrationRepository.save(registration);
        statusChanged(registration, RegistrationStatus.APPROVED, "payment");
        log.info("Registration completed. registrationId={} userId={} courseId={}",
                registration.getId(), registration.getUserId(), registration.getCourseId());
    }

    private boolean isSettled(Registration registration) {
        return registration.isPaymentSettled()
                || planRepository.existsByUserIdAndCourseIdAndStatus(
                registration.getUserId(), registration.getCourseId(), PlanStatus.COMPLETED);
    }

    private void statusChanged(Registration registration, RegistrationStatus previous, String trigger) {
        RegistrationStatusChangedEvent event = new RegistrationStatusChangedEvent(
                OutboxWriter.SCHEMA_VERSION,
                UUID.randomUUID().toString(),
                clock.instant(),
                registration.getId(),
                registration.getUserId(),
                registration.getCourseId(),
                previous == null ? null : previous.wireName(),
                registration.getStatus().wireName(),
                trigger
        );
        outboxWriter.append("Registration", registration.getId(), "RegistrationStatusChanged",
                registration.getUserId(), event);
    }
}
