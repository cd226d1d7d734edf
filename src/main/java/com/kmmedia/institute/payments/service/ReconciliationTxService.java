package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.repo.PaymentRecordRepository;
import com.kmmedia.institute.payments.service.dto.WebhookEvent;
import com.kmmedia.institute.payments.service.dto.WebhookOutcome;
import com.kmmedia.institute.payments.service.events.PaymentReconciledEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional half of webhook reconciliation.
 *
 * <p>Lives in its own bean so {@link WebhookReconciler} always calls it through the Spring proxy
 * and the transaction actually starts.</p>
 *
 * <p>Within one transaction:
 * <ol>
 *   <li>advisory lock on the payment reference</li>
 *   <li>re-read the record {@code FOR UPDATE} and re-check terminal state</li>
 *   <li>transition the record</li>
 *   <li>apply the per-type side effect on the plan or registration</li>
 *   <li>re-evaluate the registration and write a {@code PaymentReconciled} outbox event</li>
 * </ol>
 * Any failure rolls all of it back.</p>
 */
@Slf4j
@Service
public class ReconciliationTxService {

    private final PaymentRecordRepository paymentRecordRepository;
    private final InstallmentPlanTracker planTracker;
    private final RegistrationStatusCoordinator registrationCoordinator;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final OutboxWriter outboxWriter;
    private final AppProperties properties;
    private final Clock clock;

    public ReconciliationTxService(
            PaymentRecordRepository paymentRecordRepository,
            InstallmentPlanTracker planTracker,
            RegistrationStatusCoordinator registrationCoordinator,
            PostgresAdvisoryLockService advisoryLockService,
            OutboxWriter outboxWriter,
            AppProperties properties,
            Clock clock
    ) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.planTracker = planTracker;
        this.registrationCoordinator = registrationCoordinator;
        this.advisoryLockService = advisoryLockService;
        this.outboxWriter = outboxWriter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Applies a terminal gateway status to the record with the event's reference.
     *
     * @param event  verified webhook event
     * @param target terminal status requested by the event
     * @return outcome
     */
    @Transactional
    public WebhookOutcome apply(WebhookEvent event, PaymentStatus target) {
        String reference = event.reference();
        advisoryLockService.lock(properties.getIdempotency().getWebhookScope(), reference);

        PaymentRecord record = paymentRecordRepository.findByReferenceForUpdate(reference)
                .orElseThrow(() -> PaymentException.of(PaymentErrorCode.UNKNOWN_REFERENCE,
                        "No payment record for reference " + reference));

        PaymentStatus previous = record.getStatus();
        if (previous.isTerminal()) {
            // a concurrent delivery got here first
            if (previous == target) {
                return WebhookOutcome.replayed(reference, previous);
            }
            throw conflicting(reference, previous, target);
        }

        Instant now = clock.instant();
        record.settle(target, now, event.metadata());
        paymentRecordRepository.save(record);

        if (target == PaymentStatus.SUCCESS) {
            applySideEffect(record);
        }

        outboxWriter.append("PaymentRecord", record.getId(), "PaymentReconciled", record.getReference(),
                new PaymentReconciledEvent(
                        OutboxWriter.SCHEMA_VERSION,
                        UUID.randomUUID().toString(),
                        now,
                        record.getId(),
                        record.getReference(),
                        record.getUserId(),
                        record.getCourseId(),
                        record.getAmount(),
                        record.getCurrency(),
                        record.getPaymentType().wireName(),
                        previous.wireName(),
                        target.wireName(),
                        event.gateway()
                ));

        log.info("Payment reconciled. reference={} type={} {} -> {} gateway={}",
                reference, record.getPaymentType(), previous, target, event.gateway());
        return WebhookOutcome.applied(reference, target);
    }

    private void applySideEffect(PaymentRecord record) {
        String userId = record.getUserId();
        String courseId = record.getCourseId();
        switch (record.getPaymentType()) {
            // plan row before registration row, in every branch
            case APPLICATION_FEE -> {
                planTracker.markApplicationFeePaidOnActivePlan(userId, courseId, record.getReference());
                registrationCoordinator.ensureRegistration(userId, courseId,
                        "Application submitted with payment reference " + record.getReference());
            }
            case COURSE_FEE -> registrationCoordinator.markPaymentSettled(userId, courseId, record.getReference());
            case INSTALLMENT -> planTracker.applyInstallmentToActivePlan(userId, courseId, record.getAmount());
        }
        registrationCoordinator.onPaymentCompleted(userId, courseId);
    }

    static PaymentException conflicting(String reference, PaymentStatus stored, PaymentStatus incoming) {
        return PaymentException.of(PaymentErrorCode.CONFLICTING_TRANSITION,
                "Payment " + reference + " is already " + stored.wireName() + ", gateway reported " + incoming.wireName());
    }
}
