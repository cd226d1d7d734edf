package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.repo.PaymentRecordRepository;
import com.kmmedia.institute.payments.service.dto.WebhookEvent;
import com.kmmedia.institute.payments.service.dto.WebhookOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

/**
 * Maps gateway webhook events onto payment records.
 *
 * <p>Cheap checks run first, without locks, so gateways get a prompt answer for events that can
 * never apply: unknown reference, replay of a terminal status, conflicting terminal status, wrong
 * amount. Only then does {@link ReconciliationTxService} take the locks and apply the change.
 * Rejections are never swallowed; they are logged, counted and returned to the gateway.</p>
 */
@Slf4j
@Service
public class WebhookReconciler {

    private final PaymentRecordRepository paymentRecordRepository;
    private final ReconciliationTxService txService;
    private final MeterRegistry meterRegistry;

    private final Counter appliedCounter;
    private final Counter replayedCounter;

    public WebhookReconciler(
            PaymentRecordRepository paymentRecordRepository,
            ReconciliationTxService txService,
            MeterRegistry meterRegistry
    ) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.txService = txService;
        this.meterRegistry = meterRegistry;

        this.appliedCounter = Counter.builder("payments.webhook.applied").register(meterRegistry);
        this.replayedCounter = Counter.builder("payments.webhook.replayed").register(meterRegistry);
    }

    /**
     * Handles one verified webhook event.
     *
     * @param event event
     * @return outcome; a replay of an already applied terminal status is a successful no-op
     * @throws PaymentException UNKNOWN_REFERENCE, CONFLICTING_TRANSITION, AMOUNT_MISMATCH,
     *                          CONCURRENT_UPDATE when a row lock cannot be taken, or any failure of
     *                          the side effects (nothing is applied in that case)
     */
    public WebhookOutcome handle(WebhookEvent event) {
        String reference = event.reference();
        PaymentStatus target = event.status().toPaymentStatus();

        PaymentRecord current = paymentRecordRepository.findByReference(reference).orElse(null);
        if (current == null) {
            throw reject(PaymentException.of(PaymentErrorCode.UNKNOWN_REFERENCE,
                    "No payment record for reference " + reference), event, null);
        }

        if (current.getStatus().isTerminal()) {
            if (current.getStatus() == target) {
                replayedCounter.increment();
                log.info("Webhook replay ignored. reference={} status={}", reference, target);
                return WebhookOutcome.replayed(reference, current.getStatus());
            }
            throw reject(ReconciliationTxService.conflicting(reference, current.getStatus(), target), event, current);
        }

        if (!current.matchesAmount(event.amount())
                || (event.currency() != null && !event.currency().equalsIgnoreCase(current.getCurrency()))) {
            throw reject(PaymentException.of(PaymentErrorCode.AMOUNT_MISMATCH,
                    "Payment " + reference + " expects " + current.getAmount() + " " + current.getCurrency()
                            + ", gateway reported " + event.amount() + " " + event.currency()), event, current);
        }

        if (target == PaymentStatus.PENDING) {
            log.info("Webhook pending event acknowledged. reference={}", reference);
            return WebhookOutcome.acknowledged(reference, current.getStatus());
        }

        WebhookOutcome outcome;
        try {
            outcome = txService.apply(event, target);
        } catch (PaymentException e) {
            throw reject(e, event, current);
        } catch (ConcurrencyFailureException e) {
            // lock timeout, deadlock or stale row: nothing was applied, the gateway retries
            throw reject(new PaymentException(PaymentErrorCode.CONCURRENT_UPDATE,
                    "Payment " + reference + " is being updated concurrently", e), event, current);
        }

        if (outcome.replayed()) {
            replayedCounter.increment();
        } else {
            appliedCounter.increment();
        }
        return outcome;
    }

    private PaymentException reject(PaymentException e, WebhookEvent event, PaymentRecord current) {
        Counter.builder("payments.webhook.rejected")
                .tag("code", e.getCode().name())
                .register(meterRegistry)
                .increment();
        log.warn("Webhook rejected. code={} gateway={} reference={} storedStatus={} incomingStatus={} amount={} message={}",
                e.getCode(), event.gateway(), event.reference(),
                current == null ? null : current.getStatus(), event.status(), event.amount(), e.getMessage());
        return e;
    }
}
