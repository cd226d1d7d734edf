package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.InstallmentPlan;
import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.domain.PaymentType;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.service.catalog.CourseCatalog;
import com.kmmedia.institute.payments.service.catalog.CourseFeeTerms;
import com.kmmedia.institute.payments.service.events.PaymentInitiatedEvent;
import com.kmmedia.institute.payments.service.gateway.PaymentReferenceGenerator;
import com.kmmedia.institute.payments.web.dto.InitiatePaymentRequest;
import com.kmmedia.institute.payments.web.dto.PaymentResponse;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Business service for starting payments.
 */
@Service
public class PaymentService {

    private final PaymentRecordStore paymentRecordStore;
    private final InstallmentPlanTracker planTracker;
    private final CourseCatalog courseCatalog;
    private final PaymentReferenceGenerator referenceGenerator;
    private final OutboxWriter outboxWriter;
    private final AppProperties properties;
    private final Clock clock;

    public PaymentService(
            PaymentRecordStore paymentRecordStore,
            InstallmentPlanTracker planTracker,
            CourseCatalog courseCatalog,
            PaymentReferenceGenerator referenceGenerator,
            OutboxWriter outboxWriter,
            AppProperties properties,
            Clock clock
    ) {
        this.paymentRecordStore = paymentRecordStore;
        this.planTracker = planTracker;
        this.courseCatalog = courseCatalog;
        this.referenceGenerator = referenceGenerator;
        this.outboxWriter = outboxWriter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Prices the request, creates the PENDING record and writes a {@code PaymentInitiated} outbox
     * event in the same transaction.
     *
     * <p>Propagation is MANDATORY: the idempotency layer owns the transaction so the payment row,
     * the outbox row and the idempotency record commit together.</p>
     *
     * @param userId  paying student
     * @param request initialization request
     * @return response DTO
     * @throws PaymentException NOT_FOUND, ALREADY_PAID, PLAN_ALREADY_EXISTS, PLAN_NOT_ACTIVE or
     *                          INSTALLMENTS_NOT_OFFERED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentResponse initiate(String userId, InitiatePaymentRequest request) {
        String courseId = request.courseId();
        CourseFeeTerms terms = courseCatalog.feeTerms(courseId);

        PaymentRecord record = switch (request.paymentType()) {
            case APPLICATION_FEE -> {
                requireNotPaid(userId, courseId, PaymentType.APPLICATION_FEE);
                yield create(userId, request, properties.getFees().getApplicationFee(), null, null);
            }
            case COURSE_FEE -> {
                requireNotPaid(userId, courseId, PaymentType.COURSE_FEE);
                if (planTracker.findActive(userId, courseId).isPresent()) {
                    throw PaymentException.of(PaymentErrorCode.PLAN_ALREADY_EXISTS,
                            "Course " + courseId + " is being paid by an active installment plan");
                }
                yield create(userId, request, terms.courseFee(), null, null);
            }
            case INSTALLMENT -> {
                if (!terms.installmentsOffered()) {
                    throw PaymentException.of(PaymentErrorCode.INSTALLMENTS_NOT_OFFERED,
                            "Course " + courseId + " does not offer installment plans");
                }
                InstallmentPlan plan = planTracker.findActive(userId, courseId)
                        .orElseThrow(() -> PaymentException.of(PaymentErrorCode.PLAN_NOT_ACTIVE,
                                "No active installment plan for course " + courseId));
                BigDecimal amount = plan.nextInstallmentAmount();
                if (amount.signum() <= 0) {
                    throw PaymentException.of(PaymentErrorCode.OVERPAYMENT_REJECTED,
                            "Installment plan " + plan.getId() + " has no installment left to pay");
                }
                yield create(userId, request, amount, plan.getPaidInstallments() + 1, plan.getTotalInstallments());
            }
        };

        outboxWriter.append("PaymentRecord", record.getId(), "PaymentInitiated", record.getReference(),
                new PaymentInitiatedEvent(
                        OutboxWriter.SCHEMA_VERSION,
                        UUID.randomUUID().toString(),
                        clock.instant(),
                        record.getId(),
                        record.getReference(),
                        userId,
                        courseId,
                        record.getAmount(),
                        record.getCurrency(),
                        record.getPaymentType().wireName(),
                        record.getInstallmentNumber()
                ));

        return PaymentResponse.from(record);
    }

    private PaymentRecord create(String userId, InitiatePaymentRequest request, BigDecimal amount,
                                 Integer installmentNumber, Integer totalInstallments) {
        return paymentRecordStore.createPending(userId, request.courseId(), amount, request.paymentType(),
                referenceGenerator.next(), request.paymentMethod(), installmentNumber, totalInstallments);
    }

    private void requireNotPaid(String userId, String courseId, PaymentType type) {
        if (paymentRecordStore.hasSuccessful(userId, courseId, type)) {
            throw PaymentException.of(PaymentErrorCode.ALREADY_PAID,
                    type.wireName() + " for course " + courseId + " has already been paid");
        }
    }
}
