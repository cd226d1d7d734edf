package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.domain.PaymentType;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.repo.PaymentRecordRepository;
import com.kmmedia.institute.payments.repo.PaymentRecordSpecification;
import com.kmmedia.institute.payments.service.dto.PaymentFilter;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns payment records: creation of PENDING records and the read side.
 *
 * <p>Status changes never happen here; they go through {@link PaymentRecord#settle} under the
 * reconciler's locks. Records are never deleted.</p>
 */
@Slf4j
@Service
public class PaymentRecordStore {

    private final PaymentRecordRepository paymentRecordRepository;
    private final AppProperties properties;
    private final Clock clock;

    public PaymentRecordStore(PaymentRecordRepository paymentRecordRepository, AppProperties properties, Clock clock) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a PENDING record with the default payment method.
     *
     * @param userId      student
     * @param courseId    course
     * @param amount      expected amount
     * @param paymentType what is paid for
     * @param reference   gateway reference
     * @return persisted record
     * @throws PaymentException DUPLICATE_REFERENCE
     */
    @Transactional
    public PaymentRecord createPending(String userId, String courseId, BigDecimal amount,
                                       PaymentType paymentType, String reference) {
        return createPending(userId, courseId, amount, paymentType, reference,
                properties.getFees().getDefaultPaymentMethod(), null, null);
    }

    /**
     * Creates a PENDING record.
     *
     * @param userId            student
     * @param courseId          course
     * @param amount            expected amount, positive with at most two decimals
     * @param paymentType       what is paid for
     * @param reference         gateway reference
     * @param paymentMethod     payment method label, default when blank
     * @param installmentNumber installment position, only for INSTALLMENT
     * @param totalInstallments installments in the plan, only for INSTALLMENT
     * @return persisted record
     * @throws PaymentException DUPLICATE_REFERENCE
     */
    @Transactional
    public PaymentRecord createPending(String userId, String courseId, BigDecimal amount, PaymentType paymentType,
                                       String reference, String paymentMethod,
                                       Integer installmentNumber, Integer totalInstallments) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        if (paymentRecordRepository.existsByReference(reference)) {
            throw duplicate(reference);
        }

        String method = (paymentMethod == null || paymentMethod.isBlank())
                ? properties.getFees().getDefaultPaymentMethod()
                : paymentMethod.trim();
        PaymentRecord record = PaymentRecord.pending(userId, courseId, reference, amount,
                properties.getFees().getCurrency(), paymentType, method, clock.instant());
        if (installmentNumber != null && totalInstallments != null) {
            record.describeInstallment(installmentNumber, totalInstallments);
        }

        PaymentRecord saved;
        try {
            saved = paymentRecordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            throw duplicate(reference);
        }
        log.info("Payment record created. reference={} userId={} courseId={} type={} amount={}",
                reference, userId, courseId, paymentType, amount);
        return saved;
    }

    /**
     * @param reference gateway reference
     * @return record
     * @throws PaymentException NOT_FOUND
     */
    @Transactional(readOnly = true)
    public PaymentRecord get(String reference) {
        return paymentRecordRepository.findByReference(reference)
                .orElseThrow(() -> PaymentException.of(PaymentErrorCode.NOT_FOUND, "Payment " + reference + " not found"));
    }

    @Transactional(readOnly = true)
    public Page<PaymentRecord> listForAdmin(PaymentFilter filter, Pageable pageable) {
        return paymentRecordRepository.findAll(PaymentRecordSpecification.matching(filter), pageable);
    }

    /**
     * Payment history of one student, newest first.
     *
     * @param userId student
     * @return records
     */
    @Transactional(readOnly = true)
    public List<PaymentRecord> listForUser(String userId) {
        return paymentRecordRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public boolean hasSuccessful(String userId, String courseId, PaymentType paymentType) {
        return paymentRecordRepository.existsByUserIdAndCourseIdAndPaymentTypeAndStatus(
                userId, courseId, paymentType, PaymentStatus.SUCCESS);
    }

    private PaymentException duplicate(String reference) {
        return PaymentException.of(PaymentErrorCode.DUPLICATE_REFERENCE, "Payment reference " + reference + " already exists");
    }
}
