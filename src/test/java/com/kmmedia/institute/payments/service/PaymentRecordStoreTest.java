package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.domain.PaymentType;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.repo.PaymentRecordRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;

class PaymentRecordStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private PaymentRecordRepository repository;
    private PaymentRecordStore store;

    @BeforeEach
    void setUp() {
        repository = Mockito.mock(PaymentRecordRepository.class);
        store = new PaymentRecordStore(repository, new AppProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        Mockito.when(repository.saveAndFlush(Mockito.any(PaymentRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createsPendingRecordWithDefaults() {
        PaymentRecord record = store.createPending("u1", "video-production", new BigDecimal("100.00"),
                PaymentType.APPLICATION_FEE, "KM_MEDIA_A");

        Assertions.assertEquals(PaymentStatus.PENDING, record.getStatus());
        Assertions.assertEquals("GHS", record.getCurrency());
        Assertions.assertEquals("paystack", record.getPaymentMethod());
        Assertions.assertNull(record.getPaidAt());
        Assertions.assertNull(record.getInstallmentNumber());
        Assertions.assertEquals(NOW, record.getCreatedAt());
        Assertions.assertEquals(NOW, record.getUpdatedAt());
    }

    @Test
    void installmentRecordCarriesItsPosition() {
        PaymentRecord record = store.createPending("u1", "video-production", new BigDecimal("250.00"),
                PaymentType.INSTALLMENT, "KM_MEDIA_B", " momo ", 2, 4);

        Assertions.assertEquals("momo", record.getPaymentMethod());
        Assertions.assertEquals(2, record.getInstallmentNumber());
        Assertions.assertEquals(4, record.getTotalInstallments());
    }

    @Test
    void nonPositiveAmountIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.createPending("u1", "video-production",
                BigDecimal.ZERO, PaymentType.COURSE_FEE, "KM_MEDIA_C"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.createPending("u1", "video-production",
                new BigDecimal("-1.00"), PaymentType.COURSE_FEE, "KM_MEDIA_C"));
        Mockito.verify(repository, Mockito.never()).saveAndFlush(Mockito.any());
    }

    @Test
    void duplicateReferenceIsRejected() {
        Mockito.when(repository.existsByReference("KM_MEDIA_D")).thenReturn(true);

        PaymentException ex = Assertions.assertThrows(PaymentException.class, () -> store.createPending("u1",
                "video-production", new BigDecimal("100.00"), PaymentType.APPLICATION_FEE, "KM_MEDIA_D"));

        Assertions.assertEquals(PaymentErrorCode.DUPLICATE_REFERENCE, ex.getCode());
    }

    @Test
    void duplicateReferenceRaceIsRejected() {
        Mockito.when(repository.saveAndFlush(Mockito.any(PaymentRecord.class)))
                .thenThrow(new DataIntegrityViolationException("uq_payment_records_reference"));

        PaymentException ex = Assertions.assertThrows(PaymentException.class, () -> store.createPending("u1",
                "video-production", new BigDecimal("100.00"), PaymentType.APPLICATION_FEE, "KM_MEDIA_E"));

        Assertions.assertEquals(PaymentErrorCode.DUPLICATE_REFERENCE, ex.getCode());
    }

    @Test
    void unknownReferenceIsNotFound() {
        Mockito.when(repository.findByReference("nope")).thenReturn(Optional.empty());

        PaymentException ex = Assertions.assertThrows(PaymentException.class, () -> store.get("nope"));

        Assertions.assertEquals(PaymentErrorCode.NOT_FOUND, ex.getCode());
    }
}
