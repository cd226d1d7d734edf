package com.kmmedia.institute.payments.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One payment attempt: an application fee, a full course fee or one installment.
 *
 * <p>Created PENDING when a client initiates a charge and moved to a terminal status only by the
 * webhook reconciler. Rows are never deleted.</p>
 */
@Entity
@Table(
        name = "payment_records",
        uniqueConstraints = @UniqueConstraint(name = "uq_payment_records_reference", columnNames = "reference"),
        indexes = {
                @Index(name = "idx_payment_records_user_course", columnList = "user_id,course_id"),
                @Index(name = "idx_payment_records_status_created", columnList = "status,created_at")
        }
)
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
public class PaymentRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "course_id", nullable = false, updatable = false, length = 64)
    private String courseId;

    @Column(name = "reference", nullable = false, updatable = false, length = 128)
    private String reference;

    @Column(name = "amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 8)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false, length = 32)
    private PaymentType paymentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentStatus status;

    @Column(name = "payment_method", nullable = false, length = 32)
    private String paymentMethod;

    @Column(name = "installment_number")
    private Integer installmentNumber;

    @Column(name = "total_installments")
    private Integer totalInstallments;

    @Column(name = "gateway_metadata", columnDefinition = "text")
    private String gatewayMetadata;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates a PENDING record.
     *
     * @param userId      paying student
     * @param courseId    course paid for
     * @param reference   gateway reference, globally unique
     * @param amount      expected amount in major units
     * @param currency    ISO currency
     * @param paymentType what is paid for
     * @param method      payment method label
     * @return new record
     */
    public static PaymentRecord pending(String userId, String courseId, String reference, BigDecimal amount,
                                        String currency, PaymentType paymentType, String method,
                                        Instant createdAt) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(courseId, "courseId");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(paymentType, "paymentType");
        Objects.requireNonNull(createdAt, "createdAt");

        PaymentRecord p = new PaymentRecord();
        p.id = UUID.randomUUID().toString();
        p.userId = userId;
        p.courseId = courseId;
        p.reference = reference;
        p.amount = amount;
        p.currency = currency;
        p.paymentType = paymentType;
        p.paymentMethod = method;
        p.status = PaymentStatus.PENDING;
        p.createdAt = createdAt;
        p.updatedAt = p.createdAt;
        return p;
    }

    /**
     * Attaches the installment position this record pays for.
     *
     * @param number 1-based installment number
     * @param total  installments in the plan
     */
    public void describeInstallment(int number, int total) {
        this.installmentNumber = number;
        this.totalInstallments = total;
    }

    /**
     * Applies a gateway outcome. Terminal statuses are immutable.
     *
     * @param target   terminal status
     * @param at       event time; becomes {@code paidAt} for SUCCESS
     * @param metadata raw gateway metadata, may be null
     */
    public void settle(PaymentStatus target, Instant at, String metadata) {
        this.status = this.status.transitionTo(target);
        if (target == PaymentStatus.SUCCESS) {
            this.paidAt = at;
        }
        if (metadata != null) {
            this.gatewayMetadata = metadata;
        }
        this.updatedAt = at;
    }

    /**
     * Exact comparison, ignoring scale ({@code 250} equals {@code 250.00}).
     *
     * @param incoming amount reported by the gateway
     * @return true when equal
     */
    public boolean matchesAmount(BigDecimal incoming) {
        return incoming != null && amount.compareTo(incoming) == 0;
    }
}
