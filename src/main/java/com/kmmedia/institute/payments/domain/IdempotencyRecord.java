package com.kmmedia.institute.payments.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Stored outcome of a payment initialization keyed by the client's idempotency key.
 *
 * <p>Keys belong to the student who sent them: the same key from two students is two records.
 * Same (scope, owner, key) with the same request hash replays the stored response; a different
 * hash is a conflict.</p>
 */
@Entity
@Table(
        name = "idempotency_records",
        uniqueConstraints = @UniqueConstraint(name = "uq_idempotency_scope_owner_key",
                columnNames = {"scope", "owner_id", "idempotency_key"}),
        indexes = @Index(name = "idx_idempotency_created_at", columnList = "created_at")
)
@Getter
@Setter
@NoArgsConstructor
public class IdempotencyRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "scope", nullable = false, updatable = false, length = 64)
    private String scope;

    @Column(name = "owner_id", nullable = false, updatable = false, length = 64)
    private String ownerId;

    @Column(name = "idempotency_key", nullable = false, updatable = false, length = 128)
    private String idempotencyKey;

    @Column(name = "request_hash", nullable = false, length = 88)
    private String requestHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private IdempotencyStatus status;

    @Column(name = "http_status")
    private Integer httpStatus;

    @Column(name = "response_body", columnDefinition = "text")
    private String responseBody;

    @Column(name = "payment_reference", length = 128)
    private String paymentReference;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates a new in-progress record.
     *
     * @param scope   api scope (operation)
     * @param ownerId student who owns the key
     * @param key     idempotency key
     * @param hash    request hash
     * @return record
     */
    public static IdempotencyRecord inProgress(String scope, String ownerId, String key, String hash) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(hash, "hash");

        IdempotencyRecord r = new IdempotencyRecord();
        r.id = UUID.randomUUID().toString();
        r.scope = scope;
        r.ownerId = ownerId;
        r.idempotencyKey = key;
        r.requestHash = hash;
        r.status = IdempotencyStatus.IN_PROGRESS;
        r.createdAt = Instant.now();
        r.updatedAt = r.createdAt;
        return r;
    }

    /**
     * Marks record as completed and stores the HTTP response.
     *
     * @param httpStatus       http status code
     * @param responseBody     response body JSON
     * @param paymentReference reference of the created payment record
     */
    public void complete(int httpStatus, String responseBody, String paymentReference) {
        this.status = IdempotencyStatus.COMPLETED;
        this.httpStatus = httpStatus;
        this.responseBody = responseBody;
        this.paymentReference = paymentReference;
        this.updatedAt = Instant.now();
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }

    public boolean isSameHash(String incomingHash) {
        return this.requestHash != null && this.requestHash.equals(incomingHash);
    }

    /**
     * Returns true if this record has been IN_PROGRESS longer than the given duration, which
     * happens when the process died mid-request. Initialization is a single DB transaction, so
     * such a record can be re-processed.
     *
     * @param maxAge max allowed age
     * @return true if stale
     */
    public boolean isStaleInProgress(Duration maxAge) {
        if (status != IdempotencyStatus.IN_PROGRESS) {
            return false;
        }
        Instant ref = updatedAt != null ? updatedAt : createdAt;
        return ref != null && ref.isBefore(Instant.now().minus(maxAge));
    }
}
