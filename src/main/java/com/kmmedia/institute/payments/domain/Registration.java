package com.kmmedia.institute.payments.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A student's registration for a course.
 *
 * <p>{@code paymentSettled} is set when the full course fee was paid in one charge; installment
 * settlement is read from the plan.</p>
 */
@Entity
@Table(
        name = "registrations",
        uniqueConstraints = @UniqueConstraint(name = "uq_registrations_user_course", columnNames = {"user_id", "course_id"}),
        indexes = @Index(name = "idx_registrations_status", columnList = "status")
)
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
public class Registration {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "course_id", nullable = false, updatable = false, length = 64)
    private String courseId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RegistrationStatus status;

    @Column(name = "payment_settled", nullable = false)
    private boolean paymentSettled;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates a PENDING registration awaiting admin review.
     *
     * @param userId   student
     * @param courseId course
     * @param note     initial note, may be null
     * @return registration
     */
    public static Registration pending(String userId, String courseId, String note, Instant createdAt) {
        Registration r = new Registration();
        r.id = UUID.randomUUID().toString();
        r.userId = userId;
        r.courseId = courseId;
        r.status = RegistrationStatus.PENDING;
        r.notes = note;
        r.createdAt = createdAt;
        r.updatedAt = r.createdAt;
        return r;
    }

    /**
     * Admin-driven status change.
     *
     * @param target requested status
     * @param note   optional note appended to {@code notes}
     * @param now    change time
     */
    public void changeByAdmin(RegistrationStatus target, String note, Instant now) {
        this.status = this.status.adminTransitionTo(target);
        appendNote(note);
        this.updatedAt = now;
    }

    /**
     * Payment-driven completion of an APPROVED registration.
     *
     * @param now change time
     */
    public void complete(Instant now) {
        this.status = this.status.complete();
        this.updatedAt = now;
    }

    /**
     * Records that the full course fee was received in one charge.
     *
     * @param reference payment reference
     * @param now       change time
     */
    public void markPaymentSettled(String reference, Instant now) {
        if (paymentSettled) {
            return;
        }
        this.paymentSettled = true;
        appendNote("Course fee settled with payment reference " + reference);
        this.updatedAt = now;
    }

    private void appendNote(String note) {
        if (note == null || note.isBlank()) {
            return;
        }
        this.notes = (notes == null || notes.isBlank()) ? note.trim() : notes + "\n" + note.trim();
    }
}
