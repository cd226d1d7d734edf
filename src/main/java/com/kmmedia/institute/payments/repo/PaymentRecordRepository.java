package com.kmmedia.institute.payments.repo;

import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.domain.PaymentType;
import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link PaymentRecord}.
 */
public interface PaymentRecordRepository extends JpaRepository<PaymentRecord, String>, JpaSpecificationExecutor<PaymentRecord> {

    Optional<PaymentRecord> findByReference(String reference);

    boolean existsByReference(String reference);

    /**
     * Loads the record and locks its row until the transaction ends.
     *
     * @param reference gateway reference
     * @return record
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PaymentRecord p where p.reference = :reference")
    Optional<PaymentRecord> findByReferenceForUpdate(@Param("reference") String reference);

    List<PaymentRecord> findByUserIdOrderByCreatedAtDesc(String userId);

    boolean existsByUserIdAndCourseIdAndPaymentTypeAndStatus(
            String userId, String courseId, PaymentType paymentType, PaymentStatus status);

    Optional<PaymentRecord> findFirstByUserIdAndCourseIdAndPaymentTypeAndStatusOrderByCreatedAtAsc(
            String userId, String courseId, PaymentType paymentType, PaymentStatus status);

    List<PaymentRecord> findByOrderByCreatedAtDesc(Pageable pageable);

    @Query("""
            select p.status as groupKey, count(p) as rowCount, coalesce(sum(p.amount), 0) as amountTotal
            from PaymentRecord p
            group by p.status
            """)
    List<GroupTotals> totalsByStatus();

    @Query("""
            select p.paymentType as groupKey, count(p) as rowCount, coalesce(sum(p.amount), 0) as amountTotal
            from PaymentRecord p
            where p.status = com.kmmedia.institute.payments.domain.PaymentStatus.SUCCESS
            group by p.paymentType
            """)
    List<GroupTotals> successfulTotalsByType();

    @Query("""
            select coalesce(sum(p.amount), 0)
            from PaymentRecord p
            where p.status = com.kmmedia.institute.payments.domain.PaymentStatus.SUCCESS
              and p.paidAt >= :since
            """)
    BigDecimal sumSuccessfulPaidSince(@Param("since") Instant since);
}
