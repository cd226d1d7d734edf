package com.kmmedia.institute.payments.repo;

import com.kmmedia.institute.payments.domain.InstallmentPlan;
import com.kmmedia.institute.payments.domain.PlanCadence;
import com.kmmedia.institute.payments.domain.PlanStatus;
import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link InstallmentPlan}.
 */
public interface InstallmentPlanRepository extends JpaRepository<InstallmentPlan, String> {

    /**
     * Loads the plan and locks its row so balance updates from concurrent webhooks serialize.
     *
     * @param id plan id
     * @return plan
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from InstallmentPlan p where p.id = :id")
    Optional<InstallmentPlan> findByIdForUpdate(@Param("id") String id);

    /**
     * Loads the pair's ACTIVE plan and locks its row. Webhooks mutate the plan only through
     * this read, so the entity is never cached unlocked in the same transaction.
     *
     * @param userId   student
     * @param courseId course
     * @return active plan
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select p from InstallmentPlan p
            where p.userId = :userId
              and p.courseId = :courseId
              and p.status = com.kmmedia.institute.payments.domain.PlanStatus.ACTIVE
            """)
    Optional<InstallmentPlan> findActiveForUpdate(@Param("userId") String userId, @Param("courseId") String courseId);

    Optional<InstallmentPlan> findFirstByUserIdAndCourseIdAndStatus(String userId, String courseId, PlanStatus status);

    /**
     * Most recent plan of a pair, whatever its status.
     *
     * @param userId   student
     * @param courseId course
     * @return plan
     */
    Optional<InstallmentPlan> findFirstByUserIdAndCourseIdOrderByCreatedAtDesc(String userId, String courseId);

    boolean existsByUserIdAndCourseIdAndStatus(String userId, String courseId, PlanStatus status);

    Page<InstallmentPlan> findByStatus(PlanStatus status, Pageable pageable);

    Page<InstallmentPlan> findByPaymentPlan(PlanCadence cadence, Pageable pageable);

    Page<InstallmentPlan> findByStatusAndPaymentPlan(PlanStatus status, PlanCadence cadence, Pageable pageable);

    List<InstallmentPlan> findByStatusAndNextDueDateBeforeOrderByNextDueDateAsc(PlanStatus status, LocalDate date);

    @Query("select p.status as groupKey, count(p) as rowCount from InstallmentPlan p group by p.status")
    List<GroupCount> countByStatus();

    @Query("select p.paymentPlan as groupKey, count(p) as rowCount from InstallmentPlan p group by p.paymentPlan")
    List<GroupCount> countByCadence();

    @Query("""
            select coalesce(sum(p.remainingBalance), 0)
            from InstallmentPlan p
            where p.status = com.kmmedia.institute.payments.domain.PlanStatus.ACTIVE
            """)
    BigDecimal sumOutstandingBalance();
}
