package com.kmmedia.institute.payments.repo;

import com.kmmedia.institute.payments.domain.IdempotencyRecord;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link IdempotencyRecord}.
 */
public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecord, String> {

    /**
     * Finds the record of a student's key and locks it for the rest of the transaction.
     *
     * <p>Callers hold the advisory lock for the same (scope, owner, key) first, which also covers
     * the case where the row does not exist yet.</p>
     *
     * @param scope   operation scope
     * @param ownerId student id
     * @param key     idempotency key
     * @return record
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select r from IdempotencyRecord r
            where r.scope = :scope and r.ownerId = :ownerId and r.idempotencyKey = :key
            """)
    Optional<IdempotencyRecord> findForUpdate(@Param("scope") String scope,
                                              @Param("ownerId") String ownerId,
                                              @Param("key") String key);
}
