package com.kmmedia.institute.payments.repo;

import com.kmmedia.institute.payments.domain.Registration;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link Registration}.
 */
public interface RegistrationRepository extends JpaRepository<Registration, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Registration r where r.id = :id")
    Optional<Registration> findByIdForUpdate(@Param("id") String id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Registration r where r.userId = :userId and r.courseId = :courseId")
    Optional<Registration> findByUserIdAndCourseIdForUpdate(@Param("userId") String userId,
                                                            @Param("courseId") String courseId);

    Optional<Registration> findByUserIdAndCourseId(String userId, String courseId);

    long countByCreatedAtGreaterThanEqual(Instant since);

    @Query("select r.status as groupKey, count(r) as rowCount from Registration r group by r.status")
    List<GroupCount> countByStatus();
}
