package com.kmmedia.institute.payments.repo;

import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.service.dto.PaymentFilter;
import jakarta.persistence.criteria.Predicate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.jpa.domain.Specification;

/**
 * Criteria for the admin payment list.
 */
public final class PaymentRecordSpecification {

    private PaymentRecordSpecification() {
    }

    /**
     * Builds a conjunction of the filters that are set; an empty filter matches everything.
     *
     * @param filter admin filter
     * @return specification
     */
    public static Specification<PaymentRecord> matching(PaymentFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.status() != null) {
                predicates.add(cb.equal(root.get("status"), filter.status()));
            }
            if (filter.paymentType() != null) {
                predicates.add(cb.equal(root.get("paymentType"), filter.paymentType()));
            }
            if (filter.userId() != null && !filter.userId().isBlank()) {
                predicates.add(cb.equal(root.get("userId"), filter.userId().trim()));
            }
            if (filter.courseId() != null && !filter.courseId().isBlank()) {
                predicates.add(cb.equal(root.get("courseId"), filter.courseId().trim()));
            }
            if (filter.from() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"),
                        filter.from().atStartOfDay().toInstant(ZoneOffset.UTC)));
            }
            if (filter.to() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("createdAt"),
                        filter.to().atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC)));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
