package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.domain.Registration;
import com.kmmedia.institute.payments.domain.RegistrationStatus;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.repo.RegistrationRepository;
import com.kmmedia.institute.payments.service.dto.BulkItemResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Bulk admin status changes.
 *
 * <p>Not transactional itself: each id goes through
 * {@link RegistrationStatusCoordinator#adminSetStatus} in a separate transaction, so one rejected
 * id never rolls back the others. Business rejections, lock failures and store errors are
 * reported per id with a stable error code.</p>
 */
@Slf4j
@Service
public class RegistrationAdminService {

    private final RegistrationStatusCoordinator coordinator;
    private final RegistrationRepository registrationRepository;

    public RegistrationAdminService(RegistrationStatusCoordinator coordinator, RegistrationRepository registrationRepository) {
        this.coordinator = coordinator;
        this.registrationRepository = registrationRepository;
    }

    /**
     * Applies the same status change to every id; duplicates are processed once.
     *
     * @param registrationIds ids in request order
     * @param target          requested status
     * @param note            optional note
     * @return one result per distinct id, in request order
     */
    public List<BulkItemResult> setStatusBulk(List<String> registrationIds, RegistrationStatus target, String note) {
        List<BulkItemResult> results = new ArrayList<>();
        for (String id : new LinkedHashSet<>(registrationIds)) {
            try {
                Registration updated = coordinator.adminSetStatus(id, target, note);
                results.add(BulkItemResult.ok(id, updated.getStatus()));
            } catch (PaymentException e) {
                results.add(failed(id, target, e.getCode().name(), e.getMessage()));
            } catch (ConcurrencyFailureException e) {
                results.add(failed(id, target, "CONCURRENT_MODIFICATION", "Concurrent update, retry this registration"));
            } catch (DataIntegrityViolationException e) {
                results.add(failed(id, target, "CONFLICT", e.getMostSpecificCause().getMessage()));
            } catch (DataAccessException e) {
                log.warn("Bulk status change hit the store. registrationId={} target={}", id, target, e);
                results.add(BulkItemResult.failed(id, null, "STORE_UNAVAILABLE", "Registration store is temporarily unavailable"));
            } catch (IllegalArgumentException e) {
                results.add(failed(id, target, "VALIDATION_ERROR", e.getMessage()));
            }
        }
        long failed = results.stream().filter(r -> !r.success()).count();
        log.info("Bulk registration status change done. target={} total={} failed={}", target, results.size(), failed);
        return results;
    }

    private BulkItemResult failed(String id, RegistrationStatus target, String code, String message) {
        log.warn("Bulk status change rejected. registrationId={} target={} code={} message={}", id, target, code, message);
        return BulkItemResult.failed(id, currentStatus(id), code, message);
    }

    private RegistrationStatus currentStatus(String id) {
        try {
            return registrationRepository.findById(id).map(Registration::getStatus).orElse(null);
        } catch (DataAccessException e) {
            log.warn("Current status unavailable for bulk result. registrationId={} message={}", id, e.getMessage());
            return null;
        }
    }
}
