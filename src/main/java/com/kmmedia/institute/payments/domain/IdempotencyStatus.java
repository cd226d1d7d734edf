package com.kmmedia.institute.payments.domain;

/**
 * Initialization idempotency record status.
 */
public enum IdempotencyStatus {
    /** The initialization is being processed. */
    IN_PROGRESS,

    /** Response stored for replay. */
    COMPLETED
}
