package com.kmmedia.institute.payments.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Postgres advisory lock service.
 *
 * <p>Row locks only work once a row exists. {@code pg_advisory_xact_lock} serializes work on a
 * (scope, key) pair inside the current transaction even before the row is inserted: the first
 * initialization for an idempotency key, the first registration of a (student, course) pair,
 * and every webhook delivery for one payment reference.</p>
 *
 * <p>Locks are released when the transaction ends.</p>
 */
@Component
public class PostgresAdvisoryLockService {

    private final JdbcTemplate jdbcTemplate;

    public PostgresAdvisoryLockService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Acquires a transaction-scoped advisory lock, blocking until it is free.
     *
     * @param scope operation scope
     * @param key   key within the scope
     */
    public void lock(String scope, String key) {
        long lockId = toLongHash(scope + "|" + key);
        jdbcTemplate.queryForObject("select pg_advisory_xact_lock(?)", Object.class, lockId);
    }

    static long toLongHash(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(s.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
