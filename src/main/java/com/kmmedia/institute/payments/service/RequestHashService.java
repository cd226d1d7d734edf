package com.kmmedia.institute.payments.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Computes a stable request hash for idempotency: Base64(SHA-256(canonical JSON)).
 *
 * <p>The canonical mapper sorts properties, so field order in the client's JSON does not matter.</p>
 */
@Service
public class RequestHashService {

    private final ObjectMapper canonicalObjectMapper;

    public RequestHashService(@Qualifier("canonicalObjectMapper") ObjectMapper canonicalObjectMapper) {
        this.canonicalObjectMapper = canonicalObjectMapper;
    }

    /**
     * @param payload request payload
     * @return request hash
     */
    public String hash(Object payload) {
        try {
            byte[] json = canonicalObjectMapper.writeValueAsBytes(payload);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(digest.digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize request for hashing", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute request hash", e);
        }
    }
}
