package com.kmmedia.institute.payments.service.gateway;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks gateway webhook signatures: lowercase hex HMAC-SHA512 of the raw request body, keyed
 * with the gateway's webhook secret.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_SHA512 = "HmacSHA512";

    private final AppProperties properties;

    public WebhookSignatureVerifier(AppProperties properties) {
        this.properties = properties;
    }

    /**
     * @param gateway gateway name from the callback URL
     * @return the gateway's configuration
     * @throws PaymentException UNKNOWN_GATEWAY when not configured
     */
    public AppProperties.Gateway gateway(String gateway) {
        AppProperties.Gateway config = gateway == null ? null
                : properties.getGateways().get(gateway.toLowerCase(Locale.ROOT));
        if (config == null) {
            throw PaymentException.of(PaymentErrorCode.UNKNOWN_GATEWAY, "Payment gateway '" + gateway + "' is not configured");
        }
        return config;
    }

    /**
     * Verifies the signature of a raw webhook body.
     *
     * @param gateway   gateway name
     * @param rawBody   body exactly as received
     * @param signature value of the gateway's signature header, may be null
     * @throws PaymentException UNKNOWN_GATEWAY or INVALID_SIGNATURE
     */
    public void verify(String gateway, byte[] rawBody, String signature) {
        AppProperties.Gateway config = gateway(gateway);
        if (!config.isVerifySignature()) {
            return;
        }
        if (config.getWebhookSecret() == null || config.getWebhookSecret().isBlank()) {
            log.error("Webhook secret missing for gateway {}; rejecting callback", gateway);
            throw PaymentException.of(PaymentErrorCode.INVALID_SIGNATURE, "Webhook secret is not configured for " + gateway);
        }
        if (signature == null || signature.isBlank()) {
            throw PaymentException.of(PaymentErrorCode.INVALID_SIGNATURE, "Missing " + config.getSignatureHeader() + " header");
        }
        String expected = sign(config.getWebhookSecret(), rawBody);
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
        if (!matches) {
            throw new PaymentException(PaymentErrorCode.INVALID_SIGNATURE);
        }
    }

    /**
     * Computes the signature a gateway would send for this body.
     *
     * @param secret  webhook secret
     * @param rawBody body bytes
     * @return lowercase hex HMAC-SHA512
     */
    public static String sign(String secret, byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA512);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA512));
            return HexFormat.of().formatHex(mac.doFinal(rawBody));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Unable to compute webhook signature", e);
        }
    }
}
