package com.kmmedia.institute.payments.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>Bound once under the {@code app} prefix; services read their group from here instead of
 * injecting individual {@code @Value}s.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Idempotency idempotency = new Idempotency();
    private final Outbox outbox = new Outbox();
    private final Fees fees = new Fees();
    private final Reporting reporting = new Reporting();
    private final Map<String, Gateway> gateways = new LinkedHashMap<>();
    private final Catalog catalog = new Catalog();

    @Getter
    @Setter
    public static class Idempotency {
        /**
         * Scope for the payment initialization endpoint.
         */
        private String initiationScope = "payments:initialize";

        /**
         * Scope used for the per-reference advisory lock taken while applying a webhook.
         */
        private String webhookScope = "payments:webhook";

        /**
         * Max age after which an IN_PROGRESS record is considered stale and can be re-processed.
         */
        private Duration staleInProgressAfter = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic name for payment, plan and registration events.
         */
        private String paymentsEventsTopic = "enrollment-payments-events";

        private int batchSize = 100;

        /**
         * Fixed delay between publisher runs in milliseconds.
         */
        private long publishIntervalMs = 1000L;

        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Max number of send attempts before moving to DEAD.
         */
        private int maxAttempts = 10;

        private Duration baseBackoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Fees {
        /**
         * The single settlement currency.
         */
        private String currency = "GHS";

        /**
         * One-time application fee charged before enrollment.
         */
        private BigDecimal applicationFee = new BigDecimal("100.00");

        /**
         * Part of the application fee credited toward the course fee of an installment plan.
         */
        private BigDecimal applicationFeeCredit = BigDecimal.ZERO;

        /**
         * Payment method recorded when the client does not send one.
         */
        private String defaultPaymentMethod = "paystack";

        private String referencePrefix = "KM_MEDIA";

        private int maxInstallments = 12;
    }

    @Getter
    @Setter
    public static class Reporting {
        private int recentPaymentsLimit = 10;

        /**
         * Window used for the "recent registrations" counter.
         */
        private Duration recentRegistrationsWindow = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Gateway {
        /**
         * Shared secret used to sign webhook bodies (HMAC-SHA512).
         */
        private String webhookSecret;

        private String signatureHeader = "X-Paystack-Signature";

        /**
         * Disables signature verification; only meant for local sandboxes.
         */
        private boolean verifySignature = true;
    }

    @Getter
    @Setter
    public static class Catalog {
        /**
         * Course fee terms keyed by course id.
         */
        private final Map<String, Course> courses = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Course {
        private BigDecimal fee;

        private boolean installmentsOffered = true;
    }
}
