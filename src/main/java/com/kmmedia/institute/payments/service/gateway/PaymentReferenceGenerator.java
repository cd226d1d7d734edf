package com.kmmedia.institute.payments.service.gateway;

import com.kmmedia.institute.payments.config.AppProperties;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Generates gateway references of the form {@code <PREFIX>_<base36 epoch millis>_<6 random base36>},
 * upper-cased, e.g. {@code KM_MEDIA_LZ1K2J3H_8F3K2Q}.
 *
 * <p>Uniqueness is finally enforced by the unique index on {@code payment_records.reference}.</p>
 */
@Component
public class PaymentReferenceGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 6;

    private final SecureRandom random = new SecureRandom();
    private final AppProperties properties;
    private final Clock clock;

    public PaymentReferenceGenerator(AppProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public String next() {
        StringBuilder suffix = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        String reference = properties.getFees().getReferencePrefix()
                + "_" + Long.toString(clock.millis(), 36)
                + "_" + suffix;
        return reference.toUpperCase(Locale.ROOT);
    }
}
