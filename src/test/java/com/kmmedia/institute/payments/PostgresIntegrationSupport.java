package com.kmmedia.institute.payments;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmmedia.institute.payments.service.gateway.WebhookSignatureVerifier;
import com.kmmedia.institute.payments.web.PaymentsController;
import com.kmmedia.institute.payments.web.caller.CallerContextFilter;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared Postgres (Testcontainers) context for integration tests.
 *
 * <p>The container is started once and reused by every subclass, so the cached Spring context
 * always points at a live database. Each test works with its own random student ids.</p>
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureMockMvc
public abstract class PostgresIntegrationSupport {

    protected static final String WEBHOOK_SECRET = "it-webhook-secret";

    /** Test-only course with round numbers: fee 1000.00, installments offered. */
    protected static final String IT_COURSE = "it-course";

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("enrollment_payments")
            .withUsername("payments")
            .withPassword("payments");

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        POSTGRES.start();
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);

        // no Redis or Kafka in ITs
        r.add("spring.cache.type", () -> "none");
        r.add("spring.kafka.bootstrap-servers", () -> "localhost:0");
        r.add("app.outbox.publish-interval-ms", () -> "9999999");

        r.add("app.gateways.paystack.webhook-secret", () -> WEBHOOK_SECRET);
        r.add("app.catalog.courses." + IT_COURSE + ".fee", () -> "1000.00");
        r.add("app.catalog.courses." + IT_COURSE + ".installments-offered", () -> "true");
    }

    @MockBean
    protected KafkaTemplate<String, String> kafkaTemplate;

    @Autowired
    protected MockMvc mvc;

    @Autowired
    protected ObjectMapper objectMapper;

    protected static String newStudent() {
        return "student-" + UUID.randomUUID();
    }

    protected static MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder builder, String userId, String role) {
        return builder.header(CallerContextFilter.USER_ID_HEADER, userId)
                .header(CallerContextFilter.USER_ROLE_HEADER, role);
    }

    protected ResultActions initialize(String userId, String courseId, String paymentType) throws Exception {
        String body = "{\"courseId\":\"" + courseId + "\",\"paymentType\":\"" + paymentType + "\"}";
        return mvc.perform(as(MockMvcRequestBuilders.post("/payments/initialize"), userId, "student")
                .header(PaymentsController.IDEMPOTENCY_KEY_HEADER, "key-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    protected ResultActions createPlan(String userId, String courseId, int installments, String cadence) throws Exception {
        String body = "{\"courseId\":\"" + courseId + "\",\"totalInstallments\":" + installments
                + ",\"paymentPlan\":\"" + cadence + "\"}";
        return mvc.perform(as(MockMvcRequestBuilders.post("/payments/installment-plan"), userId, "student")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    protected ResultActions webhook(String reference, String status, String amount) throws Exception {
        String body = "{\"reference\":\"" + reference + "\",\"status\":\"" + status + "\",\"amount\":" + amount
                + ",\"currency\":\"GHS\",\"metadata\":{\"channel\":\"card\"}}";
        byte[] raw = body.getBytes(StandardCharsets.UTF_8);
        return mvc.perform(MockMvcRequestBuilders.post("/payments/webhook/paystack")
                .header("X-Paystack-Signature", WebhookSignatureVerifier.sign(WEBHOOK_SECRET, raw))
                .contentType(MediaType.APPLICATION_JSON)
                .content(raw));
    }

    protected JsonNode json(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }
}
