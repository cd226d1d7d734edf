package com.kmmedia.institute.payments;

import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.kmmedia.institute.payments.domain.InstallmentPlan;
import com.kmmedia.institute.payments.domain.PaymentStatus;
import com.kmmedia.institute.payments.repo.InstallmentPlanRepository;
import com.kmmedia.institute.payments.repo.PaymentRecordRepository;
import com.kmmedia.institute.payments.service.gateway.WebhookSignatureVerifier;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Webhooks racing on the same payment or the same installment plan, and a rejected side effect
 * rolling back the status change, against Postgres.
 */
class WebhookConcurrencyIT extends PostgresIntegrationSupport {

    @LocalServerPort
    int port;

    @Autowired
    TestRestTemplate rest;

    @Autowired
    PaymentRecordRepository paymentRecordRepository;

    @Autowired
    InstallmentPlanRepository planRepository;

    @Test
    void sameSuccessWebhookFromTwoThreadsPaysOneInstallment() throws Exception {
        String student = newStudent();
        createPlan(student, IT_COURSE, 4, "monthly").andExpect(status().isCreated());
        String reference = installmentReference(student);

        int[] statuses = deliverConcurrently(List.of(reference, reference), "250.00");

        Assertions.assertEquals(200, statuses[0]);
        Assertions.assertEquals(200, statuses[1]);
        InstallmentPlan plan = latestPlan(student);
        Assertions.assertEquals(1, plan.getPaidInstallments());
        Assertions.assertEquals(0, new BigDecimal("750.00").compareTo(plan.getRemainingBalance()));
        Assertions.assertEquals(PaymentStatus.SUCCESS,
                paymentRecordRepository.findByReference(reference).orElseThrow().getStatus());
    }

    @Test
    void twoInstallmentsOfOnePlanPaidAtOnceAreBothCounted() throws Exception {
        String student = newStudent();
        createPlan(student, IT_COURSE, 4, "monthly").andExpect(status().isCreated());
        String first = installmentReference(student);
        String second = installmentReference(student);

        int[] statuses = deliverConcurrently(List.of(first, second), "250.00");

        Assertions.assertEquals(200, statuses[0]);
        Assertions.assertEquals(200, statuses[1]);
        InstallmentPlan plan = latestPlan(student);
        Assertions.assertEquals(2, plan.getPaidInstallments());
        Assertions.assertEquals(0, new BigDecimal("500.00").compareTo(plan.getRemainingBalance()));
    }

    @Test
    void overpayingInstallmentLeavesRecordPendingAndBalanceUntouched() throws Exception {
        String student = newStudent();
        createPlan(student, IT_COURSE, 3, "monthly").andExpect(status().isCreated());
        // all three charged up front at the rounded-up amount; the last one no longer fits
        String first = installmentReference(student);
        String second = installmentReference(student);
        String third = installmentReference(student);

        webhook(first, "success", "333.34").andExpect(status().isOk());
        webhook(second, "success", "333.34").andExpect(status().isOk());
        webhook(third, "success", "333.34")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("OVERPAYMENT_REJECTED"));

        Assertions.assertEquals(PaymentStatus.PENDING,
                paymentRecordRepository.findByReference(third).orElseThrow().getStatus());
        InstallmentPlan plan = latestPlan(student);
        Assertions.assertEquals(2, plan.getPaidInstallments());
        Assertions.assertEquals(0, new BigDecimal("333.32").compareTo(plan.getRemainingBalance()));
    }

    private String installmentReference(String student) throws Exception {
        return json(initialize(student, IT_COURSE, "installment").andExpect(status().isCreated()))
                .get("reference").asText();
    }

    private InstallmentPlan latestPlan(String student) {
        return planRepository.findFirstByUserIdAndCourseIdOrderByCreatedAtDesc(student, IT_COURSE).orElseThrow();
    }

    private int[] deliverConcurrently(List<String> references, String amount) throws Exception {
        ExecutorService exec = Executors.newFixedThreadPool(references.size());
        CountDownLatch ready = new CountDownLatch(references.size());
        CountDownLatch go = new CountDownLatch(1);
        int[] statuses = new int[references.size()];

        for (int i = 0; i < references.size(); i++) {
            final int idx = i;
            final String reference = references.get(i);
            exec.submit(() -> {
                ready.countDown();
                try {
                    go.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                statuses[idx] = postWebhook(reference, amount).getStatusCode().value();
            });
        }

        Assertions.assertTrue(ready.await(5, TimeUnit.SECONDS));
        go.countDown();

        exec.shutdown();
        Assertions.assertTrue(exec.awaitTermination(15, TimeUnit.SECONDS));
        return statuses;
    }

    private ResponseEntity<String> postWebhook(String reference, String amount) {
        byte[] raw = ("{\"reference\":\"" + reference + "\",\"status\":\"success\",\"amount\":" + amount
                + ",\"currency\":\"GHS\"}").getBytes(StandardCharsets.UTF_8);
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        h.set("X-Paystack-Signature", WebhookSignatureVerifier.sign(WEBHOOK_SECRET, raw));
        return rest.exchange("http://localhost:" + port + "/payments/webhook/paystack",
                HttpMethod.POST, new HttpEntity<>(raw, h), String.class);
    }
}
