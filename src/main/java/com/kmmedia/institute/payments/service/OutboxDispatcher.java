package com.kmmedia.institute.payments.service;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.domain.OutboxEvent;
import com.kmmedia.institute.payments.domain.OutboxStatus;
import com.kmmedia.institute.payments.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Publishes outbox events to Kafka.
 *
 * <p>Batches are claimed with {@code FOR UPDATE SKIP LOCKED}, so several instances can run
 * concurrently without double-sending. An event is marked SENT only after the broker acks
 * (bounded by {@code sendTimeout}); failures back off exponentially with jitter and the event
 * goes DEAD after {@code maxAttempts}.</p>
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;

        this.sentCounter = Counter.builder("payments.outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("payments.outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("payments.outbox.dead").register(meterRegistry);
    }

    /**
     * Publishes the next batch of due events.
     *
     * @return number of events handled in this run
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public int publishBatch() {
        AppProperties.Outbox outbox = properties.getOutbox();

        List<OutboxEvent> batch = outboxEventRepository.lockNextBatchForPublish(
                List.of(OutboxStatus.NEW.name(), OutboxStatus.RETRY.name()),
                Instant.now(),
                outbox.getBatchSize()
        );
        if (batch.isEmpty()) {
            return 0;
        }

        int sent = 0;
        int retry = 0;
        int dead = 0;

        for (OutboxEvent e : batch) {
            try {
                kafkaTemplate.send(outbox.getPaymentsEventsTopic(), e.getEventKey(), e.getPayload())
                        .get(outbox.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
                e.markSent();
                sent++;
                sentCounter.increment();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                e.markRetry(safeError(ex), outbox.getBaseBackoff());
                retry++;
                retryCounter.increment();
                log.warn("Outbox publishing interrupted. eventId={}", e.getId());
            } catch (Exception ex) {
                String err = safeError(ex);
                if (e.getAttemptCount() + 1 >= outbox.getMaxAttempts()) {
                    e.markDead(err);
                    dead++;
                    deadCounter.increment();
                    log.error("Outbox event {} ({}) moved to DEAD after {} attempts. error={}",
                            e.getId(), e.getEventType(), e.getAttemptCount(), err);
                } else {
                    Duration backoff = computeBackoff(outbox.getBaseBackoff(), outbox.getMaxBackoff(), e.getAttemptCount() + 1);
                    e.markRetry(err, backoff);
                    retry++;
                    retryCounter.increment();
                    log.warn("Outbox event {} ({}) failed. attempt={} nextAttemptAt={} error={}",
                            e.getId(), e.getEventType(), e.getAttemptCount(), e.getNextAttemptAt(), err);
                }
            }
            outboxEventRepository.save(e);
        }

        log.info("Outbox publish batch done. sent={} retry={} dead={} topic={}", sent, retry, dead, outbox.getPaymentsEventsTopic());
        return batch.size();
    }

    static Duration computeBackoff(Duration base, Duration max, int attempt) {
        // base * 2^(attempt-1), capped, jitter in [0.5, 1.5)
        double exp = Math.pow(2.0, Math.max(0, attempt - 1));
        long candidateMs = (long) (base.toMillis() * exp);
        long capped = Math.min(candidateMs, max.toMillis());
        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        long withJitter = (long) (capped * jitter);
        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(withJitter, max.toMillis())));
    }

    private static String safeError(Exception ex) {
        String msg = ex.getMessage();
        if (msg == null) {
            msg = ex.getClass().getSimpleName();
        }
        return msg.length() > MAX_ERROR_LENGTH ? msg.substring(0, MAX_ERROR_LENGTH) : msg;
    }
}
