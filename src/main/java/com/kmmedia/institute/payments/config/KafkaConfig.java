package com.kmmedia.institute.payments.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration.
 */
@Configuration
public class KafkaConfig {

    /**
     * Topic carrying payment, installment plan and registration events from the outbox.
     *
     * <p>Keyed by payment reference or user/course pair, so six partitions keep per-student ordering.</p>
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    public NewTopic paymentsEventsTopic(AppProperties props) {
        return TopicBuilder.name(props.getOutbox().getPaymentsEventsTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
