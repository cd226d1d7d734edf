package com.kmmedia.institute.payments.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmmedia.institute.payments.domain.OutboxEvent;
import com.kmmedia.institute.payments.repo.OutboxEventRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends domain events to the outbox table.
 *
 * <p>Propagation is MANDATORY: an event is only ever written together with the state change it
 * describes.</p>
 */
@Component
public class OutboxWriter {

    /** Current payload schema version of every event. */
    public static final String SCHEMA_VERSION = "1";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public OutboxWriter(OutboxEventRepository outboxEventRepository, ObjectMapper objectMapper) {
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes and stores an event.
     *
     * @param aggregateType aggregate type
     * @param aggregateId   aggregate id
     * @param eventType     event type
     * @param eventKey      Kafka key; events of one key keep their order
     * @param event         payload
     * @return stored outbox row
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(String aggregateType, String aggregateId, String eventType, String eventKey, Object event) {
        return outboxEventRepository.save(OutboxEvent.newEvent(aggregateType, aggregateId, eventType, eventKey, toJson(event)));
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload", e);
        }
    }
}
