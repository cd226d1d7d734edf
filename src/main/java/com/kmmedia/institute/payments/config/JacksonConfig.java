package com.kmmedia.institute.payments.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Jackson and time configuration.
 *
 * <p>The "canonical" ObjectMapper sorts properties so that the same initialization request
 * always hashes to the same value.</p>
 */
@Configuration
public class JacksonConfig {

    /**
     * Application-wide mapper used by MVC, webhooks and the outbox.
     *
     * @param builder boot-configured builder
     * @return mapper
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.createXmlMapper(false).build();
    }

    /**
     * Canonical ObjectMapper used for deterministic request hashing.
     *
     * @param builder boot-configured builder
     * @return canonical mapper
     */
    @Bean("canonicalObjectMapper")
    public ObjectMapper canonicalObjectMapper(Jackson2ObjectMapperBuilder builder) {
        ObjectMapper om = builder.createXmlMapper(false).build();
        om.registerModule(new JavaTimeModule());
        om.configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true);
        om.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        return om;
    }

    @Bean
    Jackson2ObjectMapperBuilderCustomizer javaTimeModule() {
        return builder -> builder.modules(new JavaTimeModule())
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * System clock; due dates and report windows are computed against it.
     *
     * @return UTC clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
