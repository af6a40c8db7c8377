package com.flagship.payment_service.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pins the JSON settings the bus payloads and stored outcomes depend on.
 *
 * Applied to Boot's auto-configured ObjectMapper after the {@code spring.jackson.*}
 * properties, so instants stay ISO-8601 strings and payloads with extra fields
 * from other services still parse whatever those properties say.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer paymentWireFormat() {
        return builder -> builder.featuresToDisable(
                SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
