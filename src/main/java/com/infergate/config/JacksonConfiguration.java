package com.infergate.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson settings for the OpenAI-compatible API.
 */
@Configuration
public class JacksonConfiguration {

    /**
     * Clients send extra OpenAI fields (dimensions, user metadata) that we ignore.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer apiObjectMapperCustomizer() {
        return builder -> builder
                .featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
