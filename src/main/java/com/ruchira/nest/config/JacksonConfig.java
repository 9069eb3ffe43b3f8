package com.ruchira.nest.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Adjusts Spring Boot's ObjectMapper for nested groupings, whose keys are arbitrary JSON values,
 * and rejects documents with content after the first JSON value
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer nestedKeysCustomizer() {
        return builder -> builder
                .featuresToEnable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .postConfigurer(JacksonConfig::configure);
    }

    public static ObjectMapper configure(ObjectMapper objectMapper) {
        objectMapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        objectMapper.getSerializerProvider().setNullKeySerializer(new NullKeySerializer());
        return objectMapper;
    }
}
