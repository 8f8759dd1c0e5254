package com.github.dimitryivaniuta.guard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Adjusts Boot's ObjectMapper for the guard's own payloads and for proxied bodies.
 * Key ordering for request hashing lives in {@link com.github.dimitryivaniuta.guard.proxy.key.CacheKeyBuilder}.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer upstreamGuardJackson() {
        return builder -> builder
                // timeUntilReset in health payloads as "PT12S"
                .featuresToDisable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                // forwarded bodies keep full decimal precision
                .featuresToEnable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }
}
