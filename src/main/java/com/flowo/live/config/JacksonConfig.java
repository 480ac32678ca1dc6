package com.flowo.live.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Central Jackson configuration.
 *
 * <ul>
 *   <li>{@link JavaTimeModule}: {@code Instant} fields of stats and session snapshots.</li>
 *   <li>ISO-8601 text instead of numeric timestamps.</li>
 *   <li>Floats read as {@code BigDecimal} so payload timestamps keep their plain decimal form.</li>
 * </ul>
 *
 * The same mapper parses and re-serializes notification payloads in the SSE adapter.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        return mapper;
    }
}
