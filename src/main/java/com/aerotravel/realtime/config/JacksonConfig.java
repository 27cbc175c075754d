package com.aerotravel.realtime.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Central Jackson configuration for the realtime layer.
 *
 * <ul>
 *   <li>{@link JavaTimeModule}: {@code java.time} types in domain rows.</li>
 *   <li>Snake-case property naming, matching database column names.</li>
 *   <li>Unknown columns are ignored so new columns never break decoding.</li>
 *   <li>ISO-8601 dates on output.</li>
 * </ul>
 *
 * <p>{@code ObjectMapper} is thread-safe once configured; one instance per
 * runtime is shared by the transport codec and the domain adapters.</p>
 */
public final class JacksonConfig {

    private JacksonConfig() {
    }

    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

        return mapper;
    }
}
