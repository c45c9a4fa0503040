package com.fibrepay.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vertx.core.json.jackson.DatabindCodec;

/**
 * Configures the ObjectMapper behind Vert.x JsonObject.mapFrom/mapTo and Json.encode.
 * Dates travel as ISO-8601 strings.
 */
public final class JacksonConfig {

    private static volatile boolean configured;

    private JacksonConfig() {
    }

    public static synchronized void configure() {
        if (configured) {
            return;
        }
        ObjectMapper mapper = DatabindCodec.mapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        configured = true;
    }
}
