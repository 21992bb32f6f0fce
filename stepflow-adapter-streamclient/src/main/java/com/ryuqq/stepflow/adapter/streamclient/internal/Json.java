package com.ryuqq.stepflow.adapter.streamclient.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Centralised ObjectMapper configuration for reading stream messages.
 *
 * <p>The client only parses frames into trees. A frame must hold exactly one JSON value;
 * anything after it is a parse failure rather than silently dropped.</p>
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
