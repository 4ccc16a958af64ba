package com.acme.perfgate.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared JSON codec for stats probes and report summaries.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    public static String writePretty(Object value) throws JsonProcessingException {
        return PRETTY.writeValueAsString(value);
    }
}
