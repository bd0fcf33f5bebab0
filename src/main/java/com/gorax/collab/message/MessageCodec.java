package com.gorax.collab.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON mapping for the collaboration envelope. Timestamps are written as RFC 3339 strings.
 */
public final class MessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private MessageCodec() {}

    public static ClientMessage decode(String json) {
        ClientMessage message;
        try {
            message = mapper.readValue(json, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("invalid message format", e);
        }
        if (message == null || message.type() == null) {
            throw new MalformedMessageException("invalid message format", null);
        }
        return message;
    }

    public static <T> T payload(ClientMessage message, Class<T> type) {
        JsonNode payload = message.payload();
        if (payload == null || payload.isNull()) {
            throw new MalformedMessageException("missing payload for " + message.type(), null);
        }
        try {
            return mapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("invalid payload for " + message.type(), e);
        }
    }

    public static String encode(ServerMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + message.type(), e);
        }
    }

    public static class MalformedMessageException extends RuntimeException {
        public MalformedMessageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
