package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;

/**
 * Jackson mapping between payload records, the envelope's {@code data} node
 * and JSON text. Instants travel as epoch milliseconds.
 */
public class MessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .enable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS)
        .disable(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public CollaborationMessage encode(MessageType type, String senderId, ResourceKey resource,
                                       Object payload, Instant timestamp) {
        JsonNode data;
        try {
            data = mapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new MessageCodecException("Cannot encode " + type + " payload", e);
        }
        return new CollaborationMessage(type, senderId, resource.type(), resource.id(), data, timestamp);
    }

    public <T> T payload(CollaborationMessage message, Class<T> payloadType) {
        if (message.data() == null || message.data().isNull()) {
            throw new MessageCodecException("Missing data in " + message.type() + " message", null);
        }
        try {
            return mapper.treeToValue(message.data(), payloadType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MessageCodecException("Cannot decode " + message.type() + " payload", e);
        }
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public CollaborationMessage fromJson(String json) {
        CollaborationMessage message;
        try {
            message = mapper.readValue(json, CollaborationMessage.class);
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("Malformed collaboration message", e);
        }
        if (message.type() == null || message.resourceType() == null || message.resourceId() == null) {
            throw new MessageCodecException("Message type and resource required", null);
        }
        return message;
    }
}
