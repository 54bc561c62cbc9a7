package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Wire envelope shared by every message type. {@code data} holds the
 * type-specific payload, see {@link MessagePayloads}.
 */
public record CollaborationMessage(
    MessageType type,
    String senderId,
    String resourceType,
    String resourceId,
    JsonNode data,
    Instant timestamp
) {

    @JsonIgnore
    public ResourceKey resource() {
        return ResourceKey.of(resourceType, resourceId);
    }

    public boolean isFor(ResourceKey resource) {
        return resource != null && resource.matches(resourceType, resourceId);
    }

    public CollaborationMessage withSenderId(String newSenderId) {
        return new CollaborationMessage(type, newSenderId, resourceType, resourceId, data, timestamp);
    }
}
