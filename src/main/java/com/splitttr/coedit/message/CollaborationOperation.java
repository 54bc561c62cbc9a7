package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Versioned description of a content mutation. {@code version} increases per
 * resource and per originator; it is not a global order.
 */
public record CollaborationOperation(
    String id,
    OperationType type,
    String originatorId,
    String resourceType,
    String resourceId,
    CursorPosition position,
    OperationPayload payload,
    Instant timestamp,
    long version
) {

    @JsonIgnore
    public ResourceKey resource() {
        return ResourceKey.of(resourceType, resourceId);
    }
}
