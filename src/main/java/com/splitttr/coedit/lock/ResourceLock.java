package com.splitttr.coedit.lock;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.splitttr.coedit.message.ResourceKey;

import java.time.Instant;

/**
 * Advisory claim of exclusive editing rights. A null {@code expiresAt} means
 * the lock lives until it is released.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceLock(
    String resourceType,
    String resourceId,
    String holderId,
    Instant acquiredAt,
    String reason,
    Instant expiresAt
) {

    public ResourceLock {
        if (resourceType == null || resourceType.isBlank() || resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Lock resource required");
        }
        if (holderId == null || holderId.isBlank()) {
            throw new IllegalArgumentException("Lock holder required");
        }
    }

    @JsonIgnore
    public ResourceKey resource() {
        return ResourceKey.of(resourceType, resourceId);
    }

    public boolean isHeldBy(String userId) {
        return holderId.equals(userId);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
