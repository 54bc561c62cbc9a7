package com.splitttr.coedit.session;

import com.splitttr.coedit.identity.Collaborator;
import com.splitttr.coedit.message.ResourceKey;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of an active session.
 */
public record SessionState(
    String sessionId,
    ResourceKey resource,
    SessionStatus status,
    List<Collaborator> collaborators,
    Instant lastSyncAt
) {

    public enum SessionStatus { IDLE, JOINING, ACTIVE }

    public boolean isConnected() {
        return status == SessionStatus.ACTIVE;
    }
}
