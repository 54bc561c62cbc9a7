package com.splitttr.coedit.message;

import com.splitttr.coedit.identity.Collaborator;
import com.splitttr.coedit.lock.ResourceLock;

import java.util.List;

/**
 * Payload shapes carried in {@link CollaborationMessage#data()}, one per
 * message type.
 */
public final class MessagePayloads {

    private MessagePayloads() {}

    // join, presence
    public record UserPayload(Collaborator user) {}

    public record LeavePayload(String userId) {}

    public record CursorPayload(CursorPosition cursor) {}

    // selection is null when the user cleared it
    public record SelectionPayload(SelectionRange selection) {}

    public record OperationsPayload(List<CollaborationOperation> operations) {
        public OperationsPayload {
            operations = operations == null ? List.of() : List.copyOf(operations);
        }
    }

    public record SyncRequestPayload(long version) {}

    public record SyncResponsePayload(List<CollaborationOperation> operations, long version) {
        public SyncResponsePayload {
            operations = operations == null ? List.of() : List.copyOf(operations);
        }
    }

    public record LockPayload(ResourceLock lock) {}

    public record UnlockPayload(String resourceType, String resourceId) {}
}
