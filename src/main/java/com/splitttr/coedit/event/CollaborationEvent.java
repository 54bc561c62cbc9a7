package com.splitttr.coedit.event;

import com.splitttr.coedit.identity.Collaborator;
import com.splitttr.coedit.message.CollaborationOperation;
import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.ResourceKey;
import com.splitttr.coedit.message.SelectionRange;

/**
 * Everything a session reports to its callers. Subscribe to one kind with
 * {@code session.on(OperationReceived.class, ...)} or to all of them with
 * {@code CollaborationEvent.class}.
 */
public sealed interface CollaborationEvent {

    record Connected(ResourceKey resource) implements CollaborationEvent {}

    record Disconnected(ResourceKey resource) implements CollaborationEvent {}

    record CollaboratorJoined(Collaborator collaborator) implements CollaborationEvent {}

    record CollaboratorLeft(Collaborator collaborator) implements CollaborationEvent {}

    record CursorUpdated(String userId, CursorPosition cursor) implements CollaborationEvent {}

    // selection is null when the peer cleared it
    record SelectionUpdated(String userId, SelectionRange selection) implements CollaborationEvent {}

    /** A peer's operation that the caller should apply to its content model. */
    record OperationReceived(CollaborationOperation operation) implements CollaborationEvent {}

    /** The operation was dropped because {@code highestVersion} was already applied. */
    record ConflictDetected(CollaborationOperation operation, long highestVersion) implements CollaborationEvent {}

    record SyncCompleted(ResourceKey resource, long version) implements CollaborationEvent {}

    record ErrorOccurred(String message, Throwable cause) implements CollaborationEvent {}
}
