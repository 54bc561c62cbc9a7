package com.splitttr.coedit.message;

/**
 * Caller-supplied part of an operation. Id, originator, timestamp and version
 * are assigned when the operation is sent. A null resource means the resource
 * the session is currently joined to.
 */
public record OperationDraft(
    OperationType type,
    ResourceKey resource,
    CursorPosition position,
    OperationPayload payload
) {
    public OperationDraft {
        if (type == null) {
            throw new IllegalArgumentException("Operation type required");
        }
        if (position == null) {
            throw new IllegalArgumentException("Operation position required");
        }
    }

    public static OperationDraft of(OperationType type, CursorPosition position, OperationPayload payload) {
        return new OperationDraft(type, null, position, payload);
    }

    public static OperationDraft insert(CursorPosition position, String content) {
        return of(OperationType.INSERT, position, OperationPayload.text(content));
    }

    public static OperationDraft delete(CursorPosition position, int length) {
        return of(OperationType.DELETE, position, OperationPayload.span(length));
    }

    public OperationDraft on(ResourceKey target) {
        return new OperationDraft(type, target, position, payload);
    }
}
