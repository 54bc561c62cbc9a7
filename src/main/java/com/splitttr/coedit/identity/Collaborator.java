package com.splitttr.coedit.identity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.ResourceKey;
import com.splitttr.coedit.message.SelectionRange;

import java.time.Instant;

/**
 * Snapshot of a participant as seen by one session. Rebuilt from join and
 * presence messages, never owned by anyone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Collaborator(
    String userId,
    String displayName,
    String avatarRef,
    String color,
    boolean online,
    Instant lastActiveAt,
    ResourceKey currentResource,
    CursorPosition cursor,
    SelectionRange selection
) {

    public static Collaborator of(Identity identity, Instant now) {
        return new Collaborator(
            identity.userId(),
            identity.displayName(),
            identity.avatarRef(),
            ColorPalette.assignColor(identity.userId()),
            true,
            now,
            null,
            null,
            null
        );
    }

    public Collaborator withResource(ResourceKey resource) {
        return new Collaborator(userId, displayName, avatarRef, color, online, lastActiveAt, resource, cursor, selection);
    }

    public Collaborator withCursor(CursorPosition newCursor) {
        return new Collaborator(userId, displayName, avatarRef, color, online, lastActiveAt, currentResource, newCursor, selection);
    }

    public Collaborator withSelection(SelectionRange newSelection) {
        return new Collaborator(userId, displayName, avatarRef, color, online, lastActiveAt, currentResource, cursor, newSelection);
    }

    /**
     * Marks the participant online at {@code now}. The result's
     * {@code lastActiveAt} is always strictly later than this one's, even when
     * the clock has not moved.
     */
    public Collaborator touchedAt(Instant now) {
        Instant next = lastActiveAt == null || now.isAfter(lastActiveAt) ? now : lastActiveAt.plusMillis(1);
        return new Collaborator(userId, displayName, avatarRef, color, true, next, currentResource, cursor, selection);
    }

    public Collaborator cleared() {
        return new Collaborator(userId, displayName, avatarRef, color, online, lastActiveAt, null, null, null);
    }
}
