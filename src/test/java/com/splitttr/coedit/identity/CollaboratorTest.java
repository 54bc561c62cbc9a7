package com.splitttr.coedit.identity;

import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.ResourceKey;
import com.splitttr.coedit.message.SelectionRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CollaboratorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void ofCopiesIdentityAndAssignsColor() {
        Collaborator alice = Collaborator.of(new Identity("alice", "Alice", "avatars/alice.png"), T0);

        assertEquals("alice", alice.userId());
        assertEquals("Alice", alice.displayName());
        assertEquals("avatars/alice.png", alice.avatarRef());
        assertEquals(ColorPalette.assignColor("alice"), alice.color());
        assertTrue(alice.online());
        assertEquals(T0, alice.lastActiveAt());
        assertNull(alice.currentResource());
    }

    @Test
    void identityRequiresIdAndName() {
        assertThrows(IllegalArgumentException.class, () -> Identity.of(" ", "Alice"));
        assertThrows(IllegalArgumentException.class, () -> Identity.of("alice", null));
    }

    @Test
    void touchedAtMovesForwardEvenWhenClockStands() {
        Collaborator alice = Collaborator.of(Identity.of("alice", "Alice"), T0);

        Collaborator touched = alice.touchedAt(T0);
        Collaborator touchedAgain = touched.touchedAt(T0);

        assertTrue(touched.lastActiveAt().isAfter(alice.lastActiveAt()));
        assertTrue(touchedAgain.lastActiveAt().isAfter(touched.lastActiveAt()));
        assertEquals(T0.plusSeconds(5), touchedAgain.touchedAt(T0.plusSeconds(5)).lastActiveAt());
    }

    @Test
    void clearedDropsResourceCursorAndSelection() {
        CursorPosition at = CursorPosition.at("d1", 0, 4);
        Collaborator alice = Collaborator.of(Identity.of("alice", "Alice"), T0)
            .withResource(ResourceKey.of("novel", "42"))
            .withCursor(at)
            .withSelection(new SelectionRange(at, CursorPosition.at("d1", 1, 0)));

        Collaborator cleared = alice.cleared();

        assertNull(cleared.currentResource());
        assertNull(cleared.cursor());
        assertNull(cleared.selection());
        assertEquals(alice.color(), cleared.color());
    }
}
