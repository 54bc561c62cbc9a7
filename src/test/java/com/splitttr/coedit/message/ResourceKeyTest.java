package com.splitttr.coedit.message;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceKeyTest {

    @Test
    void requiresTypeAndId() {
        assertThrows(IllegalArgumentException.class, () -> ResourceKey.of("", "42"));
        assertThrows(IllegalArgumentException.class, () -> ResourceKey.of("novel", null));
    }

    @Test
    void matchesAndPrints() {
        ResourceKey key = ResourceKey.of("chapter", "c-7");

        assertTrue(key.matches("chapter", "c-7"));
        assertFalse(key.matches("novel", "c-7"));
        assertEquals("chapter:c-7", key.toString());
        assertEquals(key, ResourceKey.of("chapter", "c-7"));
    }

    @Test
    void cursorsOrderByParagraphThenOffset() {
        CursorPosition a = CursorPosition.at("d", 1, 9);
        CursorPosition b = CursorPosition.at("d", 2, 0);

        assertTrue(a.compareTo(b) < 0);
        assertTrue(new SelectionRange(a, b).isNormalized());
        assertFalse(new SelectionRange(b, a).isNormalized());
        assertTrue(new SelectionRange(a, CursorPosition.at("d", 1, 9)).isCollapsed());
    }

    @Test
    void draftRequiresTypeAndPosition() {
        assertThrows(IllegalArgumentException.class,
            () -> OperationDraft.of(null, CursorPosition.at("d", 0, 0), null));
        assertThrows(IllegalArgumentException.class, () -> OperationDraft.insert(null, "x"));

        OperationDraft draft = OperationDraft.delete(CursorPosition.at("d", 0, 2), 3)
            .on(ResourceKey.of("chapter", "c-1"));
        assertEquals(OperationType.DELETE, draft.type());
        assertEquals(3, draft.payload().length());
        assertEquals(ResourceKey.of("chapter", "c-1"), draft.resource());
    }
}
