package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Selection between two cursor positions. Callers normalize reversed
 * selections before handing them to the engine.
 */
public record SelectionRange(CursorPosition start, CursorPosition end) {

    @JsonIgnore
    public boolean isNormalized() {
        return start.compareTo(end) <= 0;
    }

    @JsonIgnore
    public boolean isCollapsed() {
        return start.compareTo(end) == 0;
    }
}
