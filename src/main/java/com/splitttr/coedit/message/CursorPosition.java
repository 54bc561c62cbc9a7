package com.splitttr.coedit.message;

import java.util.Comparator;

/**
 * Logical address into a document's content model, not a pixel location.
 */
public record CursorPosition(
    String documentId,
    int paragraphIndex,
    int offset
) implements Comparable<CursorPosition> {

    private static final Comparator<CursorPosition> ORDER = Comparator
        .comparingInt(CursorPosition::paragraphIndex)
        .thenComparingInt(CursorPosition::offset);

    public static CursorPosition at(String documentId, int paragraphIndex, int offset) {
        return new CursorPosition(documentId, paragraphIndex, offset);
    }

    // Orders by (paragraphIndex, offset) only; documentId is not compared.
    @Override
    public int compareTo(CursorPosition other) {
        return ORDER.compare(this, other);
    }
}
