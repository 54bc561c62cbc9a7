package com.splitttr.coedit.identity;

import java.util.List;

/**
 * Maps a user id onto a fixed display palette. The mapping is a pure function
 * of the id, so every session renders a given user in the same color without
 * coordinating.
 */
public final class ColorPalette {

    public static final List<String> COLORS = List.of(
        "#FF6B6B", "#4ECDC4", "#45B7D1", "#96CEB4",
        "#FFEAA7", "#DDA0DD", "#98D8C8", "#F7DC6F",
        "#BB8FCE", "#85C1E9", "#F8B500", "#00CED1"
    );

    private ColorPalette() {}

    public static String assignColor(String userId) {
        int hash = 0;
        for (int i = 0; i < userId.length(); i++) {
            hash = 31 * hash + userId.charAt(i);
        }
        // widened before abs so Integer.MIN_VALUE stays positive
        return COLORS.get((int) (Math.abs((long) hash) % COLORS.size()));
    }
}
