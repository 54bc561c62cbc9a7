package com.splitttr.coedit.identity;

/**
 * Who a session acts as. The avatar reference is optional.
 */
public record Identity(String userId, String displayName, String avatarRef) {

    public Identity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID required");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name required");
        }
    }

    public static Identity of(String userId, String displayName) {
        return new Identity(userId, displayName, null);
    }
}
