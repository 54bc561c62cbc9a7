package com.splitttr.coedit.message;

/**
 * Addressable editable unit, e.g. ("novel", "42") or ("chapter", "c-7").
 */
public record ResourceKey(String type, String id) {

    public ResourceKey {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Resource type required");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Resource id required");
        }
    }

    public static ResourceKey of(String type, String id) {
        return new ResourceKey(type, id);
    }

    public boolean matches(String otherType, String otherId) {
        return type.equals(otherType) && id.equals(otherId);
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
