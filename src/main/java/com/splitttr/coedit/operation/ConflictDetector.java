package com.splitttr.coedit.operation;

import com.splitttr.coedit.message.CollaborationOperation;
import com.splitttr.coedit.message.ResourceKey;

/**
 * Classifies incoming operations. Implementations only detect; resolving a
 * conflict is the caller's decision.
 */
public interface ConflictDetector {

    enum Verdict {
        /** New for this resource, apply it. */
        ACCEPT,
        /** Already superseded, drop it. */
        CONFLICT
    }

    /**
     * Classifies {@code operation} and, on {@link Verdict#ACCEPT}, records it
     * as applied. Must be atomic per resource: two threads offering the same
     * operation get exactly one {@code ACCEPT}.
     */
    Verdict detect(CollaborationOperation operation);

    /** Highest version accepted for the resource, 0 when none. */
    long highestVersion(ResourceKey resource);
}
