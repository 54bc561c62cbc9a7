package com.splitttr.coedit.store;

import com.splitttr.coedit.message.CollaborationOperation;
import com.splitttr.coedit.message.ResourceKey;

import java.util.List;

/**
 * Durable home of operations that were sent but not yet acknowledged by the
 * caller, keyed by resource. Implementations report failures as
 * {@link OperationStoreException}.
 */
public interface PendingOperationStore {

    void append(ResourceKey resource, CollaborationOperation operation);

    void replace(ResourceKey resource, List<CollaborationOperation> operations);

    /** Oldest first; empty when nothing is stored. */
    List<CollaborationOperation> read(ResourceKey resource);
}
