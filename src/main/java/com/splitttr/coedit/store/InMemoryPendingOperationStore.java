package com.splitttr.coedit.store;

import com.splitttr.coedit.message.CollaborationOperation;
import com.splitttr.coedit.message.ResourceKey;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Survives a session being closed and reopened, not a
 * restart.
 */
public class InMemoryPendingOperationStore implements PendingOperationStore {

    private final ConcurrentHashMap<ResourceKey, List<CollaborationOperation>> queues = new ConcurrentHashMap<>();

    @Override
    public void append(ResourceKey resource, CollaborationOperation operation) {
        queues.compute(resource, (key, existing) -> {
            List<CollaborationOperation> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            next.add(operation);
            return List.copyOf(next);
        });
    }

    @Override
    public void replace(ResourceKey resource, List<CollaborationOperation> operations) {
        if (operations.isEmpty()) {
            queues.remove(resource);
        } else {
            queues.put(resource, List.copyOf(operations));
        }
    }

    @Override
    public List<CollaborationOperation> read(ResourceKey resource) {
        return queues.getOrDefault(resource, List.of());
    }
}
