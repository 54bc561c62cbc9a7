package com.splitttr.coedit.store;

import com.splitttr.coedit.client.PendingOperationClient;
import com.splitttr.coedit.message.CollaborationOperation;
import com.splitttr.coedit.message.ResourceKey;

import java.util.List;

/**
 * Store backed by the document service. Every client failure surfaces as an
 * {@link OperationStoreException}.
 */
public class RemotePendingOperationStore implements PendingOperationStore {

    private final PendingOperationClient client;

    public RemotePendingOperationStore(PendingOperationClient client) {
        this.client = client;
    }

    @Override
    public void append(ResourceKey resource, CollaborationOperation operation) {
        try {
            client.append(resource.type(), resource.id(), operation);
        } catch (RuntimeException e) {
            throw new OperationStoreException("Failed to append operation " + operation.id() + " for " + resource, e);
        }
    }

    @Override
    public void replace(ResourceKey resource, List<CollaborationOperation> operations) {
        try {
            client.replace(resource.type(), resource.id(), operations);
        } catch (RuntimeException e) {
            throw new OperationStoreException("Failed to replace pending operations for " + resource, e);
        }
    }

    @Override
    public List<CollaborationOperation> read(ResourceKey resource) {
        List<CollaborationOperation> operations;
        try {
            operations = client.list(resource.type(), resource.id());
        } catch (RuntimeException e) {
            throw new OperationStoreException("Failed to read pending operations for " + resource, e);
        }
        return operations == null ? List.of() : operations;
    }
}
