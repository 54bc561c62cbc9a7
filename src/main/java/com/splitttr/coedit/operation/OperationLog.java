package com.splitttr.coedit.operation;

import com.splitttr.coedit.message.CollaborationOperation;
import com.splitttr.coedit.message.OperationDraft;
import com.splitttr.coedit.message.ResourceKey;
import com.splitttr.coedit.store.PendingOperationStore;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Locally originated operations: version assignment, debounced batching and
 * the pending queue kept until the caller clears it.
 */
public class OperationLog {

    private static final Logger LOG = Logger.getLogger(OperationLog.class);

    private final Clock clock;
    private final PendingOperationStore store;
    private final Duration batchWindow;
    private final ScheduledExecutorService scheduler;
    private final Consumer<List<CollaborationOperation>> batchSender;

    private final ConcurrentHashMap<ResourceKey, AtomicLong> versions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ResourceKey, List<CollaborationOperation>> pending = new ConcurrentHashMap<>();

    // buffer and batchTask are guarded by buffer
    private final List<CollaborationOperation> buffer = new ArrayList<>();
    private ScheduledFuture<?> batchTask;

    // serializes take-and-send so batches leave in the order they were cut
    private final Object sendLock = new Object();

    public OperationLog(Clock clock, PendingOperationStore store, Duration batchWindow,
                        ScheduledExecutorService scheduler, Consumer<List<CollaborationOperation>> batchSender) {
        this.clock = clock;
        this.store = store;
        this.batchWindow = batchWindow;
        this.scheduler = scheduler;
        this.batchSender = batchSender;
    }

    /**
     * Pulls the stored queue for {@code resource} into memory and makes sure
     * the next version issued is above every version in it.
     */
    public List<CollaborationOperation> load(ResourceKey resource) {
        List<CollaborationOperation> stored = readStored(resource);
        List<CollaborationOperation> merged = pending.compute(resource, (key, inMemory) -> merge(inMemory, stored));
        long highest = merged.stream().mapToLong(CollaborationOperation::version).max().orElse(0L);
        versions.computeIfAbsent(resource, key -> new AtomicLong()).accumulateAndGet(highest, Math::max);
        if (!merged.isEmpty()) {
            LOG.debugf("Loaded pending operations for %s: %d, up to version %d", resource, merged.size(), highest);
        }
        return merged;
    }

    public CollaborationOperation record(String originatorId, ResourceKey resource, OperationDraft draft) {
        CollaborationOperation operation;
        synchronized (buffer) {
            Instant now = clock.instant();
            long version = versions.computeIfAbsent(resource, key -> new AtomicLong()).incrementAndGet();
            operation = new CollaborationOperation(
                newOperationId(now),
                draft.type(),
                originatorId,
                resource.type(),
                resource.id(),
                draft.position(),
                draft.payload(),
                now,
                version
            );
            pending.compute(resource, (key, existing) -> appended(existing, operation));
            buffer.add(operation);
            scheduleFlush();
        }
        try {
            store.append(resource, operation);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Operation %s for %s kept in memory only", operation.id(), resource);
        }
        return operation;
    }

    /**
     * Sends everything buffered as one batch, now. No-op when empty.
     */
    public void flush() {
        synchronized (sendLock) {
            List<CollaborationOperation> batch;
            synchronized (buffer) {
                cancelBatchTask();
                if (buffer.isEmpty()) return;
                batch = List.copyOf(buffer);
                buffer.clear();
            }
            LOG.debugf("Flushing batch of %d operations", batch.size());
            batchSender.accept(batch);
        }
    }

    /**
     * Drops the scheduled flush. Buffered operations stay buffered; call
     * {@link #flush()} first to send them.
     */
    public void cancel() {
        synchronized (buffer) {
            cancelBatchTask();
        }
    }

    public List<CollaborationOperation> pending(ResourceKey resource) {
        return pending.getOrDefault(resource, List.of());
    }

    public List<CollaborationOperation> pendingAfter(ResourceKey resource, long version) {
        return pending(resource).stream()
            .filter(op -> op.version() > version)
            .toList();
    }

    public void clearPending(ResourceKey resource) {
        pending.remove(resource);
        try {
            store.replace(resource, List.of());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not clear stored pending operations for %s", resource);
        }
    }

    public long currentVersion(ResourceKey resource) {
        AtomicLong version = versions.get(resource);
        return version == null ? 0L : version.get();
    }

    private List<CollaborationOperation> readStored(ResourceKey resource) {
        try {
            return store.read(resource);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not read pending operations for %s, continuing with memory only", resource);
            return List.of();
        }
    }

    private void scheduleFlush() {
        if (batchTask != null) return;
        try {
            batchTask = scheduler.schedule(this::flushScheduled, batchWindow.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Scheduler unavailable, operations stay buffered until the next flush");
        }
    }

    private void flushScheduled() {
        try {
            flush();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Scheduled operation flush failed");
        }
    }

    private void cancelBatchTask() {
        if (batchTask != null) {
            batchTask.cancel(false);
            batchTask = null;
        }
    }

    private static List<CollaborationOperation> appended(List<CollaborationOperation> existing,
                                                         CollaborationOperation operation) {
        List<CollaborationOperation> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        next.add(operation);
        return List.copyOf(next);
    }

    // union by id, ordered by version; in-memory entries win over stored copies
    private static List<CollaborationOperation> merge(List<CollaborationOperation> inMemory,
                                                      List<CollaborationOperation> stored) {
        Map<String, CollaborationOperation> byId = new LinkedHashMap<>();
        stored.forEach(op -> byId.put(op.id(), op));
        if (inMemory != null) {
            inMemory.forEach(op -> byId.put(op.id(), op));
        }
        List<CollaborationOperation> merged = new ArrayList<>(byId.values());
        merged.sort((a, b) -> Long.compare(a.version(), b.version()));
        return List.copyOf(merged);
    }

    private static String newOperationId(Instant now) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(36L * 36 * 36 * 36 * 36 * 36), 36);
        return "op_" + now.toEpochMilli() + "_" + "0".repeat(6 - suffix.length()) + suffix;
    }
}
