package com.splitttr.coedit.session;

import com.splitttr.coedit.bus.MessageBus;
import com.splitttr.coedit.bus.Subscription;
import com.splitttr.coedit.config.CollaborationConfig;
import com.splitttr.coedit.event.CollaborationEvent;
import com.splitttr.coedit.event.CollaborationEvent.ConflictDetected;
import com.splitttr.coedit.event.CollaborationEvent.Connected;
import com.splitttr.coedit.event.CollaborationEvent.Disconnected;
import com.splitttr.coedit.event.CollaborationEvent.ErrorOccurred;
import com.splitttr.coedit.event.CollaborationEvent.OperationReceived;
import com.splitttr.coedit.event.CollaborationEvent.SyncCompleted;
import com.splitttr.coedit.event.EventDispatcher;
import com.splitttr.coedit.identity.Collaborator;
import com.splitttr.coedit.identity.Identity;
import com.splitttr.coedit.lock.LockManager;
import com.splitttr.coedit.lock.ResourceLock;
import com.splitttr.coedit.message.CollaborationMessage;
import com.splitttr.coedit.message.CollaborationOperation;
import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.MessageCodec;
import com.splitttr.coedit.message.MessageCodecException;
import com.splitttr.coedit.message.MessagePayloads.CursorPayload;
import com.splitttr.coedit.message.MessagePayloads.LeavePayload;
import com.splitttr.coedit.message.MessagePayloads.LockPayload;
import com.splitttr.coedit.message.MessagePayloads.OperationsPayload;
import com.splitttr.coedit.message.MessagePayloads.SelectionPayload;
import com.splitttr.coedit.message.MessagePayloads.SyncRequestPayload;
import com.splitttr.coedit.message.MessagePayloads.SyncResponsePayload;
import com.splitttr.coedit.message.MessagePayloads.UnlockPayload;
import com.splitttr.coedit.message.MessagePayloads.UserPayload;
import com.splitttr.coedit.message.MessageType;
import com.splitttr.coedit.message.OperationDraft;
import com.splitttr.coedit.message.ResourceKey;
import com.splitttr.coedit.message.SelectionRange;
import com.splitttr.coedit.operation.ConflictDetector;
import com.splitttr.coedit.operation.ConflictDetector.Verdict;
import com.splitttr.coedit.operation.OperationLog;
import com.splitttr.coedit.presence.PresenceTracker;
import com.splitttr.coedit.security.PermissionChecker;
import com.splitttr.coedit.session.SessionState.SessionStatus;
import com.splitttr.coedit.store.PendingOperationStore;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One participant's view of collaborative editing: presence, cursors,
 * versioned operations and advisory locks for at most one joined resource at
 * a time.
 *
 * <p>Lifecycle: construct, {@link #init(Identity)}, then any number of
 * {@link #join(String, String)} / {@link #leave()} cycles, then
 * {@link #close()}. Every session operation before {@code init} throws
 * {@link IllegalStateException}.
 *
 * <p>Nothing here throws because the bus or the store is down: publish and
 * persistence failures are logged, reported as {@link ErrorOccurred} and local
 * editing carries on. Conflicts are events, lock refusals are {@code false}.
 *
 * <p>Locks are advisory. A session holding a lock does not stop anyone from
 * sending operations for that resource; editors should check
 * {@link #canEdit(String, String)} or {@link #getLock(String, String)}.
 */
public class CollaborationSession implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(CollaborationSession.class);

    private final MessageBus bus;
    private final ConflictDetector conflicts;
    private final PermissionChecker permissions;
    private final CollaborationConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final MessageCodec codec = new MessageCodec();

    private final EventDispatcher events = new EventDispatcher();
    private final PresenceTracker presence;
    private final OperationLog operations;
    private final LockManager locks;

    private final AtomicReference<Collaborator> currentUser = new AtomicReference<>();
    private final AtomicReference<ResourceKey> currentResource = new AtomicReference<>();
    private volatile SessionStatus status = SessionStatus.IDLE;
    private volatile Instant lastSyncAt;

    // guarded by this
    private Subscription busSubscription;
    private ScheduledFuture<?> heartbeat;

    public CollaborationSession(MessageBus bus, PendingOperationStore store, ConflictDetector conflicts,
                                PermissionChecker permissions, CollaborationConfig config,
                                Clock clock, ScheduledExecutorService scheduler) {
        this.bus = bus;
        this.conflicts = conflicts;
        this.permissions = permissions;
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
        this.presence = new PresenceTracker(clock, config.inactiveThreshold(), events);
        this.operations = new OperationLog(clock, store, config.batchWindow(), scheduler, this::sendBatch);
        this.locks = new LockManager(clock);
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Binds the session to {@code identity}, subscribes to the bus and starts
     * the presence heartbeat. A second call is ignored.
     */
    public synchronized void init(Identity identity) {
        if (currentUser.get() != null) {
            LOG.debugf("Session for %s already initialized", currentUser.get().userId());
            return;
        }
        currentUser.set(Collaborator.of(identity, clock.instant()));

        try {
            busSubscription = bus.subscribe(this::onMessage);
        } catch (RuntimeException e) {
            // offline: local editing keeps working without cross-session sync
            LOG.warnf(e, "Message bus unavailable for %s, running without sync", identity.userId());
            events.emit(new ErrorOccurred("Message bus unavailable", e));
        }

        long interval = config.presenceInterval().toMillis();
        try {
            heartbeat = scheduler.scheduleAtFixedRate(this::heartbeat, interval, interval, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.warnf(e, "Presence heartbeat not scheduled for %s", identity.userId());
        }
        LOG.infof("Collaboration session initialized for %s", identity.userId());
    }

    /**
     * Joins {@code resourceType:resourceId}, leaving the current resource
     * first. The handshake is fire-and-forget: join and sync_request are
     * published, locally pending operations are replayed, and the call
     * returns without waiting for peers.
     */
    public synchronized void join(String resourceType, String resourceId) {
        requireInitialized();
        ResourceKey resource = ResourceKey.of(resourceType, resourceId);

        if (currentResource.get() != null) {
            leave();
        }

        status = SessionStatus.JOINING;
        currentResource.set(resource);
        Collaborator me = currentUser.updateAndGet(user -> user.withResource(resource).touchedAt(clock.instant()));

        List<CollaborationOperation> pending = operations.load(resource);

        broadcast(MessageType.JOIN, new UserPayload(me));
        broadcast(MessageType.SYNC_REQUEST, new SyncRequestPayload(operations.currentVersion(resource)));
        if (!pending.isEmpty()) {
            // replayed as a sync response so peers that already applied them stay silent
            broadcast(MessageType.SYNC_RESPONSE,
                new SyncResponsePayload(pending, operations.currentVersion(resource)));
        }

        status = SessionStatus.ACTIVE;
        lastSyncAt = clock.instant();
        LOG.infof("User %s joined %s (%d pending operations)", me.userId(), resource, pending.size());
        events.emit(new Connected(resource));
    }

    /**
     * Leaves the joined resource: flushes buffered operations, announces the
     * departure, releases own locks and forgets peers. No-op when idle.
     */
    public synchronized void leave() {
        Collaborator me = requireInitialized();
        ResourceKey resource = currentResource.get();
        if (resource == null) return;

        operations.flush();
        operations.cancel();

        broadcast(MessageType.LEAVE, new LeavePayload(me.userId()));
        for (ResourceLock lock : locks.heldBy(me.userId())) {
            unlock(lock.resourceType(), lock.resourceId());
        }

        locks.clear();
        presence.clear();
        currentResource.set(null);
        currentUser.updateAndGet(user -> user.cleared());
        status = SessionStatus.IDLE;

        LOG.infof("User %s left %s", me.userId(), resource);
        events.emit(new Disconnected(resource));
    }

    /**
     * Leaves the joined resource, stops the heartbeat, detaches from the bus
     * and drops all listeners. The session can be initialized again afterwards.
     */
    @Override
    public synchronized void close() {
        if (currentUser.get() == null) return;
        leave();
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
        if (busSubscription != null) {
            busSubscription.unsubscribe();
            busSubscription = null;
        }
        events.clear();
        Collaborator me = currentUser.getAndSet(null);
        LOG.infof("Collaboration session closed for %s", me.userId());
    }

    // ---------------------------------------------------------------- local updates

    public void updateCursor(CursorPosition cursor) {
        requireInitialized();
        if (currentResource.get() == null) return;
        currentUser.updateAndGet(user -> user.withCursor(cursor).touchedAt(clock.instant()));
        broadcast(MessageType.CURSOR_MOVE, new CursorPayload(cursor));
    }

    /**
     * @param selection the new selection, or null when it was cleared
     */
    public void updateSelection(SelectionRange selection) {
        requireInitialized();
        if (currentResource.get() == null) return;
        currentUser.updateAndGet(user -> user.withSelection(selection).touchedAt(clock.instant()));
        broadcast(MessageType.SELECTION, new SelectionPayload(selection));
    }

    /**
     * Stamps the draft with id, originator, timestamp and the next version for
     * its resource, queues it as pending and schedules it for the next batch.
     *
     * @return the queued operation, empty when no resource is joined
     */
    public Optional<CollaborationOperation> sendOperation(OperationDraft draft) {
        Collaborator me = requireInitialized();
        ResourceKey joined = currentResource.get();
        if (joined == null) return Optional.empty();
        ResourceKey target = draft.resource() == null ? joined : draft.resource();
        return Optional.of(operations.record(me.userId(), target, draft));
    }

    /** Sends the buffered batch without waiting for the debounce window. */
    public void flushOperations() {
        requireInitialized();
        operations.flush();
    }

    public List<CollaborationOperation> getPendingOperations() {
        requireInitialized();
        ResourceKey resource = currentResource.get();
        return resource == null ? List.of() : operations.pending(resource);
    }

    /** Acknowledges every pending operation of the joined resource. */
    public void clearPendingOperations() {
        requireInitialized();
        ResourceKey resource = currentResource.get();
        if (resource != null) {
            operations.clearPending(resource);
        }
    }

    // ---------------------------------------------------------------- locks

    public boolean lock(String resourceType, String resourceId) {
        return lock(resourceType, resourceId, null, null);
    }

    /**
     * Claims {@code resourceType:resourceId}. Returns false, never throws, when
     * another identity holds a live lock.
     *
     * @param ttl lock lifetime, null for none
     */
    public boolean lock(String resourceType, String resourceId, String reason, Duration ttl) {
        Collaborator me = requireInitialized();
        ResourceKey resource = ResourceKey.of(resourceType, resourceId);
        Optional<ResourceLock> granted = locks.acquire(me.userId(), resource, reason, ttl);
        if (granted.isEmpty()) {
            LOG.debugf("Lock on %s refused for %s", resource, me.userId());
            return false;
        }
        broadcastFor(resource, MessageType.LOCK, new LockPayload(granted.get()));
        return true;
    }

    /** Releases a lock this identity holds; false otherwise. */
    public boolean unlock(String resourceType, String resourceId) {
        Collaborator me = requireInitialized();
        ResourceKey resource = ResourceKey.of(resourceType, resourceId);
        if (!locks.release(me.userId(), resource)) {
            return false;
        }
        broadcastFor(resource, MessageType.UNLOCK, new UnlockPayload(resourceType, resourceId));
        return true;
    }

    public Optional<ResourceLock> getLock(String resourceType, String resourceId) {
        requireInitialized();
        return locks.get(ResourceKey.of(resourceType, resourceId));
    }

    /** Live locks {@code userId} holds, as far as this session knows. */
    public List<ResourceLock> getLocksHeldBy(String userId) {
        requireInitialized();
        return locks.heldBy(userId);
    }

    /**
     * True when the permission system allows this identity to edit and no one
     * else holds a live lock on the resource.
     */
    public boolean canEdit(String resourceType, String resourceId) {
        Collaborator me = requireInitialized();
        ResourceKey resource = ResourceKey.of(resourceType, resourceId);
        if (!permissions.canEdit(me.userId(), resource)) {
            return false;
        }
        return locks.get(resource).map(lock -> lock.isHeldBy(me.userId())).orElse(true);
    }

    // ---------------------------------------------------------------- queries

    public List<Collaborator> getCollaborators() {
        requireInitialized();
        return presence.snapshot();
    }

    public Collaborator getCurrentUser() {
        return requireInitialized();
    }

    public Optional<ResourceKey> getCurrentResource() {
        requireInitialized();
        return Optional.ofNullable(currentResource.get());
    }

    public Optional<SessionState> getState() {
        Collaborator me = requireInitialized();
        ResourceKey resource = currentResource.get();
        if (resource == null) return Optional.empty();
        return Optional.of(new SessionState(
            "collab_" + me.userId() + "_" + resource.id(),
            resource,
            status,
            presence.snapshot(),
            lastSyncAt
        ));
    }

    public SessionStatus getStatus() {
        return status;
    }

    /**
     * Subscribes to one kind of event, or to every kind with
     * {@code CollaborationEvent.class}. Allowed before {@code init}.
     */
    public <E extends CollaborationEvent> Subscription on(Class<E> eventType, Consumer<? super E> handler) {
        return events.on(eventType, handler);
    }

    // ---------------------------------------------------------------- timers

    /** Re-announces presence and sweeps silent peers. Runs on the heartbeat timer. */
    void heartbeat() {
        try {
            Collaborator me = currentUser.get();
            if (me == null || currentResource.get() == null) return;
            broadcast(MessageType.PRESENCE, new UserPayload(me));
            presence.sweep();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Presence heartbeat failed");
        }
    }

    private void sendBatch(List<CollaborationOperation> batch) {
        if (currentResource.get() == null) {
            LOG.debugf("Dropping transmission of %d operations, no resource joined; they stay pending", batch.size());
            return;
        }
        broadcast(MessageType.OPERATION, new OperationsPayload(batch));
    }

    // ---------------------------------------------------------------- inbound

    void onMessage(CollaborationMessage message) {
        Collaborator me = currentUser.get();
        ResourceKey joined = currentResource.get();
        if (me == null || joined == null) return;
        if (me.userId().equals(message.senderId())) return;
        if (!message.isFor(joined)) return;

        LOG.debugf("%s received %s from %s", me.userId(), message.type(), message.senderId());
        try {
            switch (message.type()) {
                case JOIN -> handleJoin(message);
                case LEAVE -> handleLeave(message);
                case CURSOR_MOVE -> presence.recordCursor(message.senderId(),
                    codec.payload(message, CursorPayload.class).cursor());
                case SELECTION -> presence.recordSelection(message.senderId(),
                    codec.payload(message, SelectionPayload.class).selection());
                case OPERATION -> handleOperations(codec.payload(message, OperationsPayload.class).operations());
                case PRESENCE -> presence.recordPresence(userOf(message));
                case SYNC_REQUEST -> handleSyncRequest(message);
                case SYNC_RESPONSE -> handleSyncResponse(joined, codec.payload(message, SyncResponsePayload.class));
                case LOCK -> handleLock(message);
                case UNLOCK -> handleUnlock(message);
            }
        } catch (MessageCodecException | IllegalArgumentException e) {
            LOG.warnf(e, "Dropping invalid %s message from %s", message.type(), message.senderId());
            events.emit(new ErrorOccurred("Invalid " + message.type() + " message from " + message.senderId(), e));
        }
    }

    private void handleJoin(CollaborationMessage message) {
        presence.recordJoin(userOf(message));
        // tell the joiner we are here
        broadcast(MessageType.PRESENCE, new UserPayload(currentUser.get()));
    }

    private void handleLeave(CollaborationMessage message) {
        String userId = required(codec.payload(message, LeavePayload.class).userId(), "userId");
        requireSender(userId, message, "userId");
        presence.recordLeave(userId);
        List<ResourceLock> dropped = locks.dropAllHeldBy(userId);
        if (!dropped.isEmpty()) {
            LOG.debugf("Dropped %d locks held by departed %s", dropped.size(), userId);
        }
    }

    private void handleLock(CollaborationMessage message) {
        ResourceLock lock = required(codec.payload(message, LockPayload.class).lock(), "lock");
        requireSender(lock.holderId(), message, "lock.holderId");
        if (!locks.applyRemoteLock(lock)) {
            LOG.debugf("Ignoring lock on %s by %s, held by someone else", lock.resource(), lock.holderId());
        }
    }

    private void handleUnlock(CollaborationMessage message) {
        UnlockPayload unlock = codec.payload(message, UnlockPayload.class);
        ResourceKey resource = ResourceKey.of(unlock.resourceType(), unlock.resourceId());
        if (!locks.applyRemoteUnlock(message.senderId(), resource)) {
            LOG.debugf("Ignoring unlock of %s by %s, not the holder", resource, message.senderId());
        }
    }

    private void handleOperations(List<CollaborationOperation> incoming) {
        for (CollaborationOperation op : incoming) {
            if (conflicts.detect(op) == Verdict.CONFLICT) {
                long highest = conflicts.highestVersion(op.resource());
                LOG.debugf("Conflict on %s: %s v%d <= v%d", op.resource(), op.id(), op.version(), highest);
                events.emit(new ConflictDetected(op, highest));
                continue;
            }
            events.emit(new OperationReceived(op));
        }
    }

    private void handleSyncRequest(CollaborationMessage message) {
        long requested = codec.payload(message, SyncRequestPayload.class).version();
        ResourceKey joined = currentResource.get();
        List<CollaborationOperation> newer = operations.pendingAfter(joined, requested);
        if (newer.isEmpty()) return;
        broadcast(MessageType.SYNC_RESPONSE, new SyncResponsePayload(newer, operations.currentVersion(joined)));
    }

    private void handleSyncResponse(ResourceKey joined, SyncResponsePayload response) {
        for (CollaborationOperation op : response.operations()) {
            // already applied: replay is a no-op, not a conflict
            if (conflicts.detect(op) == Verdict.ACCEPT) {
                events.emit(new OperationReceived(op));
            }
        }
        lastSyncAt = clock.instant();
        events.emit(new SyncCompleted(joined, response.version()));
    }

    // ---------------------------------------------------------------- outbound

    private void broadcast(MessageType type, Object payload) {
        ResourceKey resource = currentResource.get();
        if (resource == null) return;
        broadcastFor(resource, type, payload);
    }

    // lock traffic goes out on the joined resource's channel when there is one
    private void broadcastFor(ResourceKey target, MessageType type, Object payload) {
        ResourceKey joined = currentResource.get();
        ResourceKey channel = joined != null ? joined : target;
        String senderId = currentUser.get().userId();
        try {
            bus.publish(codec.encode(type, senderId, channel, payload, clock.instant()));
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to publish %s for %s", type, channel);
            events.emit(new ErrorOccurred("Failed to publish " + type, e));
        }
    }

    private Collaborator userOf(CollaborationMessage message) {
        Collaborator user = required(codec.payload(message, UserPayload.class).user(), "user");
        requireSender(required(user.userId(), "user.userId"), message, "user.userId");
        return user;
    }

    // a peer may only speak for itself
    private static void requireSender(String claimed, CollaborationMessage message, String field) {
        if (!claimed.equals(message.senderId())) {
            throw new MessageCodecException(field + " " + claimed + " does not match sender " + message.senderId(), null);
        }
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new MessageCodecException("Missing " + field, null);
        }
        return value;
    }

    private Collaborator requireInitialized() {
        Collaborator me = currentUser.get();
        if (me == null) {
            throw new IllegalStateException("Collaboration session not initialized, call init() first");
        }
        return me;
    }
}
