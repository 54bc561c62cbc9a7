package com.splitttr.coedit.presence;

import com.splitttr.coedit.event.CollaborationEvent.CollaboratorJoined;
import com.splitttr.coedit.event.CollaborationEvent.CollaboratorLeft;
import com.splitttr.coedit.event.CollaborationEvent.CursorUpdated;
import com.splitttr.coedit.event.CollaborationEvent.SelectionUpdated;
import com.splitttr.coedit.event.EventDispatcher;
import com.splitttr.coedit.identity.Collaborator;
import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.SelectionRange;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live set of peers on the joined resource. Entries are created by join and
 * presence messages and removed by leave messages or by {@link #sweep()} once
 * they have been silent longer than the inactivity threshold.
 */
public class PresenceTracker {

    private static final Logger LOG = Logger.getLogger(PresenceTracker.class);

    private final ConcurrentHashMap<String, Collaborator> collaborators = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration inactiveThreshold;
    private final EventDispatcher events;

    public PresenceTracker(Clock clock, Duration inactiveThreshold, EventDispatcher events) {
        this.clock = clock;
        this.inactiveThreshold = inactiveThreshold;
        this.events = events;
    }

    /**
     * Explicit join: always announced, even for a peer that is already known.
     */
    public void recordJoin(Collaborator peer) {
        Collaborator stored = upsert(peer);
        events.emit(new CollaboratorJoined(stored));
    }

    /**
     * Heartbeat or reply to our own join. Announced only the first time the
     * peer is seen.
     */
    public void recordPresence(Collaborator peer) {
        boolean known = collaborators.containsKey(peer.userId());
        Collaborator stored = upsert(peer);
        if (!known) {
            events.emit(new CollaboratorJoined(stored));
        }
    }

    public void recordLeave(String userId) {
        Collaborator removed = collaborators.remove(userId);
        if (removed != null) {
            events.emit(new CollaboratorLeft(removed));
        }
    }

    public void recordCursor(String userId, CursorPosition cursor) {
        Collaborator updated = collaborators.computeIfPresent(userId,
            (id, existing) -> existing.withCursor(cursor).touchedAt(clock.instant()));
        if (updated != null) {
            events.emit(new CursorUpdated(userId, cursor));
        }
    }

    public void recordSelection(String userId, SelectionRange selection) {
        Collaborator updated = collaborators.computeIfPresent(userId,
            (id, existing) -> existing.withSelection(selection).touchedAt(clock.instant()));
        if (updated != null) {
            events.emit(new SelectionUpdated(userId, selection));
        }
    }

    /**
     * Removes every peer silent for longer than the inactivity threshold and
     * announces each removal once.
     */
    public List<Collaborator> sweep() {
        Instant cutoff = clock.instant().minus(inactiveThreshold);
        List<Collaborator> removed = new ArrayList<>();
        for (Map.Entry<String, Collaborator> entry : collaborators.entrySet()) {
            Collaborator peer = entry.getValue();
            // remove(key, value) loses to a concurrent refresh instead of dropping a live peer
            if (peer.lastActiveAt().isBefore(cutoff) && collaborators.remove(entry.getKey(), peer)) {
                removed.add(peer);
            }
        }
        if (!removed.isEmpty()) {
            LOG.debugf("Swept %d inactive collaborators", removed.size());
        }
        removed.forEach(peer -> events.emit(new CollaboratorLeft(peer)));
        return removed;
    }

    public List<Collaborator> snapshot() {
        return List.copyOf(collaborators.values());
    }

    public boolean contains(String userId) {
        return collaborators.containsKey(userId);
    }

    public void clear() {
        collaborators.clear();
    }

    private Collaborator upsert(Collaborator peer) {
        Instant now = clock.instant();
        return collaborators.compute(peer.userId(), (id, existing) -> {
            // local clock only; strictly increasing across updates from the same peer
            Instant previous = existing == null ? null : existing.lastActiveAt();
            return withLastActive(peer, previous).touchedAt(now);
        });
    }

    private static Collaborator withLastActive(Collaborator incoming, Instant lastActiveAt) {
        return new Collaborator(
            incoming.userId(),
            incoming.displayName(),
            incoming.avatarRef(),
            incoming.color(),
            incoming.online(),
            lastActiveAt,
            incoming.currentResource(),
            incoming.cursor(),
            incoming.selection()
        );
    }
}
