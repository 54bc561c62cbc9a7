package com.splitttr.coedit.lock;

import com.splitttr.coedit.message.ResourceKey;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of advisory locks, at most one live lock per resource. Nothing here
 * stops a second identity from editing a locked resource: editors are
 * expected to check {@link #get(ResourceKey)} before allowing changes. An
 * expired lock counts as absent whether or not an unlock message arrived.
 */
public class LockManager {

    private final ConcurrentHashMap<ResourceKey, ResourceLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public LockManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Grants the lock when the resource is free, its lock has expired, or
     * {@code holderId} already holds it (the lock is then renewed with the new
     * reason and ttl).
     *
     * @param ttl null or zero for a lock without expiry
     * @return the granted lock, empty when someone else holds a live lock
     */
    public Optional<ResourceLock> acquire(String holderId, ResourceKey resource, String reason, Duration ttl) {
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("Lock ttl must not be negative: " + ttl);
        }
        Instant now = clock.instant();
        Instant expiresAt = ttl == null || ttl.isZero() ? null : now.plus(ttl);
        ResourceLock candidate = new ResourceLock(resource.type(), resource.id(), holderId, now, reason, expiresAt);
        ResourceLock result = locks.compute(resource, (key, existing) -> {
            if (existing != null && !existing.isHeldBy(holderId) && !existing.isExpired(now)) {
                return existing;
            }
            return candidate;
        });
        return result == candidate ? Optional.of(candidate) : Optional.empty();
    }

    /**
     * Releases a live lock held by {@code holderId}. Anything else, including
     * an expired lock, leaves the table unchanged and returns false.
     */
    public boolean release(String holderId, ResourceKey resource) {
        Instant now = clock.instant();
        boolean[] released = {false};
        locks.computeIfPresent(resource, (key, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (!existing.isHeldBy(holderId)) {
                return existing;
            }
            released[0] = true;
            return null;
        });
        return released[0];
    }

    public Optional<ResourceLock> get(ResourceKey resource) {
        ResourceLock lock = locks.get(resource);
        if (lock == null) return Optional.empty();
        if (lock.isExpired(clock.instant())) {
            locks.remove(resource, lock);
            return Optional.empty();
        }
        return Optional.of(lock);
    }

    /** Live locks held by {@code holderId}; expired ones are evicted on the way. */
    public List<ResourceLock> heldBy(String holderId) {
        Instant now = clock.instant();
        List<ResourceLock> held = new ArrayList<>();
        for (Map.Entry<ResourceKey, ResourceLock> entry : locks.entrySet()) {
            ResourceLock lock = entry.getValue();
            if (lock.isExpired(now)) {
                locks.remove(entry.getKey(), lock);
            } else if (lock.isHeldBy(holderId)) {
                held.add(lock);
            }
        }
        return held;
    }

    /**
     * Mirrors a peer's lock announcement under the same rule as
     * {@link #acquire}: a live lock held by someone else is kept.
     *
     * @return false when the announcement was ignored
     */
    public boolean applyRemoteLock(ResourceLock lock) {
        Instant now = clock.instant();
        ResourceLock result = locks.compute(lock.resource(), (key, existing) -> {
            if (existing != null && !existing.isHeldBy(lock.holderId()) && !existing.isExpired(now)) {
                return existing;
            }
            return lock;
        });
        return result == lock;
    }

    /**
     * Mirrors a peer's unlock announcement. Only the holder's own unlock
     * removes a live lock.
     */
    public boolean applyRemoteUnlock(String senderId, ResourceKey resource) {
        return release(senderId, resource);
    }

    /** Drops every lock held by {@code holderId}, e.g. when that peer leaves. */
    public List<ResourceLock> dropAllHeldBy(String holderId) {
        List<ResourceLock> dropped = new ArrayList<>();
        for (Map.Entry<ResourceKey, ResourceLock> entry : locks.entrySet()) {
            ResourceLock lock = entry.getValue();
            if (lock.isHeldBy(holderId) && locks.remove(entry.getKey(), lock)) {
                dropped.add(lock);
            }
        }
        return dropped;
    }

    public void clear() {
        locks.clear();
    }
}
