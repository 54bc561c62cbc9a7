package com.splitttr.coedit.session;

import com.splitttr.coedit.bus.MessageBus;
import com.splitttr.coedit.config.CollaborationConfig;
import com.splitttr.coedit.identity.Identity;
import com.splitttr.coedit.operation.VersionConflictDetector;
import com.splitttr.coedit.security.PermissionChecker;
import com.splitttr.coedit.store.PendingOperationStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds server-side sessions over the deployment bus, one per user id.
 */
@ApplicationScoped
public class SessionManager {

    private static final Logger LOG = Logger.getLogger(SessionManager.class);

    private final ConcurrentHashMap<String, CollaborationSession> sessions = new ConcurrentHashMap<>();

    @Inject
    MessageBus bus;

    @Inject
    PendingOperationStore store;

    @Inject
    PermissionChecker permissions;

    @Inject
    CollaborationConfig config;

    @Inject
    Clock clock;

    @Inject
    ScheduledExecutorService scheduler;

    /**
     * Returns the initialized session for {@code identity}, creating it on
     * first use.
     */
    public CollaborationSession getOrCreateSession(Identity identity) {
        return sessions.computeIfAbsent(identity.userId(), id -> {
            var session = new CollaborationSession(
                bus, store, new VersionConflictDetector(), permissions, config, clock, scheduler);
            session.init(identity);
            return session;
        });
    }

    public CollaborationSession getSession(String userId) {
        return sessions.get(userId);
    }

    public void closeSession(String userId) {
        CollaborationSession session = sessions.remove(userId);
        if (session != null) {
            session.close();
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    @PreDestroy
    void closeAll() {
        LOG.infof("Closing %d collaboration sessions", sessions.size());
        sessions.keySet().forEach(this::closeSession);
    }
}
