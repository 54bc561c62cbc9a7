package com.splitttr.coedit.session;

import com.splitttr.coedit.bus.LocalMessageBus;
import com.splitttr.coedit.config.CollaborationConfig;
import com.splitttr.coedit.identity.Identity;
import com.splitttr.coedit.security.PermissionChecker;
import com.splitttr.coedit.store.InMemoryPendingOperationStore;
import com.splitttr.coedit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class SessionManagerTest {

    private SessionManager manager;
    private LocalMessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new LocalMessageBus();
        manager = new SessionManager();
        manager.bus = bus;
        manager.store = new InMemoryPendingOperationStore();
        manager.permissions = PermissionChecker.ALLOW_ALL;
        manager.config = CollaborationConfig.defaults();
        manager.clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        manager.scheduler = mock(ScheduledExecutorService.class);
    }

    @Test
    void oneInitializedSessionPerUser() {
        CollaborationSession first = manager.getOrCreateSession(Identity.of("alice", "Alice"));
        CollaborationSession second = manager.getOrCreateSession(Identity.of("alice", "Alice"));

        assertSame(first, second);
        assertEquals("alice", first.getCurrentUser().userId());
        assertSame(first, manager.getSession("alice"));
        assertEquals(1, bus.subscriberCount());
    }

    @Test
    void closeRemovesAndDetaches() {
        manager.getOrCreateSession(Identity.of("alice", "Alice")).join("novel", "42");
        manager.getOrCreateSession(Identity.of("bob", "Bob"));

        manager.closeSession("alice");

        assertNull(manager.getSession("alice"));
        assertEquals(1, manager.sessionCount());
        assertEquals(1, bus.subscriberCount());

        manager.closeAll();
        assertEquals(0, manager.sessionCount());
        assertEquals(0, bus.subscriberCount());
    }
}
