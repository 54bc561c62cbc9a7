package com.splitttr.coedit.config;

import com.splitttr.coedit.store.InMemoryPendingOperationStore;
import com.splitttr.coedit.store.RemotePendingOperationStore;
import com.splitttr.coedit.client.PendingOperationClient;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CollaborationConfigTest {

    @Test
    void defaultsMatchDocumentedTimings() {
        CollaborationConfig config = CollaborationConfig.defaults();

        assertEquals(Duration.ofSeconds(30), config.presenceInterval());
        assertEquals(Duration.ofMinutes(2), config.inactiveThreshold());
        assertEquals(Duration.ofMillis(100), config.batchWindow());
    }

    @Test
    void rejectsNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class,
            () -> new CollaborationConfig(Duration.ZERO, Duration.ofMinutes(2), Duration.ofMillis(100)));
        assertThrows(IllegalArgumentException.class,
            () -> new CollaborationConfig(Duration.ofSeconds(30), null, Duration.ofMillis(100)));
        assertThrows(IllegalArgumentException.class,
            () -> new CollaborationConfig(Duration.ofSeconds(30), Duration.ofMinutes(2), Duration.ofMillis(-1)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void storageProviderSelectsStore() {
        CollaborationBeans beans = new CollaborationBeans();
        Instance<PendingOperationClient> client = mock(Instance.class);
        when(client.get()).thenReturn(mock(PendingOperationClient.class));

        beans.storageProvider = "memory";
        assertInstanceOf(InMemoryPendingOperationStore.class, beans.pendingOperationStore(client));
        verify(client, never()).get();

        beans.storageProvider = " Remote ";
        assertInstanceOf(RemotePendingOperationStore.class, beans.pendingOperationStore(client));

        beans.storageProvider = "redis";
        assertThrows(IllegalStateException.class, () -> beans.pendingOperationStore(client));
    }

    @Test
    void beansBindProperties() {
        CollaborationBeans beans = new CollaborationBeans();
        beans.presenceInterval = Duration.ofSeconds(5);
        beans.inactiveThreshold = Duration.ofSeconds(20);
        beans.batchWindow = Duration.ofMillis(50);

        assertEquals(new CollaborationConfig(Duration.ofSeconds(5), Duration.ofSeconds(20), Duration.ofMillis(50)),
            beans.collaborationConfig());
    }
}
