package com.splitttr.coedit.config;

import com.splitttr.coedit.client.PendingOperationClient;
import com.splitttr.coedit.security.PermissionChecker;
import com.splitttr.coedit.store.InMemoryPendingOperationStore;
import com.splitttr.coedit.store.PendingOperationStore;
import com.splitttr.coedit.store.RemotePendingOperationStore;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * CDI wiring for sessions built by {@code SessionManager}.
 *
 * collab.storage.provider:
 *  - memory (default, pending operations live as long as the process)
 *  - remote (document service, see PendingOperationClient)
 */
@ApplicationScoped
public class CollaborationBeans {

    private static final Logger LOG = Logger.getLogger(CollaborationBeans.class);

    @ConfigProperty(name = "collab.presence.interval", defaultValue = "30s")
    Duration presenceInterval;

    @ConfigProperty(name = "collab.presence.inactive-threshold", defaultValue = "2m")
    Duration inactiveThreshold;

    @ConfigProperty(name = "collab.operations.batch-window", defaultValue = "100ms")
    Duration batchWindow;

    @ConfigProperty(name = "collab.storage.provider", defaultValue = "memory")
    String storageProvider;

    @Produces
    @Singleton
    CollaborationConfig collaborationConfig() {
        return new CollaborationConfig(presenceInterval, inactiveThreshold, batchWindow);
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    ScheduledExecutorService collaborationScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "collab-timers");
            t.setDaemon(true);
            return t;
        });
    }

    void shutdownScheduler(@Disposes ScheduledExecutorService scheduler) {
        scheduler.shutdownNow();
    }

    @Produces
    @Singleton
    PendingOperationStore pendingOperationStore(@RestClient Instance<PendingOperationClient> client) {
        String provider = storageProvider == null ? "memory" : storageProvider.trim().toLowerCase();
        return switch (provider) {
            case "remote" -> {
                LOG.info("Pending operations stored in the document service");
                yield new RemotePendingOperationStore(client.get());
            }
            case "memory" -> new InMemoryPendingOperationStore();
            default -> throw new IllegalStateException("Unknown collab.storage.provider: " + storageProvider);
        };
    }

    @Produces
    @Singleton
    @DefaultBean
    PermissionChecker permissionChecker() {
        return PermissionChecker.ALLOW_ALL;
    }
}
