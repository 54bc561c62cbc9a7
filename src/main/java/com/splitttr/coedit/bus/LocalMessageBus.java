package com.splitttr.coedit.bus;

import com.splitttr.coedit.message.CollaborationMessage;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process channel. Messages are delivered synchronously on the publishing
 * thread, in subscription order. Remote clients reach it through the
 * WebSocket relay.
 */
@ApplicationScoped
public class LocalMessageBus implements MessageBus {

    private static final Logger LOG = Logger.getLogger(LocalMessageBus.class);

    private final List<Consumer<CollaborationMessage>> handlers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(CollaborationMessage message) {
        LOG.debugf("Publishing %s from %s on %s:%s to %d subscribers",
            message.type(), message.senderId(), message.resourceType(), message.resourceId(), handlers.size());
        for (Consumer<CollaborationMessage> handler : handlers) {
            try {
                handler.accept(message);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Subscriber failed on %s message", message.type());
            }
        }
    }

    @Override
    public Subscription subscribe(Consumer<CollaborationMessage> handler) {
        // one registration per call, even for the same handler
        Consumer<CollaborationMessage> registration = handler::accept;
        handlers.add(registration);
        return () -> handlers.remove(registration);
    }

    public int subscriberCount() {
        return handlers.size();
    }
}
