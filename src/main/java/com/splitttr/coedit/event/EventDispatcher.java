package com.splitttr.coedit.event;

import com.splitttr.coedit.bus.Subscription;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed listener registry. Handlers run on the thread that emits; a throwing
 * handler is logged and skipped.
 */
public class EventDispatcher {

    private static final Logger LOG = Logger.getLogger(EventDispatcher.class);

    private final Map<Class<?>, List<Consumer<CollaborationEvent>>> listeners = new ConcurrentHashMap<>();

    public <E extends CollaborationEvent> Subscription on(Class<E> eventType, Consumer<? super E> handler) {
        Consumer<CollaborationEvent> listener = event -> handler.accept(eventType.cast(event));
        List<Consumer<CollaborationEvent>> registered =
            listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
        registered.add(listener);
        return () -> registered.remove(listener);
    }

    public void emit(CollaborationEvent event) {
        deliver(listeners.get(event.getClass()), event);
        deliver(listeners.get(CollaborationEvent.class), event);
    }

    public void clear() {
        listeners.clear();
    }

    private void deliver(List<Consumer<CollaborationEvent>> registered, CollaborationEvent event) {
        if (registered == null) return;
        for (Consumer<CollaborationEvent> listener : registered) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Event handler failed on %s", event.getClass().getSimpleName());
            }
        }
    }
}
