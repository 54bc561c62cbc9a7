package com.splitttr.coedit.event;

import com.splitttr.coedit.bus.Subscription;
import com.splitttr.coedit.event.CollaborationEvent.Connected;
import com.splitttr.coedit.event.CollaborationEvent.Disconnected;
import com.splitttr.coedit.message.ResourceKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventDispatcherTest {

    private static final ResourceKey NOVEL = ResourceKey.of("novel", "42");

    private final EventDispatcher dispatcher = new EventDispatcher();

    @Test
    void typedListenersOnlySeeTheirKind() {
        List<ResourceKey> connected = new ArrayList<>();
        dispatcher.on(Connected.class, e -> connected.add(e.resource()));

        dispatcher.emit(new Connected(NOVEL));
        dispatcher.emit(new Disconnected(NOVEL));

        assertEquals(List.of(NOVEL), connected);
    }

    @Test
    void catchAllListenerSeesEverything() {
        List<CollaborationEvent> all = new ArrayList<>();
        dispatcher.on(CollaborationEvent.class, all::add);

        dispatcher.emit(new Connected(NOVEL));
        dispatcher.emit(new Disconnected(NOVEL));

        assertEquals(2, all.size());
    }

    @Test
    void throwingListenerIsSkipped() {
        List<CollaborationEvent> seen = new ArrayList<>();
        dispatcher.on(Connected.class, e -> { throw new RuntimeException("listener bug"); });
        dispatcher.on(Connected.class, seen::add);

        assertDoesNotThrow(() -> dispatcher.emit(new Connected(NOVEL)));
        assertEquals(1, seen.size());
    }

    @Test
    void unsubscribeAndClear() {
        List<CollaborationEvent> seen = new ArrayList<>();
        Subscription subscription = dispatcher.on(Connected.class, seen::add);
        dispatcher.on(Disconnected.class, seen::add);

        subscription.unsubscribe();
        dispatcher.emit(new Connected(NOVEL));
        dispatcher.clear();
        dispatcher.emit(new Disconnected(NOVEL));

        assertTrue(seen.isEmpty());
    }
}
