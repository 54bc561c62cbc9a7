package com.splitttr.coedit.bus;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.splitttr.coedit.message.CollaborationMessage;
import com.splitttr.coedit.message.MessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalMessageBusTest {

    private LocalMessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new LocalMessageBus();
    }

    private static CollaborationMessage message(String sender) {
        return new CollaborationMessage(MessageType.PRESENCE, sender, "novel", "42",
            JsonNodeFactory.instance.objectNode(), Instant.EPOCH);
    }

    @Test
    void deliversToEverySubscriberInOrder() {
        List<String> seen = new ArrayList<>();
        bus.subscribe(m -> seen.add("first:" + m.senderId()));
        bus.subscribe(m -> seen.add("second:" + m.senderId()));

        bus.publish(message("alice"));

        assertEquals(List.of("first:alice", "second:alice"), seen);
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() {
        List<CollaborationMessage> seen = new ArrayList<>();
        bus.subscribe(m -> { throw new IllegalStateException("boom"); });
        bus.subscribe(seen::add);

        assertDoesNotThrow(() -> bus.publish(message("alice")));
        assertEquals(1, seen.size());
    }

    @Test
    void unsubscribeStopsDeliveryAndIsIdempotent() {
        List<CollaborationMessage> seen = new ArrayList<>();
        Subscription subscription = bus.subscribe(seen::add);

        subscription.unsubscribe();
        subscription.unsubscribe();
        bus.publish(message("alice"));

        assertTrue(seen.isEmpty());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void sameHandlerTwiceIsTwoSubscriptions() {
        List<CollaborationMessage> seen = new ArrayList<>();
        java.util.function.Consumer<CollaborationMessage> handler = seen::add;
        Subscription first = bus.subscribe(handler);
        bus.subscribe(handler);

        first.close();
        bus.publish(message("alice"));

        assertEquals(1, seen.size());
    }
}
