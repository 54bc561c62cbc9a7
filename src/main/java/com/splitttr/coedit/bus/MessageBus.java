package com.splitttr.coedit.bus;

import com.splitttr.coedit.message.CollaborationMessage;

import java.util.function.Consumer;

/**
 * Deployment-wide publish/subscribe channel. Delivery is best-effort and
 * at-most-once; subscribers must tolerate reordering and loss. Every
 * subscriber sees every message, including its own, so filtering by sender and
 * resource is the subscriber's job.
 */
public interface MessageBus {

    void publish(CollaborationMessage message);

    Subscription subscribe(Consumer<CollaborationMessage> handler);
}
