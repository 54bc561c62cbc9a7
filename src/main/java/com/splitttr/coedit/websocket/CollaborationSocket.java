package com.splitttr.coedit.websocket;

import com.splitttr.coedit.bus.MessageBus;
import com.splitttr.coedit.bus.Subscription;
import com.splitttr.coedit.identity.Collaborator;
import com.splitttr.coedit.lock.ResourceLock;
import com.splitttr.coedit.message.CollaborationMessage;
import com.splitttr.coedit.message.MessageCodec;
import com.splitttr.coedit.message.MessageCodecException;
import com.splitttr.coedit.message.MessagePayloads.LeavePayload;
import com.splitttr.coedit.message.MessagePayloads.LockPayload;
import com.splitttr.coedit.message.MessagePayloads.UserPayload;
import com.splitttr.coedit.message.MessageType;
import com.splitttr.coedit.message.ResourceKey;
import com.splitttr.coedit.security.AuthService;
import io.quarkus.websockets.next.*;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * WebSocket relay onto the deployment's message bus, so sessions on other
 * devices share the channel with in-process sessions.
 * Requires JWT authentication - sender identity is taken from the token.
 */
@WebSocket(path = "/ws/collab")
public class CollaborationSocket {

    private static final Logger LOG = Logger.getLogger(CollaborationSocket.class);
    private static final MessageCodec codec = new MessageCodec();

    @Inject
    MessageBus bus;

    @Inject
    AuthService authService;

    @Inject
    Clock clock;

    // Store relay state externally since the socket instance may not persist
    private static final Map<String, RelayState> relays = new ConcurrentHashMap<>();

    record RelayState(String userId, Subscription subscription, AtomicReference<ResourceKey> joined) {}

    record RelayError(String error) {}

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        if (!authService.isAuthenticated()) {
            LOG.warnf("Unauthenticated WebSocket connection attempt: %s", connection.id());
            connection.closeAndAwait(new CloseReason(1008, "Authentication required"));
            return;
        }

        String userId = authService.getCurrentUserId();
        Subscription subscription = bus.subscribe(message -> forward(connection, userId, message));
        relays.put(connection.id(), new RelayState(userId, subscription, new AtomicReference<>()));
        LOG.infof("Relay opened: %s (user: %s)", connection.id(), userId);
    }

    @OnTextMessage
    public void onMessage(String messageJson, WebSocketConnection connection) {
        // token could expire mid-session
        if (!authService.isAuthenticated()) {
            LOG.warnf("Authentication expired for connection: %s", connection.id());
            connection.closeAndAwait(new CloseReason(1008, "Authentication expired"));
            return;
        }

        RelayState state = relays.get(connection.id());
        if (state == null) {
            sendError(connection, "Connection not registered");
            return;
        }

        String authenticatedUserId = authService.getCurrentUserId();
        if (!state.userId().equals(authenticatedUserId)) {
            LOG.warnf("User ID mismatch: relay=%s, auth=%s", state.userId(), authenticatedUserId);
            sendError(connection, "Authentication mismatch");
            return;
        }

        CollaborationMessage message;
        ResourceKey resource;
        try {
            message = codec.fromJson(messageJson);
            resource = message.resource();
            requireOwnIdentity(message, authenticatedUserId);
        } catch (MessageCodecException | IllegalArgumentException e) {
            LOG.debugf("Rejected frame from %s: %s", authenticatedUserId, e.getMessage());
            sendError(connection, e.getMessage());
            return;
        }

        // Never trust the sender the client claims
        CollaborationMessage relayed = authenticated(message, authenticatedUserId, resource);
        if (relayed.type() == MessageType.JOIN) {
            state.joined().set(resource);
        } else if (relayed.type() == MessageType.LEAVE) {
            state.joined().set(null);
        }

        LOG.debugf("Relaying %s from %s on %s", relayed.type(), authenticatedUserId, resource);
        bus.publish(relayed);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        LOG.debugf("WebSocket closed: %s", connection.id());
        release(connection);
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warnf("WebSocket error on %s: %s", connection.id(), t.getMessage());
        release(connection);
    }

    static int activeRelays() {
        return relays.size();
    }

    // payloads naming a user must name the token subject; leave is rebuilt instead
    private void requireOwnIdentity(CollaborationMessage message, String userId) {
        String claimed = switch (message.type()) {
            case JOIN, PRESENCE -> {
                Collaborator user = codec.payload(message, UserPayload.class).user();
                yield user == null ? null : user.userId();
            }
            case LOCK -> {
                ResourceLock lock = codec.payload(message, LockPayload.class).lock();
                yield lock == null ? null : lock.holderId();
            }
            default -> userId;
        };
        if (!userId.equals(claimed)) {
            throw new MessageCodecException(message.type() + " payload does not belong to " + userId, null);
        }
    }

    private CollaborationMessage authenticated(CollaborationMessage message, String userId, ResourceKey resource) {
        if (message.type() == MessageType.LEAVE) {
            // a client may only announce its own departure
            return codec.encode(MessageType.LEAVE, userId, resource, new LeavePayload(userId), clock.instant());
        }
        CollaborationMessage relayed = message.withSenderId(userId);
        if (relayed.timestamp() == null) {
            relayed = new CollaborationMessage(relayed.type(), userId, relayed.resourceType(),
                relayed.resourceId(), relayed.data(), clock.instant());
        }
        return relayed;
    }

    private void forward(WebSocketConnection connection, String userId, CollaborationMessage message) {
        if (userId.equals(message.senderId()) || !connection.isOpen()) return;
        connection.sendText(codec.toJson(message)).subscribe().with(
            ignored -> {},
            failure -> LOG.debugf("Relay to %s failed: %s", connection.id(), failure.getMessage()));
    }

    private void release(WebSocketConnection connection) {
        RelayState state = relays.remove(connection.id());
        if (state == null) return;

        state.subscription().unsubscribe();
        ResourceKey joined = state.joined().getAndSet(null);
        if (joined != null) {
            bus.publish(codec.encode(MessageType.LEAVE, state.userId(), joined,
                new LeavePayload(state.userId()), clock.instant()));
        }
    }

    private void sendError(WebSocketConnection conn, String message) {
        try {
            conn.sendTextAndAwait(codec.toJson(new RelayError(message)));
        } catch (RuntimeException e) {
            LOG.debugf("Could not deliver error to %s: %s", conn.id(), e.getMessage());
        }
    }
}
