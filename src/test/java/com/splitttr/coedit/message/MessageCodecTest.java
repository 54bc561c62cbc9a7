package com.splitttr.coedit.message;

import com.splitttr.coedit.identity.Collaborator;
import com.splitttr.coedit.identity.Identity;
import com.splitttr.coedit.message.MessagePayloads.CursorPayload;
import com.splitttr.coedit.message.MessagePayloads.OperationsPayload;
import com.splitttr.coedit.message.MessagePayloads.UserPayload;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final ResourceKey NOVEL = ResourceKey.of("novel", "42");

    private final MessageCodec codec = new MessageCodec();

    @Test
    void encodesTypeAndTimestampOnTheWire() {
        CollaborationMessage message = codec.encode(MessageType.CURSOR_MOVE, "alice", NOVEL,
            new CursorPayload(CursorPosition.at("42", 3, 17)), NOW);

        String json = codec.toJson(message);

        assertTrue(json.contains("\"type\":\"cursor_move\""), json);
        assertTrue(json.contains("\"timestamp\":" + NOW.toEpochMilli()), json);
        assertTrue(json.contains("\"paragraphIndex\":3"), json);
    }

    @Test
    void parsesClientFrame() {
        String json = """
            {"type":"cursor_move","senderId":"bob","resourceType":"novel","resourceId":"42",
             "data":{"cursor":{"documentId":"42","paragraphIndex":1,"offset":5}},
             "timestamp":1772359200000,"extra":"ignored"}
            """;

        CollaborationMessage message = codec.fromJson(json);

        assertEquals(MessageType.CURSOR_MOVE, message.type());
        assertEquals("bob", message.senderId());
        assertEquals(NOVEL, message.resource());
        assertEquals(Instant.ofEpochMilli(1772359200000L), message.timestamp());
        assertEquals(CursorPosition.at("42", 1, 5), codec.payload(message, CursorPayload.class).cursor());
    }

    @Test
    void operationsKeepPayloadAndVersion() {
        CollaborationOperation op = new CollaborationOperation("op_1_abc123", OperationType.FORMAT, "alice",
            "novel", "42", CursorPosition.at("42", 0, 0),
            OperationPayload.formatting(5, Map.of("bold", true)), NOW, 7);

        CollaborationMessage decoded = codec.fromJson(codec.toJson(
            codec.encode(MessageType.OPERATION, "alice", NOVEL, new OperationsPayload(List.of(op)), NOW)));

        List<CollaborationOperation> operations = codec.payload(decoded, OperationsPayload.class).operations();
        assertEquals(List.of(op), operations);
        assertEquals(Boolean.TRUE, operations.get(0).payload().format().get("bold"));
    }

    @Test
    void collaboratorOmitsUnsetFields() {
        Collaborator alice = Collaborator.of(Identity.of("alice", "Alice"), NOW);

        String json = codec.toJson(new UserPayload(alice));

        assertFalse(json.contains("cursor"), json);
        assertFalse(json.contains("avatarRef"), json);
        assertTrue(json.contains("\"color\":\"" + alice.color() + "\""), json);
    }

    @Test
    void rejectsGarbageAndIncompleteEnvelopes() {
        assertThrows(MessageCodecException.class, () -> codec.fromJson("not json"));
        assertThrows(MessageCodecException.class,
            () -> codec.fromJson("{\"type\":\"join\",\"senderId\":\"bob\",\"resourceId\":\"42\"}"));
        assertThrows(MessageCodecException.class,
            () -> codec.fromJson("{\"type\":\"teleport\",\"resourceType\":\"novel\",\"resourceId\":\"42\"}"));
    }

    @Test
    void missingDataIsACodecError() {
        CollaborationMessage empty = new CollaborationMessage(MessageType.CURSOR_MOVE, "bob", "novel", "42", null, NOW);

        assertThrows(MessageCodecException.class, () -> codec.payload(empty, CursorPayload.class));
    }
}
