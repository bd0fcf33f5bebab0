package com.gorax.collab.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gorax.collab.message.MessageCodec.MalformedMessageException;
import com.gorax.collab.message.Payloads.LockRequest;
import com.gorax.collab.session.EditLock;
import com.gorax.collab.session.ElementType;
import com.gorax.collab.session.Presence;
import com.gorax.collab.session.SessionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCodecTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void envelopeUsesWireFieldNamesAndRfc3339Timestamp() throws Exception {
        EditLock lock = new EditLock("node-1", ElementType.NODE, "user-1", "Alice",
            Instant.parse("2026-03-01T12:30:00Z"));

        JsonNode json = JSON.readTree(MessageCodec.encode(ServerMessage.lockAcquired(lock)));

        assertThat(json.fieldNames()).toIterable().containsExactlyInAnyOrder("type", "payload", "timestamp");
        assertThat(json.path("type").asText()).isEqualTo("lock_acquired");
        assertThat(Instant.parse(json.path("timestamp").asText())).isNotNull();
        assertThat(json.path("payload").path("elementId").asText()).isEqualTo("node-1");
        assertThat(json.path("payload").path("elementType").asText()).isEqualTo("node");
        assertThat(json.path("payload").path("ownerUserId").asText()).isEqualTo("user-1");
        assertThat(json.path("payload").path("acquiredAt").asText()).isEqualTo("2026-03-01T12:30:00Z");
    }

    @Test
    void lockFailedAlwaysCarriesCurrentLockField() throws Exception {
        JsonNode json = JSON.readTree(MessageCodec.encode(ServerMessage.lockFailed("node-1", "no session", null)));

        assertThat(json.path("payload").has("currentLock")).isTrue();
        assertThat(json.path("payload").path("currentLock").isNull()).isTrue();
        assertThat(json.path("payload").path("reason").asText()).isEqualTo("no session");
    }

    @Test
    void simplePayloadsCarryTheirFields() throws Exception {
        JsonNode json = JSON.readTree(MessageCodec.encode(ServerMessage.userLeft("user-1")));
        assertThat(json.path("payload").path("userId").asText()).isEqualTo("user-1");

        JsonNode error = JSON.readTree(MessageCodec.encode(ServerMessage.error("boom")));
        assertThat(error.path("type").asText()).isEqualTo("error");
        assertThat(error.path("payload").path("message").asText()).isEqualTo("boom");
    }

    @Test
    void userJoinedCarriesEitherSessionOrUser() throws Exception {
        SessionState state = new SessionState("wf-1", Map.of(), Map.of(),
            Instant.parse("2026-03-01T12:00:00Z"), Instant.parse("2026-03-01T12:00:00Z"));
        Presence bob = new Presence("user-2", "Bob", "#10B981", null, null,
            Instant.parse("2026-03-01T12:00:00Z"), Instant.parse("2026-03-01T12:00:00Z"));

        JsonNode toJoiner = JSON.readTree(MessageCodec.encode(ServerMessage.sessionState(state))).path("payload");
        JsonNode toOthers = JSON.readTree(MessageCodec.encode(ServerMessage.userJoined(bob))).path("payload");

        assertThat(toJoiner.has("session")).isTrue();
        assertThat(toJoiner.has("user")).isFalse();
        assertThat(toJoiner.path("session").path("workflowId").asText()).isEqualTo("wf-1");
        assertThat(toOthers.has("session")).isFalse();
        assertThat(toOthers.path("user").path("color").asText()).isEqualTo("#10B981");
    }

    @Test
    void decodeKeepsUnknownTypeAsText() {
        ClientMessage message = MessageCodec.decode("{\"type\":\"mystery\",\"payload\":{\"a\":1},\"extra\":true}");

        assertThat(message.type()).isEqualTo("mystery");
        assertThat(MessageType.fromWire(message.type())).isEmpty();
        assertThat(message.payload().path("a").asInt()).isEqualTo(1);
    }

    @Test
    void decodeRejectsNonEnvelopes() {
        assertThatThrownBy(() -> MessageCodec.decode("[1,2,3]")).isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> MessageCodec.decode("{\"payload\":{}}")).isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> MessageCodec.decode("null")).isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> MessageCodec.decode("{")).isInstanceOf(MalformedMessageException.class);
    }

    @Test
    void payloadAcceptsCamelAndSnakeCase() {
        ClientMessage camel = MessageCodec.decode(
            "{\"type\":\"lock_acquire\",\"payload\":{\"elementId\":\"n1\",\"elementType\":\"node\"}}");
        ClientMessage snake = MessageCodec.decode(
            "{\"type\":\"lock_acquire\",\"payload\":{\"element_id\":\"n1\",\"element_type\":\"node\"}}");

        assertThat(MessageCodec.payload(camel, LockRequest.class)).isEqualTo(new LockRequest("n1", "node"));
        assertThat(MessageCodec.payload(snake, LockRequest.class)).isEqualTo(new LockRequest("n1", "node"));
    }

    @Test
    void missingPayloadIsMalformed() {
        ClientMessage message = MessageCodec.decode("{\"type\":\"lock_acquire\"}");

        assertThatThrownBy(() -> MessageCodec.payload(message, LockRequest.class))
            .isInstanceOf(MalformedMessageException.class)
            .hasMessageContaining("lock_acquire");
    }
}
