package com.gorax.collab.message;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.gorax.collab.session.CursorPosition;
import com.gorax.collab.session.EditLock;
import com.gorax.collab.session.Presence;
import com.gorax.collab.session.Selection;
import com.gorax.collab.session.SessionState;

/**
 * Payload shapes carried inside the envelope, one record per message type.
 */
public final class Payloads {

    private Payloads() {}

    // client -> server

    public record LockRequest(
        @JsonAlias("element_id") String elementId,
        @JsonAlias("element_type") String elementType
    ) {}

    public record PresenceRequest(CursorPosition cursor, Selection selection) {}

    // server -> client

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UserJoined(SessionState session, Presence user) {}

    public record UserLeft(String userId) {}

    public record PresenceUpdate(String userId, CursorPosition cursor, Selection selection) {}

    public record LockReleased(String elementId) {}

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record LockFailed(String elementId, String reason, EditLock currentLock) {}

    public record ErrorDetail(String message) {}
}
