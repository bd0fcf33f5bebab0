package com.gorax.collab.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.gorax.collab.session.EditLock;
import com.gorax.collab.session.Presence;
import com.gorax.collab.session.SessionState;

import java.time.Instant;

public record ServerMessage(
    MessageType type,
    Object payload,
    Instant timestamp
) {
    public static ServerMessage sessionState(SessionState state) {
        return of(MessageType.USER_JOINED, new Payloads.UserJoined(state, null));
    }

    public static ServerMessage userJoined(Presence user) {
        return of(MessageType.USER_JOINED, new Payloads.UserJoined(null, user));
    }

    public static ServerMessage userLeft(String userId) {
        return of(MessageType.USER_LEFT, new Payloads.UserLeft(userId));
    }

    public static ServerMessage presenceUpdate(Presence presence) {
        return of(MessageType.PRESENCE_UPDATE,
            new Payloads.PresenceUpdate(presence.userId(), presence.cursor(), presence.selection()));
    }

    public static ServerMessage lockAcquired(EditLock lock) {
        return of(MessageType.LOCK_ACQUIRED, lock);
    }

    public static ServerMessage lockReleased(String elementId) {
        return of(MessageType.LOCK_RELEASED, new Payloads.LockReleased(elementId));
    }

    public static ServerMessage lockFailed(String elementId, String reason, EditLock currentLock) {
        return of(MessageType.LOCK_FAILED, new Payloads.LockFailed(elementId, reason, currentLock));
    }

    public static ServerMessage changeApplied(JsonNode change) {
        return of(MessageType.CHANGE_APPLIED, change);
    }

    public static ServerMessage error(String message) {
        return of(MessageType.ERROR, new Payloads.ErrorDetail(message));
    }

    private static ServerMessage of(MessageType type, Object payload) {
        return new ServerMessage(type, payload, Instant.now());
    }
}
