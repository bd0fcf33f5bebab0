package com.gorax.collab.session;

import java.time.Instant;

/**
 * A participant's live state inside a collaboration session.
 * Instances are immutable; the session swaps in a new record on every update.
 */
public record Presence(
    String userId,
    String userName,
    String color,
    CursorPosition cursor,
    Selection selection,
    Instant joinedAt,
    Instant lastSeen
) {
    Presence rename(String newName, Instant now) {
        return new Presence(userId, newName, color, cursor, selection, joinedAt, now);
    }

    Presence move(CursorPosition newCursor, Selection newSelection, Instant now) {
        return new Presence(
            userId,
            userName,
            color,
            newCursor != null ? newCursor : cursor,
            newSelection != null ? newSelection : selection,
            joinedAt,
            now
        );
    }
}
