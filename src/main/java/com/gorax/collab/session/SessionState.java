package com.gorax.collab.session;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of a session, sent to clients joining late.
 */
public record SessionState(
    String workflowId,
    Map<String, Presence> participants,
    Map<String, EditLock> locks,
    Instant createdAt,
    Instant updatedAt
) {
    public SessionState {
        participants = Map.copyOf(participants);
        locks = Map.copyOf(locks);
    }
}
