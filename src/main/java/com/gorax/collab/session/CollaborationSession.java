package com.gorax.collab.session;

import com.gorax.collab.session.CollaborationService.AlreadyLockedException;
import com.gorax.collab.session.CollaborationService.NotFoundException;
import com.gorax.collab.session.CollaborationService.NotOwnerException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one workflow's session. Every method runs under the session monitor,
 * so a caller never observes a half-applied participant or lock change.
 */
final class CollaborationSession {

    private static final List<String> PALETTE = List.of(
        "#3B82F6", "#10B981", "#F59E0B", "#EF4444", "#8B5CF6",
        "#EC4899", "#14B8A6", "#F97316", "#6366F1", "#84CC16"
    );

    private final String workflowId;
    private final Instant createdAt;
    private final Map<String, Presence> participants = new LinkedHashMap<>();
    private final Map<String, EditLock> locks = new LinkedHashMap<>();
    private Instant updatedAt;
    private int nextColor;

    CollaborationSession(String workflowId, Instant createdAt) {
        this.workflowId = workflowId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    synchronized Presence join(String userId, String userName, Instant now) {
        Presence existing = participants.get(userId);
        Presence presence = existing != null
            ? existing.rename(userName, now)
            : new Presence(userId, userName, nextColor(), null, null, now, now);
        participants.put(userId, presence);
        updatedAt = now;
        return presence;
    }

    synchronized List<EditLock> leave(String userId, Instant now) {
        if (participants.remove(userId) == null) {
            throw new NotFoundException("user " + userId + " is not in session " + workflowId);
        }
        List<EditLock> released = new ArrayList<>();
        Iterator<EditLock> it = locks.values().iterator();
        while (it.hasNext()) {
            EditLock lock = it.next();
            if (lock.isOwnedBy(userId)) {
                released.add(lock);
                it.remove();
            }
        }
        updatedAt = now;
        return released;
    }

    synchronized Presence updatePresence(String userId, CursorPosition cursor, Selection selection, Instant now) {
        Presence presence = requireParticipant(userId).move(cursor, selection, now);
        participants.put(userId, presence);
        updatedAt = now;
        return presence;
    }

    synchronized EditLock acquire(String userId, String elementId, ElementType elementType, Instant now) {
        Presence owner = requireParticipant(userId);
        EditLock current = locks.get(elementId);
        if (current != null && !current.isOwnedBy(userId)) {
            throw new AlreadyLockedException(current);
        }
        EditLock lock = new EditLock(elementId, elementType, userId, owner.userName(), now);
        locks.put(elementId, lock);
        participants.put(userId, owner.move(null, null, now));
        updatedAt = now;
        return lock;
    }

    synchronized boolean release(String userId, String elementId, Instant now) {
        EditLock current = locks.get(elementId);
        if (current == null) {
            return false;
        }
        if (!current.isOwnedBy(userId)) {
            throw new NotOwnerException(elementId, current.ownerUserId());
        }
        locks.remove(elementId);
        updatedAt = now;
        return true;
    }

    synchronized boolean isEmpty() {
        return participants.isEmpty();
    }

    synchronized boolean idleSince(Instant cutoff) {
        return updatedAt.isBefore(cutoff);
    }

    synchronized SessionState snapshot() {
        return new SessionState(workflowId, participants, locks, createdAt, updatedAt);
    }

    synchronized List<Presence> participants() {
        return participants.values().stream()
            .sorted(Comparator.comparing(Presence::joinedAt))
            .toList();
    }

    synchronized List<EditLock> locks() {
        return locks.values().stream()
            .sorted(Comparator.comparing(EditLock::acquiredAt))
            .toList();
    }

    // caller holds the monitor
    private Presence requireParticipant(String userId) {
        Presence presence = participants.get(userId);
        if (presence == null) {
            throw new NotFoundException("user " + userId + " is not in session " + workflowId);
        }
        return presence;
    }

    private String nextColor() {
        return PALETTE.get(nextColor++ % PALETTE.size());
    }
}
