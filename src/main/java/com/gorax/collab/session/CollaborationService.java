package com.gorax.collab.session;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Authoritative presence and element-lock state for every workflow being edited.
 *
 * <p>Sessions are created by the first join and dropped when the last participant leaves.
 * Creation and removal go through {@link ConcurrentHashMap#compute}, so a join racing the
 * last leave of the same workflow never lands in a session that is already gone. All other
 * mutations run under the individual session's monitor.
 *
 * <p>This class does no I/O; callers turn its results into outbound events.
 */
@ApplicationScoped
public class CollaborationService {

    private static final Logger LOG = Logger.getLogger(CollaborationService.class);

    private final ConcurrentHashMap<String, CollaborationSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public CollaborationService() {
        this(Clock.systemUTC());
    }

    CollaborationService(Clock clock) {
        this.clock = clock;
    }

    public Presence joinSession(String workflowId, String userId, String userName) {
        Instant now = clock.instant();
        AtomicReference<Presence> joined = new AtomicReference<>();
        sessions.compute(workflowId, (id, session) -> {
            if (session == null) {
                LOG.debugf("Opening collaboration session for workflow %s", id);
                session = new CollaborationSession(id, now);
            }
            joined.set(session.join(userId, userName, now));
            return session;
        });
        return joined.get();
    }

    /**
     * Removes the participant and releases every lock they held.
     *
     * @return the released locks, in the order they were acquired
     * @throws NotFoundException if the session or the participant does not exist
     */
    public List<EditLock> leaveSession(String workflowId, String userId) {
        Instant now = clock.instant();
        AtomicReference<List<EditLock>> released = new AtomicReference<>();
        sessions.computeIfPresent(workflowId, (id, session) -> {
            released.set(session.leave(userId, now));
            if (session.isEmpty()) {
                LOG.debugf("Closing collaboration session for workflow %s", id);
                return null;
            }
            return session;
        });
        if (released.get() == null) {
            throw new NotFoundException("no collaboration session for workflow " + workflowId);
        }
        return released.get();
    }

    public SessionState getSession(String workflowId) {
        CollaborationSession session = sessions.get(workflowId);
        return session == null ? null : session.snapshot();
    }

    public Presence updatePresence(String workflowId, String userId, CursorPosition cursor, Selection selection) {
        return require(workflowId).updatePresence(userId, cursor, selection, clock.instant());
    }

    /**
     * Grants {@code userId} the lock on an element. Re-acquiring an owned lock refreshes its timestamp.
     *
     * @throws AlreadyLockedException if another participant holds the element
     * @throws NotFoundException if the session or the participant does not exist
     */
    public EditLock acquireLock(String workflowId, String userId, String elementId, ElementType elementType) {
        return require(workflowId).acquire(userId, elementId, elementType, clock.instant());
    }

    /**
     * @return true if a lock was removed, false if the element was not locked
     * @throws NotOwnerException if the element is locked by someone else
     */
    public boolean releaseLock(String workflowId, String userId, String elementId) {
        return require(workflowId).release(userId, elementId, clock.instant());
    }

    public List<Presence> activeUsers(String workflowId) {
        CollaborationSession session = sessions.get(workflowId);
        return session == null ? List.of() : session.participants();
    }

    public List<EditLock> activeLocks(String workflowId) {
        CollaborationSession session = sessions.get(workflowId);
        return session == null ? List.of() : session.locks();
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Drops sessions that have not changed for longer than {@code maxAge}, locks included.
     *
     * @return number of sessions removed
     */
    public int cleanupInactiveSessions(Duration maxAge) {
        return cleanupInactiveSessions(maxAge, workflowId -> false);
    }

    /**
     * Like {@link #cleanupInactiveSessions(Duration)}, but keeps every session for which
     * {@code inUse} holds. The predicate is evaluated while the session entry is locked.
     *
     * @return number of sessions removed
     */
    public int cleanupInactiveSessions(Duration maxAge, Predicate<String> inUse) {
        Instant cutoff = clock.instant().minus(maxAge);
        AtomicInteger removed = new AtomicInteger();
        for (String workflowId : sessions.keySet()) {
            sessions.computeIfPresent(workflowId, (id, session) -> {
                if (session.idleSince(cutoff) && !inUse.test(id)) {
                    LOG.debugf("Evicting idle collaboration session for workflow %s", id);
                    removed.incrementAndGet();
                    return null;
                }
                return session;
            });
        }
        return removed.get();
    }

    private CollaborationSession require(String workflowId) {
        CollaborationSession session = sessions.get(workflowId);
        if (session == null) {
            throw new NotFoundException("no collaboration session for workflow " + workflowId);
        }
        return session;
    }

    public static class NotFoundException extends RuntimeException {
        public NotFoundException(String message) {
            super(message);
        }
    }

    public static class AlreadyLockedException extends RuntimeException {
        private final EditLock currentLock;

        public AlreadyLockedException(EditLock currentLock) {
            super("element is locked by another user");
            this.currentLock = currentLock;
        }

        public EditLock currentLock() {
            return currentLock;
        }
    }

    public static class NotOwnerException extends RuntimeException {
        public NotOwnerException(String elementId, String ownerUserId) {
            super("lock on " + elementId + " is held by " + ownerUserId);
        }
    }
}
