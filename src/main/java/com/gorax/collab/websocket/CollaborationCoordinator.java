package com.gorax.collab.websocket;

import com.gorax.collab.config.CollaborationConfig;
import com.gorax.collab.message.ClientMessage;
import com.gorax.collab.message.MessageCodec;
import com.gorax.collab.message.MessageCodec.MalformedMessageException;
import com.gorax.collab.message.MessageType;
import com.gorax.collab.message.Payloads.LockRequest;
import com.gorax.collab.message.Payloads.PresenceRequest;
import com.gorax.collab.message.ServerMessage;
import com.gorax.collab.session.CollaborationService;
import com.gorax.collab.session.CollaborationService.AlreadyLockedException;
import com.gorax.collab.session.CollaborationService.NotFoundException;
import com.gorax.collab.session.CollaborationService.NotOwnerException;
import com.gorax.collab.session.EditLock;
import com.gorax.collab.session.ElementType;
import com.gorax.collab.session.Presence;
import com.gorax.collab.session.SessionState;
import com.gorax.collab.transport.Connection;
import com.gorax.collab.transport.Transport;
import com.gorax.collab.transport.TransportHub;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds workflow collaboration sessions to hub rooms.
 *
 * <p>Each admitted connection joins the room {@code collaboration:<workflowId>}. Inbound
 * envelopes are decoded and dispatched to {@link CollaborationService}; the results are
 * fanned out through {@link TransportHub}. A user may hold several connections to one
 * workflow; when the last of them goes away the coordinator runs exactly the same teardown as
 * an explicit {@code leave}, at most once per connection.
 */
@ApplicationScoped
public class CollaborationCoordinator {

    private static final Logger LOG = Logger.getLogger(CollaborationCoordinator.class);

    static final String ROOM_PREFIX = "collaboration:";

    @Inject
    TransportHub hub;

    @Inject
    CollaborationService service;

    @Inject
    CollaborationConfig config;

    // serializes the ceiling check with registration
    private final Object admission = new Object();
    private final ConcurrentHashMap<String, Member> members = new ConcurrentHashMap<>();
    // open connections per workflow and user; join and leave for one user run under its entry
    private final ConcurrentHashMap<String, Integer> attachments = new ConcurrentHashMap<>();

    static final class Member {
        final Connection connection;
        final String workflowId;
        final String userId;
        final String userName;
        final String room;
        // guarded by this
        boolean departed;
        boolean attached;

        Member(Connection connection, String workflowId, String userId, String userName) {
            this.connection = connection;
            this.workflowId = workflowId;
            this.userId = userId;
            this.userName = userName;
            this.room = roomFor(workflowId);
        }
    }

    public static String roomFor(String workflowId) {
        return ROOM_PREFIX + workflowId;
    }

    /**
     * Admits an authenticated stream into a workflow's room and joins its session.
     *
     * @throws AdmissionRejectedException if the workflow id is malformed or the room is full;
     *     nothing has been registered in that case
     */
    public Connection connect(Transport transport, String tenantId, String userId, String userName, String workflowId) {
        if (!Identifiers.isValidId(workflowId)) {
            LOG.warnf("Invalid workflow id format %s from user %s", workflowId, userId);
            throw new AdmissionRejectedException(Connection.CLOSE_POLICY_VIOLATION, "invalid workflow_id format");
        }

        Connection connection = new Connection(tenantId, userId, transport, limits());
        Member member = new Member(connection, workflowId, userId, userName);

        synchronized (admission) {
            int current = hub.clientCount(member.room);
            if (current >= config.maxConnectionsPerWorkflow()) {
                LOG.warnf("Workflow %s connection limit exceeded (current %d, max %d)",
                    workflowId, current, config.maxConnectionsPerWorkflow());
                throw new AdmissionRejectedException(Connection.CLOSE_TRY_AGAIN_LATER,
                    "workflow connection limit exceeded");
            }
            members.put(connection.id(), member);
            connection.onInbound(frame -> dispatch(member, frame));
            connection.onClose(c -> disconnect(c.id()));
            hub.register(connection);
            hub.subscribe(connection, member.room);
        }

        LOG.infof("Collaboration connection established: workflow %s, user %s, connection %s",
            workflowId, userId, connection.id());

        synchronized (member) {
            if (!member.departed) {
                attach(member);
            }
        }
        return connection;
    }

    public void receive(String connectionId, String frame) {
        Member member = members.get(connectionId);
        if (member == null) {
            LOG.debugf("Frame for unknown connection %s ignored", connectionId);
            return;
        }
        member.connection.receive(frame);
    }

    public void pong(String connectionId) {
        Member member = members.get(connectionId);
        if (member != null) {
            member.connection.touch();
        }
    }

    /**
     * Tears a connection down. Safe to call from any thread, any number of times.
     */
    public void disconnect(String connectionId) {
        Member member = members.remove(connectionId);
        if (member == null) {
            return;
        }
        hub.unsubscribe(member.connection, member.room);
        hub.unregister(member.connection);
        member.connection.close(Connection.CLOSE_NORMAL, "disconnected");

        synchronized (member) {
            member.departed = true;
            if (member.attached) {
                detach(member);
            }
        }
        LOG.infof("Collaboration client disconnected: workflow %s, user %s, connection %s",
            member.workflowId, member.userId, connectionId);
    }

    public int connectionCount(String workflowId) {
        return hub.clientCount(roomFor(workflowId));
    }

    /**
     * Evicts sessions idle for longer than {@code maxAge} whose room has no subscribers left.
     * Sessions of rooms that still hold connections are kept, locks included.
     *
     * @return number of sessions removed
     */
    public int evictIdleSessions(Duration maxAge) {
        return service.cleanupInactiveSessions(maxAge, workflowId -> connectionCount(workflowId) > 0);
    }

    // caller holds the member monitor
    private void attach(Member member) {
        attachments.compute(attachmentKey(member), (key, open) -> {
            join(member);
            return open == null ? 1 : open + 1;
        });
        member.attached = true;
    }

    // caller holds the member monitor
    private void detach(Member member) {
        attachments.computeIfPresent(attachmentKey(member), (key, open) -> {
            if (open > 1) {
                LOG.debugf("User %s still has %d connections on workflow %s",
                    member.userId, open - 1, member.workflowId);
                return open - 1;
            }
            leave(member);
            return null;
        });
        member.attached = false;
    }

    private static String attachmentKey(Member member) {
        return member.workflowId + '\n' + member.userId;
    }

    private void dispatch(Member member, String frame) {
        synchronized (member) {
            if (member.departed) {
                return;
            }
            ClientMessage message;
            try {
                message = MessageCodec.decode(frame);
            } catch (MalformedMessageException e) {
                LOG.warnf("Failed to parse message from user %s: %s", member.userId, e.getMessage());
                sendError(member, "invalid message format");
                return;
            }

            Optional<MessageType> type = MessageType.fromWire(message.type());
            if (type.isEmpty()) {
                LOG.warnf("Unknown message type %s from user %s", message.type(), member.userId);
                sendError(member, "unknown message type");
                return;
            }

            try {
                switch (type.get()) {
                    case JOIN -> join(member);
                    case LEAVE -> leave(member);
                    case PRESENCE -> updatePresence(member, message);
                    case LOCK_ACQUIRE -> acquireLock(member, message);
                    case LOCK_RELEASE -> releaseLock(member, message);
                    case CHANGE -> forwardChange(member, message);
                    default -> {
                        LOG.warnf("Server-side message type %s sent by user %s", message.type(), member.userId);
                        sendError(member, "unknown message type");
                    }
                }
            } catch (MalformedMessageException e) {
                LOG.warnf("Bad %s payload from user %s: %s", message.type(), member.userId, e.getMessage());
                sendError(member, e.getMessage());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to handle %s from user %s on workflow %s",
                    message.type(), member.userId, member.workflowId);
                sendError(member, "internal error");
            }
        }
    }

    // caller holds the member monitor
    private void join(Member member) {
        Presence presence = service.joinSession(member.workflowId, member.userId, member.userName);

        SessionState state = service.getSession(member.workflowId);
        if (state != null) {
            member.connection.enqueue(MessageCodec.encode(ServerMessage.sessionState(state)));
        }
        hub.broadcastToOthers(member.room, member.userId, MessageCodec.encode(ServerMessage.userJoined(presence)));

        LOG.infof("User %s joined collaboration on workflow %s", member.userId, member.workflowId);
    }

    // caller holds the member monitor
    private void leave(Member member) {
        List<EditLock> released;
        try {
            released = service.leaveSession(member.workflowId, member.userId);
        } catch (NotFoundException e) {
            LOG.debugf("User %s already left workflow %s", member.userId, member.workflowId);
            return;
        }

        for (EditLock lock : released) {
            hub.broadcast(member.room, MessageCodec.encode(ServerMessage.lockReleased(lock.elementId())));
        }
        hub.broadcastToOthers(member.room, member.userId, MessageCodec.encode(ServerMessage.userLeft(member.userId)));

        LOG.infof("User %s left collaboration on workflow %s (%d locks released)",
            member.userId, member.workflowId, released.size());
    }

    private void updatePresence(Member member, ClientMessage message) {
        PresenceRequest request = MessageCodec.payload(message, PresenceRequest.class);
        Presence presence;
        try {
            presence = service.updatePresence(member.workflowId, member.userId, request.cursor(), request.selection());
        } catch (NotFoundException e) {
            LOG.warnf("Presence update rejected for user %s: %s", member.userId, e.getMessage());
            sendError(member, "not joined to a collaboration session");
            return;
        }
        hub.broadcastToOthers(member.room, member.userId, MessageCodec.encode(ServerMessage.presenceUpdate(presence)));
    }

    private void acquireLock(Member member, ClientMessage message) {
        LockRequest request = MessageCodec.payload(message, LockRequest.class);
        if (!Identifiers.isValidId(request.elementId())) {
            LOG.warnf("Invalid element id %s in lock request from user %s on workflow %s",
                request.elementId(), member.userId, member.workflowId);
            return;
        }
        Optional<ElementType> elementType = ElementType.fromWire(request.elementType());
        if (elementType.isEmpty()) {
            LOG.warnf("Invalid element type %s in lock request from user %s on workflow %s",
                request.elementType(), member.userId, member.workflowId);
            return;
        }

        EditLock lock;
        try {
            lock = service.acquireLock(member.workflowId, member.userId, request.elementId(), elementType.get());
        } catch (AlreadyLockedException e) {
            member.connection.enqueue(MessageCodec.encode(
                ServerMessage.lockFailed(request.elementId(), e.getMessage(), e.currentLock())));
            return;
        } catch (NotFoundException e) {
            member.connection.enqueue(MessageCodec.encode(
                ServerMessage.lockFailed(request.elementId(), e.getMessage(), null)));
            return;
        }

        hub.broadcast(member.room, MessageCodec.encode(ServerMessage.lockAcquired(lock)));
        LOG.infof("Lock acquired: workflow %s, user %s, element %s",
            member.workflowId, member.userId, request.elementId());
    }

    private void releaseLock(Member member, ClientMessage message) {
        LockRequest request = MessageCodec.payload(message, LockRequest.class);
        if (!Identifiers.isValidId(request.elementId())) {
            LOG.warnf("Invalid element id %s in lock release from user %s on workflow %s",
                request.elementId(), member.userId, member.workflowId);
            return;
        }

        boolean released;
        try {
            released = service.releaseLock(member.workflowId, member.userId, request.elementId());
        } catch (NotOwnerException | NotFoundException e) {
            LOG.warnf("Lock release by user %s on workflow %s refused: %s",
                member.userId, member.workflowId, e.getMessage());
            return;
        }
        if (!released) {
            LOG.debugf("Element %s on workflow %s was not locked", request.elementId(), member.workflowId);
            return;
        }

        hub.broadcast(member.room, MessageCodec.encode(ServerMessage.lockReleased(request.elementId())));
        LOG.infof("Lock released: workflow %s, user %s, element %s",
            member.workflowId, member.userId, request.elementId());
    }

    private void forwardChange(Member member, ClientMessage message) {
        hub.broadcastToOthers(member.room, member.userId, MessageCodec.encode(ServerMessage.changeApplied(message.payload())));
        LOG.debugf("Change broadcast: workflow %s, user %s", member.workflowId, member.userId);
    }

    private void sendError(Member member, String message) {
        if (!member.connection.enqueue(MessageCodec.encode(ServerMessage.error(message)))) {
            LOG.warnf("Failed to send error message to connection %s", member.connection.id());
        }
    }

    private Connection.Limits limits() {
        return new Connection.Limits(
            config.outboundQueueSize(),
            config.maxMessageSize(),
            config.pingInterval(),
            config.readTimeout()
        );
    }

    public static class AdmissionRejectedException extends RuntimeException {
        private final int closeCode;

        public AdmissionRejectedException(int closeCode, String reason) {
            super(reason);
            this.closeCode = closeCode;
        }

        public int closeCode() {
            return closeCode;
        }
    }
}
