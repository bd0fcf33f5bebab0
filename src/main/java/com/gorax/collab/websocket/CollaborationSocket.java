package com.gorax.collab.websocket;

import com.gorax.collab.config.CollaborationConfig;
import com.gorax.collab.security.AuthService;
import com.gorax.collab.transport.Connection;
import com.gorax.collab.websocket.CollaborationCoordinator.AdmissionRejectedException;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnPongMessage;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import io.vertx.core.buffer.Buffer;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * WebSocket endpoint for real-time collaborative editing of one workflow.
 * Requires JWT authentication - user and tenant identity are taken from the token.
 */
@WebSocket(path = "/api/v1/workflows/{id}/collaborate")
public class CollaborationSocket {

    private static final Logger LOG = Logger.getLogger(CollaborationSocket.class);

    @Inject
    CollaborationCoordinator coordinator;

    @Inject
    AuthService authService;

    @Inject
    CollaborationConfig config;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        if (!authService.isAuthenticated()) {
            LOG.warnf("Unauthenticated WebSocket connection attempt: %s", connection.id());
            connection.closeAndAwait(new CloseReason(Connection.CLOSE_POLICY_VIOLATION, "Authentication required"));
            return;
        }

        String workflowId = connection.pathParam("id");
        try {
            coordinator.connect(
                new WebSocketTransport(connection, config.writeTimeout()),
                authService.getTenantId(),
                authService.getCurrentUserId(),
                authService.getUserName(),
                workflowId
            );
        } catch (AdmissionRejectedException e) {
            connection.closeAndAwait(new CloseReason(e.closeCode(), e.getMessage()));
        }
    }

    @OnTextMessage
    public void onMessage(String message, WebSocketConnection connection) {
        // token could expire mid-session
        if (!authService.isAuthenticated()) {
            LOG.warnf("Authentication expired for connection: %s", connection.id());
            coordinator.disconnect(connection.id());
            connection.closeAndAwait(new CloseReason(Connection.CLOSE_POLICY_VIOLATION, "Authentication expired"));
            return;
        }
        coordinator.receive(connection.id(), message);
    }

    @OnPongMessage
    public void onPong(Buffer data, WebSocketConnection connection) {
        coordinator.pong(connection.id());
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        LOG.debugf("WebSocket closed: %s", connection.id());
        coordinator.disconnect(connection.id());
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.errorf("WebSocket error on %s: %s", connection.id(), t.getMessage());
        coordinator.disconnect(connection.id());
    }
}
