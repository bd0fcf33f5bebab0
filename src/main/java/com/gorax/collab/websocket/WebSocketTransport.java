package com.gorax.collab.websocket;

import com.gorax.collab.transport.Transport;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import io.vertx.core.buffer.Buffer;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * {@link Transport} over a Quarkus WebSocket connection. Writes block the calling write loop
 * for at most the configured write timeout.
 */
class WebSocketTransport implements Transport {

    private static final Logger LOG = Logger.getLogger(WebSocketTransport.class);

    private final WebSocketConnection connection;
    private final Duration writeTimeout;

    WebSocketTransport(WebSocketConnection connection, Duration writeTimeout) {
        this.connection = connection;
        this.writeTimeout = writeTimeout;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public void sendText(String text) {
        connection.sendText(text).await().atMost(writeTimeout);
    }

    @Override
    public void sendPing() {
        connection.sendPing(Buffer.buffer()).await().atMost(writeTimeout);
    }

    @Override
    public void close(int code, String reason) {
        if (!connection.isOpen()) {
            return;
        }
        // may run on an event loop thread, so never await here
        connection.close(new CloseReason(code, reason)).subscribe().with(
            ignored -> {},
            failure -> LOG.debugf(failure, "Closing WebSocket %s failed", connection.id()));
    }
}
