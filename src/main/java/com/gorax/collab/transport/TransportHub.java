package com.gorax.collab.transport;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Process-wide registry of live connections grouped into named rooms.
 *
 * <p>The hub knows nothing about collaboration; rooms are plain names such as
 * {@code collaboration:<workflowId>} or {@code execution:<executionId>}. Fan-out goes through
 * {@link Connection#enqueue}, so a slow subscriber loses messages instead of stalling the sender.
 */
@ApplicationScoped
public class TransportHub {

    private static final Logger LOG = Logger.getLogger(TransportHub.class);

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<Connection>> rooms = new ConcurrentHashMap<>();
    private final ExecutorService writers = Executors.newCachedThreadPool(new WriterThreadFactory());

    /**
     * Adds the connection to the registry and starts its write loop.
     */
    public void register(Connection connection) {
        if (connections.putIfAbsent(connection.id(), connection) != null) {
            return;
        }
        connection.start(writers);
        LOG.debugf("Registered connection %s (tenant %s, user %s)",
            connection.id(), connection.tenantId(), connection.userId());
    }

    public void unregister(Connection connection) {
        if (!connections.remove(connection.id(), connection)) {
            return;
        }
        for (String room : connection.rooms()) {
            unsubscribe(connection, room);
        }
        LOG.debugf("Unregistered connection %s", connection.id());
    }

    /**
     * @return false if the connection is not registered
     */
    public boolean subscribe(Connection connection, String room) {
        AtomicBoolean subscribed = new AtomicBoolean();
        // runs under the registry entry, so a concurrent unregister sees the room afterwards
        connections.computeIfPresent(connection.id(), (id, registered) -> {
            if (registered == connection && !connection.isClosed()) {
                rooms.compute(room, (name, members) -> {
                    Set<Connection> target = members != null ? members : ConcurrentHashMap.newKeySet();
                    target.add(connection);
                    return target;
                });
                connection.joinRoom(room);
                subscribed.set(true);
            }
            return registered;
        });
        if (!subscribed.get()) {
            LOG.warnf("Ignoring subscription of unregistered connection %s to %s", connection.id(), room);
        }
        return subscribed.get();
    }

    public void unsubscribe(Connection connection, String room) {
        rooms.computeIfPresent(room, (name, members) -> {
            members.remove(connection);
            return members.isEmpty() ? null : members;
        });
        connection.leaveRoom(room);
    }

    public int broadcast(String room, String message) {
        return deliver(room, message, c -> true);
    }

    public int broadcastToUser(String room, String userId, String message) {
        return deliver(room, message, c -> userId.equals(c.userId()));
    }

    public int broadcastToOthers(String room, String excludeUserId, String message) {
        return deliver(room, message, c -> !excludeUserId.equals(c.userId()));
    }

    public int broadcastToTenant(String tenantId, String message) {
        int delivered = 0;
        for (Connection connection : connections.values()) {
            if (tenantId.equals(connection.tenantId()) && connection.enqueue(message)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int clientCount(String room) {
        Set<Connection> members = rooms.get(room);
        return members == null ? 0 : members.size();
    }

    public int roomCount() {
        return rooms.size();
    }

    public int connectionCount() {
        return connections.size();
    }

    public Connection connection(String connectionId) {
        return connections.get(connectionId);
    }

    @PreDestroy
    public void shutdown() {
        for (Connection connection : connections.values()) {
            connection.close(Connection.CLOSE_GOING_AWAY, "server shutting down");
        }
        writers.shutdownNow();
    }

    private int deliver(String room, String message, Predicate<Connection> filter) {
        Set<Connection> members = rooms.get(room);
        if (members == null) {
            return 0;
        }
        int delivered = 0;
        for (Connection connection : members) {
            if (filter.test(connection) && connection.enqueue(message)) {
                delivered++;
            }
        }
        return delivered;
    }

    private static final class WriterThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "collab-writer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
