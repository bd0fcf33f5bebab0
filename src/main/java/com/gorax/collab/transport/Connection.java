package com.gorax.collab.transport;

import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One authenticated client stream with a bounded outbound queue and its own write loop.
 *
 * <p>Delivery is at-most-once: {@link #enqueue} never blocks, and a message that does not fit
 * in the queue is dropped for this client only.
 */
public class Connection {

    private static final Logger LOG = Logger.getLogger(Connection.class);

    public static final int CLOSE_NORMAL = 1000;
    public static final int CLOSE_GOING_AWAY = 1001;
    public static final int CLOSE_POLICY_VIOLATION = 1008;
    public static final int CLOSE_TOO_BIG = 1009;
    public static final int CLOSE_TRY_AGAIN_LATER = 1013;

    public record Limits(int queueCapacity, long maxMessageSize, Duration pingInterval, Duration readTimeout) {}

    private final String id;
    private final String tenantId;
    private final String userId;
    private final Transport transport;
    private final Limits limits;
    private final BlockingQueue<String> outbound;
    private final Set<String> rooms = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();

    private volatile long lastReadNanos = System.nanoTime();
    private volatile Thread writer;
    private volatile Consumer<String> inboundHandler = frame -> {};
    private volatile Consumer<Connection> closeListener = c -> {};

    public Connection(String tenantId, String userId, Transport transport, Limits limits) {
        this.id = transport.id();
        this.tenantId = tenantId;
        this.userId = userId;
        this.transport = transport;
        this.limits = limits;
        this.outbound = new ArrayBlockingQueue<>(limits.queueCapacity());
    }

    public String id() {
        return id;
    }

    public String tenantId() {
        return tenantId;
    }

    public String userId() {
        return userId;
    }

    public Set<String> rooms() {
        return Collections.unmodifiableSet(rooms);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public void onInbound(Consumer<String> handler) {
        this.inboundHandler = handler;
    }

    public void onClose(Consumer<Connection> listener) {
        this.closeListener = listener;
    }

    /**
     * Queues a message without blocking.
     *
     * @return false if the connection is closed or its queue is full
     */
    public boolean enqueue(String message) {
        if (closed.get()) {
            return false;
        }
        if (!outbound.offer(message)) {
            long total = dropped.incrementAndGet();
            LOG.warnf("Outbound queue full for connection %s (user %s), dropped message (%d dropped so far)",
                id, userId, total);
            return false;
        }
        return true;
    }

    /**
     * Entry point for every inbound text frame. Oversized frames close the connection.
     */
    public void receive(String frame) {
        if (closed.get()) {
            return;
        }
        long size = frame.getBytes(StandardCharsets.UTF_8).length;
        if (size > limits.maxMessageSize()) {
            LOG.warnf("Connection %s sent a %d byte frame (limit %d), closing", id, size, limits.maxMessageSize());
            close(CLOSE_TOO_BIG, "message too big");
            return;
        }
        touch();
        inboundHandler.accept(frame);
    }

    /**
     * Records liveness, called for pongs and accepted frames.
     */
    public void touch() {
        lastReadNanos = System.nanoTime();
    }

    void start(Executor executor) {
        executor.execute(this::writeLoop);
    }

    /**
     * Closes the transport and stops the write loop. Only the first call has any effect.
     */
    public void close(int code, String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            transport.close(code, reason);
        } catch (RuntimeException e) {
            LOG.debugf(e, "Closing transport of connection %s failed", id);
        }
        Thread w = writer;
        if (w != null && w != Thread.currentThread()) {
            w.interrupt();
        }
        outbound.clear();
        try {
            closeListener.accept(this);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Close listener failed for connection %s", id);
        }
    }

    void joinRoom(String room) {
        rooms.add(room);
    }

    void leaveRoom(String room) {
        rooms.remove(room);
    }

    private void writeLoop() {
        writer = Thread.currentThread();
        long pingNanos = limits.pingInterval().toNanos();
        long readTimeoutNanos = limits.readTimeout().toNanos();
        long nextPing = System.nanoTime() + pingNanos;
        try {
            while (!closed.get()) {
                long wait = nextPing - System.nanoTime();
                String first = wait > 0 ? outbound.poll(wait, TimeUnit.NANOSECONDS) : null;
                if (closed.get()) {
                    return;
                }
                if (first != null) {
                    transport.sendText(coalesce(first));
                    continue;
                }
                if (System.nanoTime() - lastReadNanos > readTimeoutNanos) {
                    LOG.infof("Connection %s missed its read deadline, closing", id);
                    close(CLOSE_GOING_AWAY, "read timeout");
                    return;
                }
                transport.sendPing();
                nextPing = System.nanoTime() + pingNanos;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (!closed.get()) {
                LOG.debugf(e, "Write to connection %s failed", id);
            }
        } finally {
            writer = null;
            close(CLOSE_GOING_AWAY, "write loop stopped");
        }
    }

    // joins everything queued behind the first message into one frame
    private String coalesce(String first) {
        int pending = outbound.size();
        if (pending == 0) {
            return first;
        }
        StringBuilder frame = new StringBuilder(first);
        for (int i = 0; i < pending; i++) {
            String next = outbound.poll();
            if (next == null) {
                break;
            }
            frame.append('\n').append(next);
        }
        return frame.toString();
    }
}
