package com.gorax.collab.transport;

/**
 * The raw bidirectional channel under a {@link Connection}.
 *
 * <p>Send methods block until the frame is written and throw an unchecked exception when the
 * peer is gone. They are only ever called from the connection's write loop.
 */
public interface Transport {

    String id();

    void sendText(String text);

    void sendPing();

    void close(int code, String reason);
}
