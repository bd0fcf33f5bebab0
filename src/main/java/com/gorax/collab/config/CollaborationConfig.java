package com.gorax.collab.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Limits and timers for workflow collaboration.
 *
 * <p>Configure via application.properties:
 * <pre>
 * collab.max-connections-per-workflow=50
 * collab.max-message-size=524288
 * collab.ping-interval=54s
 * </pre>
 */
@ConfigMapping(prefix = "collab")
public interface CollaborationConfig {

    /**
     * Connections admitted to one workflow room before new ones are turned away.
     */
    @WithDefault("50")
    int maxConnectionsPerWorkflow();

    /**
     * Largest inbound frame, in bytes.
     */
    @WithDefault("524288")
    long maxMessageSize();

    /**
     * Outbound messages buffered per connection before new ones are dropped.
     */
    @WithDefault("256")
    int outboundQueueSize();

    @WithDefault("54s")
    Duration pingInterval();

    /**
     * A connection with no inbound frame or pong for this long is closed.
     */
    @WithDefault("60s")
    Duration readTimeout();

    @WithDefault("10s")
    Duration writeTimeout();

    /**
     * Sessions with no activity for this long are evicted by the cleanup job.
     */
    @WithDefault("30m")
    Duration sessionIdleTimeout();
}
