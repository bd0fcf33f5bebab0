package com.gorax.collab.websocket;

import com.gorax.collab.config.CollaborationConfig;

import java.time.Duration;

record TestConfig(int maxConnectionsPerWorkflow, long maxMessageSize, int outboundQueueSize)
    implements CollaborationConfig {

    static TestConfig defaults() {
        return new TestConfig(50, 64 * 1024, 256);
    }

    @Override
    public Duration pingInterval() {
        return Duration.ofSeconds(30);
    }

    @Override
    public Duration readTimeout() {
        return Duration.ofSeconds(60);
    }

    @Override
    public Duration writeTimeout() {
        return Duration.ofSeconds(10);
    }

    @Override
    public Duration sessionIdleTimeout() {
        return Duration.ofMinutes(30);
    }
}
