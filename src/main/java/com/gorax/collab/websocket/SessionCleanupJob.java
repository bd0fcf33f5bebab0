package com.gorax.collab.websocket;

import com.gorax.collab.config.CollaborationConfig;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Periodically evicts collaboration sessions nobody has touched for
 * {@code collab.session-idle-timeout} and nobody is connected to anymore.
 */
@ApplicationScoped
public class SessionCleanupJob {

    private static final Logger LOG = Logger.getLogger(SessionCleanupJob.class);

    @Inject
    CollaborationCoordinator coordinator;

    @Inject
    CollaborationConfig config;

    @Scheduled(every = "${collab.cleanup-interval:5m}")
    void cleanup() {
        int cleaned = coordinator.evictIdleSessions(config.sessionIdleTimeout());
        if (cleaned > 0) {
            LOG.infof("Cleaned up %d inactive collaboration sessions", cleaned);
        }
    }
}
