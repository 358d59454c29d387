package com.example.nodelearn.service;

import com.example.nodelearn.error.NodeLearnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Ends and archives sessions nobody has touched for a while, so abandoned explorations still reach
 * the history.
 */
@Service
public class IdleSessionReaper {

    private static final Logger logger = LoggerFactory.getLogger(IdleSessionReaper.class);

    private final ExplorationService explorationService;
    private final Clock clock;

    @Value("${app.sessions.idle-timeout-ms:1800000}")
    private long idleTimeoutMs;

    public IdleSessionReaper(ExplorationService explorationService, Clock clock) {
        this.explorationService = explorationService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.sessions.reap-interval-ms:60000}", initialDelay = 60000L)
    public void run() {
        Instant cutoff = clock.instant().minusMillis(idleTimeoutMs);
        for (ExplorationSession session : explorationService.activeSessions()) {
            if (session.getLastActivityAt().isAfter(cutoff)) {
                continue;
            }
            try {
                explorationService.end(session.getSessionId());
                logger.info("Reaped idle session {}", session.getSessionId());
            } catch (NodeLearnException e) {
                // left registered, retried on the next run
                logger.warn("Could not reap session {}: {}", session.getSessionId(), e.getMessage());
            }
        }
    }
}
