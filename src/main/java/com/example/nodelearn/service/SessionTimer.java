package com.example.nodelearn.service;

import com.example.nodelearn.error.InvalidSessionStateException;
import com.example.nodelearn.error.InvalidTimestampException;
import com.example.nodelearn.tree.KnowledgeTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Dwell-time tracking with two states per session: Idle and Focused(node).
 *
 * <p>Every transition first flushes the time elapsed since the previous transition into the
 * focused node's totals, so the sum of {@code perNodeDwell} always equals the total Focused time.
 * Transitions must arrive in chronological order; an earlier timestamp is rejected and leaves the
 * totals untouched.</p>
 */
@Service
public class SessionTimer {

    private static final Logger logger = LoggerFactory.getLogger(SessionTimer.class);

    private final Clock clock;

    public SessionTimer(Clock clock) {
        this.clock = clock;
    }

    public void focus(ExplorationSession session, String nodeId) {
        focus(session, nodeId, clock.instant());
    }

    public void focus(ExplorationSession session, String nodeId, Instant at) {
        session.getStateLock().lock();
        try {
            requireActive(session);
            requireInOrder(session, at);
            session.getTree().getNode(nodeId);

            flush(session, at);
            session.transition(nodeId, at);
        } finally {
            session.getStateLock().unlock();
        }
        logger.debug("Session {} focused {} at {}", session.getSessionId(), nodeId, at);
    }

    public void blur(ExplorationSession session) {
        blur(session, clock.instant());
    }

    public void blur(ExplorationSession session, Instant at) {
        session.getStateLock().lock();
        try {
            requireActive(session);
            requireInOrder(session, at);

            flush(session, at);
            session.transition(null, at);
        } finally {
            session.getStateLock().unlock();
        }
        logger.debug("Session {} idle at {}", session.getSessionId(), at);
    }

    public void endSession(ExplorationSession session) {
        endSession(session, clock.instant());
    }

    /**
     * Flushes any open Focused interval and closes the session. Ending an already ended session is
     * a no-op.
     */
    public void endSession(ExplorationSession session, Instant at) {
        session.getStateLock().lock();
        try {
            if (!session.isActive()) {
                return;
            }
            requireInOrder(session, at);

            flush(session, at);
            session.transition(null, at);
            session.end(at);
        } finally {
            session.getStateLock().unlock();
        }
        logger.info("Session {} ended, total dwell {}ms", session.getSessionId(), session.getTotalDwellMs());
    }

    private void flush(ExplorationSession session, Instant at) {
        String focused = session.getFocusedNodeId();
        if (focused == null) {
            return;
        }
        // whole-millisecond boundaries, so consecutive intervals add up without rounding loss
        long elapsed = at.toEpochMilli() - session.getLastTransitionAt().toEpochMilli();
        session.recordDwell(focused, elapsed);

        // a node removed while focused keeps its share in perNodeDwell only
        KnowledgeTree tree = session.getTree();
        if (tree.contains(focused)) {
            tree.getNode(focused).addDwell(elapsed);
        }
    }

    private static void requireActive(ExplorationSession session) {
        if (!session.isActive()) {
            throw new InvalidSessionStateException("Session " + session.getSessionId() + " has ended");
        }
    }

    private static void requireInOrder(ExplorationSession session, Instant at) {
        if (at.isBefore(session.getLastTransitionAt())) {
            throw new InvalidTimestampException("Timestamp " + at + " is earlier than last transition "
                    + session.getLastTransitionAt() + " in session " + session.getSessionId());
        }
    }
}
