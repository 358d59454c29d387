package com.example.nodelearn.service;

import com.example.nodelearn.suggest.ExplorationDepth;
import com.example.nodelearn.tree.KnowledgeTree;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One live exploration episode: the tree being grown, dwell totals and the focus state used by
 * {@link SessionTimer}. Becomes read-only once {@link #getEndedAt()} is set.
 *
 * <p>Two locks guard a session. {@code expansionLock} makes expansions single-flight and keeps
 * structural changes out while a provider call is pending. {@code stateLock} is taken for every
 * short read or write of the tree, dwell totals and focus state, so renderers and timer events can
 * run alongside a pending expansion.</p>
 */
@Getter
public class ExplorationSession {

    private final String sessionId;
    private final String ownerRef;
    private final Instant startedAt;
    private final ExplorationDepth depth;
    private final KnowledgeTree tree;
    private final Set<String> tags;
    private final Map<String, Long> perNodeDwell = new LinkedHashMap<>();
    // held for the whole provider call of an expansion
    private final ReentrantLock expansionLock = new ReentrantLock();
    // held briefly around every read or write of the tree and the timer state
    private final ReentrantLock stateLock = new ReentrantLock();

    private Instant endedAt;
    private String focusedNodeId;
    private Instant lastTransitionAt;
    private volatile Instant lastActivityAt;

    public ExplorationSession(String sessionId, String ownerRef, Instant startedAt, ExplorationDepth depth,
                              KnowledgeTree tree, Set<String> tags) {
        this.sessionId = sessionId;
        this.ownerRef = ownerRef;
        this.startedAt = startedAt;
        this.depth = depth;
        this.tree = tree;
        this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
        this.lastTransitionAt = startedAt;
        this.lastActivityAt = startedAt;
    }

    public boolean isActive() {
        return endedAt == null;
    }

    public boolean isFocused() {
        return focusedNodeId != null;
    }

    public Map<String, Long> getPerNodeDwell() {
        return Collections.unmodifiableMap(perNodeDwell);
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    public long getTotalDwellMs() {
        return perNodeDwell.values().stream().mapToLong(Long::longValue).sum();
    }

    void recordDwell(String nodeId, long millis) {
        perNodeDwell.merge(nodeId, millis, Long::sum);
    }

    void transition(String focusedNodeId, Instant at) {
        this.focusedNodeId = focusedNodeId;
        this.lastTransitionAt = at;
        touch(at);
    }

    void end(Instant at) {
        this.endedAt = at;
    }

    void touch(Instant at) {
        if (lastActivityAt == null || at.isAfter(lastActivityAt)) {
            lastActivityAt = at;
        }
    }
}
