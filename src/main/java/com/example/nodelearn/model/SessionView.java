package com.example.nodelearn.model;

import com.example.nodelearn.tree.TreeSnapshot;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * What a renderer needs to draw a session: the tree structure and per-node dwell time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionView {
    private String sessionId;
    private String ownerRef;
    private boolean active;
    private String focusedNodeId;
    private Instant startedAt;
    private Instant endedAt;
    private Set<String> tags;
    private TreeSnapshot tree;
    private Map<String, Long> perNodeDwell;
}
