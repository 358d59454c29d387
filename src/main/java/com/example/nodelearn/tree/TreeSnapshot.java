package com.example.nodelearn.tree;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only structural copy of a {@link KnowledgeTree}, handed to renderers and stored with
 * archived sessions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TreeSnapshot {
    private String rootId;
    private long nextSequence;
    private List<NodeSnapshot> nodes;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class NodeSnapshot {
        private String id;
        private String topic;
        private String normalizedTopic;
        private String parentId;
        private List<String> childIds;
        private List<String> crossLinks;
        private String relation;
        private Instant createdAt;
        private long cumulativeDwellMs;
        // normalized topic -> when it was first offered
        private Map<String, Instant> suggestionsSeen;
    }
}
