package com.example.nodelearn.tree;

import com.example.nodelearn.topic.Topic;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One explored concept. Owned by the {@link KnowledgeTree} that created it; the parent is
 * held as an id and is only used for path reconstruction and ancestor checks.
 */
@Getter
public class KnowledgeNode {

    private final String id;
    private final Topic topic;
    private final String parentId;
    private final Instant createdAt;
    private final String relation;
    private final List<String> children = new ArrayList<>();
    private final Set<String> crossLinks = new LinkedHashSet<>();
    // normalized topic -> when it was first offered for this node
    private final Map<String, Instant> suggestionsSeen = new LinkedHashMap<>();
    private long cumulativeDwellMs;

    KnowledgeNode(String id, Topic topic, String parentId, Instant createdAt, String relation) {
        this.id = id;
        this.topic = topic;
        this.parentId = parentId;
        this.createdAt = createdAt;
        this.relation = relation;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public List<String> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Set<String> getCrossLinks() {
        return Collections.unmodifiableSet(crossLinks);
    }

    public Map<String, Instant> getSuggestionsSeen() {
        return Collections.unmodifiableMap(suggestionsSeen);
    }

    /**
     * Whether {@code normalizedTopic} was already offered for this node and is still within
     * {@code retentionCutoff} ({@code null} means seen entries never expire).
     */
    public boolean hasSeen(String normalizedTopic, Instant retentionCutoff) {
        Instant seenAt = suggestionsSeen.get(normalizedTopic);
        if (seenAt == null) {
            return false;
        }
        return retentionCutoff == null || !seenAt.isBefore(retentionCutoff);
    }

    public void markSeen(String normalizedTopic, Instant at) {
        suggestionsSeen.put(normalizedTopic, at);
    }

    public void addDwell(long millis) {
        cumulativeDwellMs += millis;
    }

    List<String> mutableChildren() {
        return children;
    }

    Set<String> mutableCrossLinks() {
        return crossLinks;
    }

    void restoreDwell(long millis) {
        this.cumulativeDwellMs = millis;
    }
}
