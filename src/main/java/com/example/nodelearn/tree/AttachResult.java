package com.example.nodelearn.tree;

import lombok.Value;

/**
 * Outcome of {@link KnowledgeTree#attachChild}: either a freshly created node, or a
 * reference to the node that already owns the topic elsewhere in the tree.
 */
@Value
public class AttachResult {
    String nodeId;
    boolean created;
    boolean crossLinked;

    static AttachResult created(String nodeId) {
        return new AttachResult(nodeId, true, false);
    }

    static AttachResult existing(String nodeId, boolean crossLinked) {
        return new AttachResult(nodeId, false, crossLinked);
    }
}
