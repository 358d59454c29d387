package com.example.nodelearn.tree;

import com.example.nodelearn.error.CycleException;
import com.example.nodelearn.error.NodeNotFoundException;
import com.example.nodelearn.error.ParentNotFoundException;
import com.example.nodelearn.error.RootRemovalException;
import com.example.nodelearn.error.TreeAlreadyInitializedException;
import com.example.nodelearn.topic.Topic;
import com.example.nodelearn.topic.TopicNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arena of {@link KnowledgeNode}s indexed by id.
 *
 * <p>A concept appears at most once in the whole tree: {@code topicIndex} maps each normalized
 * topic to the single node that owns it. Attaching an already-present topic under another parent
 * records a cross-link on that parent instead of creating a duplicate. Ownership flows strictly from
 * parent to children, so the structure stays acyclic and every non-root node has exactly one parent.</p>
 *
 * <p>Not thread-safe; callers serialize access per session.</p>
 */
public class KnowledgeTree {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeTree.class);

    private final TopicNormalizer normalizer;
    private final Clock clock;
    private final Map<String, KnowledgeNode> nodesById = new LinkedHashMap<>();
    private final Map<String, String> topicIndex = new HashMap<>();
    private String rootId;
    private long sequence;

    public KnowledgeTree(TopicNormalizer normalizer, Clock clock) {
        this.normalizer = normalizer;
        this.clock = clock;
    }

    public String createRoot(String rawTopic) {
        if (rootId != null) {
            throw new TreeAlreadyInitializedException("Tree already has root " + rootId);
        }
        Topic topic = normalizer.normalize(rawTopic);
        KnowledgeNode root = newNode(topic, null, null);
        rootId = root.getId();
        logger.debug("Created root {} for topic '{}'", rootId, topic.getDisplay());
        return rootId;
    }

    public AttachResult attachChild(String parentId, String rawTopic) {
        return attachChild(parentId, rawTopic, null);
    }

    /**
     * Attaches {@code rawTopic} under {@code parentId}. When the topic already exists anywhere in
     * the tree the existing node is returned and, unless it is already owned by this parent, a
     * cross-link is recorded on the parent.
     *
     * @param relation optional description of how the child relates to the parent
     * @throws ParentNotFoundException if the parent is unknown
     * @throws CycleException          if the topic equals the parent's or one of its ancestors' topic
     */
    public AttachResult attachChild(String parentId, String rawTopic, String relation) {
        Topic topic = normalizer.normalize(rawTopic);
        KnowledgeNode parent = nodesById.get(parentId);
        if (parent == null) {
            throw new ParentNotFoundException("Parent node not found: " + parentId);
        }
        if (isOnPathToRoot(parentId, topic)) {
            throw new CycleException("Topic '" + topic.getDisplay() + "' is already an ancestor of " + parentId);
        }

        String existingId = topicIndex.get(topic.getNormalized());
        if (existingId != null) {
            KnowledgeNode existing = nodesById.get(existingId);
            if (parentId.equals(existing.getParentId())) {
                return AttachResult.existing(existingId, false);
            }
            parent.mutableCrossLinks().add(existingId);
            logger.debug("Cross-linked {} -> existing {} ('{}')", parentId, existingId, topic.getDisplay());
            return AttachResult.existing(existingId, true);
        }

        KnowledgeNode child = newNode(topic, parentId, relation);
        parent.mutableChildren().add(child.getId());
        logger.debug("Attached {} ('{}') under {}", child.getId(), topic.getDisplay(), parentId);
        return AttachResult.created(child.getId());
    }

    /**
     * Deletes the node and every node it owns, and drops cross-links that pointed into the removed
     * subtree.
     *
     * @return ids of the removed nodes, the subtree root first
     */
    public List<String> removeSubtree(String nodeId) {
        KnowledgeNode node = getNode(nodeId);
        if (node.isRoot()) {
            throw new RootRemovalException("The root can only be replaced through reset");
        }

        List<String> removed = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(nodeId);
        while (!pending.isEmpty()) {
            String id = pending.pollFirst();
            KnowledgeNode current = nodesById.get(id);
            removed.add(id);
            current.getChildren().forEach(pending::addLast);
        }

        for (String id : removed) {
            KnowledgeNode gone = nodesById.remove(id);
            topicIndex.remove(gone.getTopic().getNormalized());
        }
        nodesById.get(node.getParentId()).mutableChildren().remove(nodeId);
        for (KnowledgeNode remaining : nodesById.values()) {
            remaining.mutableCrossLinks().removeAll(removed);
        }

        logger.debug("Removed subtree {} ({} nodes)", nodeId, removed.size());
        return removed;
    }

    /**
     * Topics from the root down to {@code nodeId}, both included.
     */
    public List<Topic> pathTo(String nodeId) {
        KnowledgeNode node = getNode(nodeId);
        List<Topic> path = new ArrayList<>();
        while (node != null) {
            path.add(node.getTopic());
            node = node.getParentId() == null ? null : nodesById.get(node.getParentId());
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Number of edges between the root and {@code nodeId}.
     */
    public int depthOf(String nodeId) {
        return pathTo(nodeId).size() - 1;
    }

    /**
     * Discards the whole tree and starts over from a new root. Node ids keep increasing so ids of the
     * discarded tree are never reused.
     */
    public String reset(String rawTopic) {
        normalizer.normalize(rawTopic);
        logger.debug("Resetting tree ({} nodes discarded)", nodesById.size());
        nodesById.clear();
        topicIndex.clear();
        rootId = null;
        return createRoot(rawTopic);
    }

    /**
     * Whether {@code topic} equals the topic of {@code nodeId} or of any of its ancestors.
     */
    public boolean isOnPathToRoot(String nodeId, Topic topic) {
        KnowledgeNode current = nodesById.get(nodeId);
        while (current != null) {
            if (current.getTopic().equals(topic)) {
                return true;
            }
            current = current.getParentId() == null ? null : nodesById.get(current.getParentId());
        }
        return false;
    }

    public Optional<String> findByTopic(Topic topic) {
        return Optional.ofNullable(topicIndex.get(topic.getNormalized()));
    }

    public boolean contains(String nodeId) {
        return nodesById.containsKey(nodeId);
    }

    public KnowledgeNode getNode(String nodeId) {
        KnowledgeNode node = nodesById.get(nodeId);
        if (node == null) {
            throw new NodeNotFoundException("Node not found: " + nodeId);
        }
        return node;
    }

    public Collection<KnowledgeNode> getNodes() {
        return Collections.unmodifiableCollection(nodesById.values());
    }

    public String getRootId() {
        return rootId;
    }

    public int size() {
        return nodesById.size();
    }

    public int crossLinkCount() {
        return nodesById.values().stream().mapToInt(n -> n.getCrossLinks().size()).sum();
    }

    /**
     * Removes a cross-link recorded by {@link #attachChild}. Used to roll back a partially applied
     * batch.
     */
    public void unlinkCrossLink(String parentId, String targetId) {
        KnowledgeNode parent = nodesById.get(parentId);
        if (parent != null) {
            parent.mutableCrossLinks().remove(targetId);
        }
    }

    public TreeSnapshot snapshot() {
        List<TreeSnapshot.NodeSnapshot> nodes = new ArrayList<>(nodesById.size());
        for (KnowledgeNode node : nodesById.values()) {
            nodes.add(TreeSnapshot.NodeSnapshot.builder()
                    .id(node.getId())
                    .topic(node.getTopic().getDisplay())
                    .normalizedTopic(node.getTopic().getNormalized())
                    .parentId(node.getParentId())
                    .childIds(List.copyOf(node.getChildren()))
                    .crossLinks(List.copyOf(node.getCrossLinks()))
                    .relation(node.getRelation())
                    .createdAt(node.getCreatedAt())
                    .cumulativeDwellMs(node.getCumulativeDwellMs())
                    .suggestionsSeen(new LinkedHashMap<>(node.getSuggestionsSeen()))
                    .build());
        }
        return TreeSnapshot.builder()
                .rootId(rootId)
                .nextSequence(sequence)
                .nodes(nodes)
                .build();
    }

    /**
     * Rebuilds a live tree from a snapshot, keeping node ids, structure, dwell totals and the time
     * each suggestion was first offered. Node
     * topics are normalized again, so snapshots written by an older normalizer are re-keyed.
     */
    public static KnowledgeTree fromSnapshot(TreeSnapshot snapshot, TopicNormalizer normalizer, Clock clock) {
        KnowledgeTree tree = new KnowledgeTree(normalizer, clock);
        Instant now = clock.instant();
        for (TreeSnapshot.NodeSnapshot ns : snapshot.getNodes()) {
            Topic topic = normalizer.normalize(ns.getTopic());
            KnowledgeNode node = new KnowledgeNode(ns.getId(), topic, ns.getParentId(),
                    ns.getCreatedAt() != null ? ns.getCreatedAt() : now, ns.getRelation());
            node.mutableChildren().addAll(ns.getChildIds() != null ? ns.getChildIds() : List.of());
            node.mutableCrossLinks().addAll(ns.getCrossLinks() != null ? ns.getCrossLinks() : List.of());
            if (ns.getSuggestionsSeen() != null) {
                ns.getSuggestionsSeen().forEach((seen, at) -> node.markSeen(seen, at != null ? at : now));
            }
            node.restoreDwell(ns.getCumulativeDwellMs());
            tree.nodesById.put(node.getId(), node);
            tree.topicIndex.put(topic.getNormalized(), node.getId());
        }
        tree.rootId = snapshot.getRootId();
        tree.sequence = snapshot.getNextSequence();
        return tree;
    }

    private KnowledgeNode newNode(Topic topic, String parentId, String relation) {
        String id = "n" + (++sequence);
        KnowledgeNode node = new KnowledgeNode(id, topic, parentId, clock.instant(), relation);
        nodesById.put(id, node);
        topicIndex.put(topic.getNormalized(), id);
        return node;
    }
}
