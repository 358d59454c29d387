package com.example.nodelearn.service;

import com.example.nodelearn.archive.ArchiveSearch;
import com.example.nodelearn.document.DocumentParser;
import com.example.nodelearn.error.ExpansionInProgressException;
import com.example.nodelearn.error.InvalidSessionStateException;
import com.example.nodelearn.error.SessionNotFoundException;
import com.example.nodelearn.model.ArchiveEntry;
import com.example.nodelearn.model.OwnerStats;
import com.example.nodelearn.model.SessionRecord;
import com.example.nodelearn.model.SessionSummary;
import com.example.nodelearn.model.SessionView;
import com.example.nodelearn.suggest.ExplorationDepth;
import com.example.nodelearn.topic.Topic;
import com.example.nodelearn.topic.TopicNormalizer;
import com.example.nodelearn.tree.KnowledgeTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Entry point for the application layer: owns the live sessions and routes each call to the tree,
 * the merger, the timer and the archive.
 */
@Service
public class ExplorationService {

    private static final Logger logger = LoggerFactory.getLogger(ExplorationService.class);

    private final TopicNormalizer normalizer;
    private final SuggestionMerger suggestionMerger;
    private final SessionTimer sessionTimer;
    private final SessionHistoryStore historyStore;
    private final ArchiveSearch archiveSearch;
    private final DocumentParser documentParser;
    private final LearningStats learningStats;
    private final Clock clock;
    private final Map<String, ExplorationSession> sessions = new ConcurrentHashMap<>();

    public ExplorationService(TopicNormalizer normalizer, SuggestionMerger suggestionMerger, SessionTimer sessionTimer,
                              SessionHistoryStore historyStore, ArchiveSearch archiveSearch,
                              DocumentParser documentParser, LearningStats learningStats, Clock clock) {
        this.normalizer = normalizer;
        this.suggestionMerger = suggestionMerger;
        this.sessionTimer = sessionTimer;
        this.historyStore = historyStore;
        this.archiveSearch = archiveSearch;
        this.documentParser = documentParser;
        this.learningStats = learningStats;
        this.clock = clock;
    }

    public ExplorationSession start(String ownerRef, String seedTopic, Set<String> tags, ExplorationDepth depth) {
        KnowledgeTree tree = new KnowledgeTree(normalizer, clock);
        tree.createRoot(seedTopic);
        return register(ownerRef, tree, tags, depth);
    }

    /**
     * Starts a session from an uploaded document: the first seed topic becomes the root and the
     * others its children.
     */
    public ExplorationSession startFromDocument(String ownerRef, byte[] document, String mimeType,
                                                Set<String> tags, ExplorationDepth depth) {
        Iterator<String> seeds = documentParser.extractSeedTopics(document, mimeType).iterator();
        KnowledgeTree tree = new KnowledgeTree(normalizer, clock);
        String rootId = tree.createRoot(seeds.next());
        while (seeds.hasNext()) {
            tree.attachChild(rootId, seeds.next());
        }
        return register(ownerRef, tree, tags, depth);
    }

    /**
     * Opens a new live session whose tree continues from an archived one.
     */
    public ExplorationSession resume(String archivedSessionId) {
        SessionRecord record = historyStore.get(archivedSessionId);
        KnowledgeTree tree = KnowledgeTree.fromSnapshot(record.getTree(), normalizer, clock);
        ExplorationDepth depth = record.getDepth() == null ? null : ExplorationDepth.valueOf(record.getDepth());
        ExplorationSession session = register(record.getOwnerRef(), tree, record.getTags(), depth);
        logger.info("Session {} resumes archived session {}", session.getSessionId(), archivedSessionId);
        return session;
    }

    public ExplorationSession get(String sessionId) {
        ExplorationSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException("No active session: " + sessionId);
        }
        return session;
    }

    public Collection<ExplorationSession> activeSessions() {
        return new ArrayList<>(sessions.values());
    }

    public List<Topic> expand(String sessionId, String nodeId) {
        return suggestionMerger.expand(get(sessionId), nodeId);
    }

    /**
     * @return Markdown explanation of the node's topic; the tree is not changed
     */
    public String explain(String sessionId, String nodeId) {
        return suggestionMerger.explain(requireActive(get(sessionId)), nodeId);
    }

    public void focus(String sessionId, String nodeId) {
        sessionTimer.focus(get(sessionId), nodeId);
    }

    public void blur(String sessionId) {
        sessionTimer.blur(get(sessionId));
    }

    public List<String> removeSubtree(String sessionId, String nodeId) {
        ExplorationSession session = requireActive(get(sessionId));
        return exclusively(session, () -> underStateLock(session, () -> session.getTree().removeSubtree(nodeId)));
    }

    public String reset(String sessionId, String rawTopic) {
        ExplorationSession session = requireActive(get(sessionId));
        // an invalid topic must leave focus and the tree as they were
        normalizer.normalize(rawTopic);
        return exclusively(session, () -> underStateLock(session, () -> {
            if (session.isFocused()) {
                sessionTimer.blur(session);
            }
            return session.getTree().reset(rawTopic);
        }));
    }

    public SessionView view(String sessionId) {
        ExplorationSession session = get(sessionId);
        return underStateLock(session, () -> SessionView.builder()
                .sessionId(session.getSessionId())
                .ownerRef(session.getOwnerRef())
                .active(session.isActive())
                .focusedNodeId(session.getFocusedNodeId())
                .startedAt(session.getStartedAt())
                .endedAt(session.getEndedAt())
                .tags(session.getTags())
                .tree(session.getTree().snapshot())
                .perNodeDwell(new LinkedHashMap<>(session.getPerNodeDwell()))
                .build());
    }

    /**
     * Closes the session, archives it and makes it searchable. If the store is unavailable the
     * session stays registered, closed, and calling {@code end} again retries the archiving.
     */
    public ArchiveEntry end(String sessionId) {
        ExplorationSession session = get(sessionId);
        ArchiveEntry entry = exclusively(session, () -> {
            sessionTimer.endSession(session);
            return historyStore.persist(session);
        });
        archiveSearch.index(entry);
        sessions.remove(sessionId);
        logger.info("Session {} archived", sessionId);
        return entry;
    }

    public SessionRecord archived(String sessionId) {
        return historyStore.get(sessionId);
    }

    public List<String> search(String query, Set<String> tags) {
        return archiveSearch.search(query, tags);
    }

    public Iterable<SessionSummary> listByOwner(String ownerRef) {
        return historyStore.listByOwner(ownerRef);
    }

    public OwnerStats ownerStats(String ownerRef) {
        return learningStats.forOwner(ownerRef);
    }

    private ExplorationSession register(String ownerRef, KnowledgeTree tree, Set<String> tags, ExplorationDepth depth) {
        ExplorationSession session = new ExplorationSession(
                UUID.randomUUID().toString(), ownerRef, clock.instant(), depth, tree, tags);
        sessions.put(session.getSessionId(), session);
        logger.info("Session {} started for {} on '{}'", session.getSessionId(), ownerRef,
                tree.getNode(tree.getRootId()).getTopic().getDisplay());
        return session;
    }

    private static ExplorationSession requireActive(ExplorationSession session) {
        if (!session.isActive()) {
            throw new InvalidSessionStateException("Session " + session.getSessionId() + " has ended");
        }
        return session;
    }

    private static <T> T underStateLock(ExplorationSession session, Supplier<T> action) {
        session.getStateLock().lock();
        try {
            return action.get();
        } finally {
            session.getStateLock().unlock();
        }
    }

    // Structural changes must not interleave with a running expansion.
    private static <T> T exclusively(ExplorationSession session, Supplier<T> action) {
        if (!session.getExpansionLock().tryLock()) {
            throw new ExpansionInProgressException("An expansion is running in session " + session.getSessionId());
        }
        try {
            return action.get();
        } finally {
            session.getExpansionLock().unlock();
        }
    }
}
