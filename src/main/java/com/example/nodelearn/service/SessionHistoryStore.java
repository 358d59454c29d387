package com.example.nodelearn.service;

import com.example.nodelearn.error.InvalidSessionStateException;
import com.example.nodelearn.error.SessionNotFoundException;
import com.example.nodelearn.error.StoreUnavailableException;
import com.example.nodelearn.kv.KvClient;
import com.example.nodelearn.model.ArchiveEntry;
import com.example.nodelearn.model.SessionRecord;
import com.example.nodelearn.model.SessionSummary;
import com.example.nodelearn.repo.ArchiveEntryRepo;
import com.example.nodelearn.repo.SessionRecordRepo;
import com.example.nodelearn.store.StoreClient;
import com.example.nodelearn.topic.TopicNormalizer;
import com.example.nodelearn.tree.KnowledgeNode;
import com.example.nodelearn.tree.KnowledgeTree;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only archive of ended sessions.
 *
 * <p>MongoDB is the system of record for {@link SessionRecord}s and their {@link ArchiveEntry}
 * projections; Redis keeps recently written entries so a retried {@link #persist} is answered without
 * a store round trip. Persisting is idempotent per sessionId, so callers may retry after a
 * {@link StoreUnavailableException}.</p>
 */
@Service
public class SessionHistoryStore {

    private static final Logger logger = LoggerFactory.getLogger(SessionHistoryStore.class);
    private static final String CACHE_PREFIX = "archive:";

    private final SessionRecordRepo sessionRepo;
    private final ArchiveEntryRepo archiveRepo;
    private final StoreClient storeClient;
    private final KvClient kvClient;
    private final TopicNormalizer normalizer;
    private final ObjectMapper objectMapper;

    @Value("${app.history.cache-ttl-sec:3600}")
    private long cacheTtlSec;

    @Value("${app.history.page-size:20}")
    private int pageSize;

    public SessionHistoryStore(SessionRecordRepo sessionRepo, ArchiveEntryRepo archiveRepo, StoreClient storeClient,
                               KvClient kvClient, TopicNormalizer normalizer, ObjectMapper objectMapper) {
        this.sessionRepo = sessionRepo;
        this.archiveRepo = archiveRepo;
        this.storeClient = storeClient;
        this.kvClient = kvClient;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
    }

    /**
     * Archives an ended session. Persisting a session that is already archived returns the existing
     * entry and writes nothing.
     *
     * @throws InvalidSessionStateException if the session has not ended
     * @throws StoreUnavailableException    if the store cannot be reached; safe to retry
     */
    public ArchiveEntry persist(ExplorationSession session) {
        if (session.isActive()) {
            throw new InvalidSessionStateException("Session " + session.getSessionId() + " must end before it is persisted");
        }

        Optional<ArchiveEntry> existing = findEntry(session.getSessionId());
        if (existing.isPresent()) {
            logger.debug("Session {} already archived", session.getSessionId());
            return existing.get();
        }

        SessionRecord record = toRecord(session);
        ArchiveEntry entry = toEntry(session);
        try {
            // record first: a retry after a failed entry write rewrites the same record
            sessionRepo.save(record);
            archiveRepo.save(entry);
        } catch (DataAccessException e) {
            logger.error("Failed to persist session {}", session.getSessionId(), e);
            throw new StoreUnavailableException("Session store unavailable: " + e.getMessage(), e);
        }

        cache(entry);
        logger.info("Persisted session {} ({} nodes, {} terms)",
                session.getSessionId(), record.getNodeCount(), entry.getIndexedTerms().size());
        return entry;
    }

    /**
     * @throws SessionNotFoundException if no session with this id was archived
     */
    public SessionRecord get(String sessionId) {
        try {
            return sessionRepo.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException("Session not found: " + sessionId));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Session store unavailable: " + e.getMessage(), e);
        }
    }

    public Optional<ArchiveEntry> findEntry(String sessionId) {
        Optional<ArchiveEntry> cached = cached(sessionId);
        if (cached.isPresent()) {
            return cached;
        }
        try {
            Optional<ArchiveEntry> stored = archiveRepo.findById(sessionId);
            stored.ifPresent(this::cache);
            return stored;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Archive store unavailable: " + e.getMessage(), e);
        }
    }

    public List<ArchiveEntry> allEntries() {
        try {
            return archiveRepo.findAll();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Archive store unavailable: " + e.getMessage(), e);
        }
    }

    /**
     * An owner's archived sessions, most recent first. Pages are fetched lazily as the iteration
     * advances, and every call to {@code iterator()} starts again from the newest session.
     */
    public Iterable<SessionSummary> listByOwner(String ownerRef) {
        return () -> new SummaryIterator(ownerRef);
    }

    private SessionRecord toRecord(ExplorationSession session) {
        KnowledgeTree tree = session.getTree();
        String rootTopic = tree.getRootId() == null ? null : tree.getNode(tree.getRootId()).getTopic().getDisplay();
        return SessionRecord.builder()
                .sessionId(session.getSessionId())
                .ownerRef(session.getOwnerRef())
                .startedAt(toMillis(session.getStartedAt()))
                .endedAt(toMillis(session.getEndedAt()))
                .depth(session.getDepth() == null ? null : session.getDepth().name())
                .tree(tree.snapshot())
                .perNodeDwell(new LinkedHashMap<>(session.getPerNodeDwell()))
                .tags(new LinkedHashSet<>(session.getTags()))
                .rootTopic(rootTopic)
                .nodeCount(tree.size())
                .crossLinkCount(tree.crossLinkCount())
                .totalDwellMs(session.getTotalDwellMs())
                .build();
    }

    private ArchiveEntry toEntry(ExplorationSession session) {
        Set<String> terms = new LinkedHashSet<>();
        for (KnowledgeNode node : session.getTree().getNodes()) {
            terms.addAll(normalizer.tokenize(node.getTopic().getNormalized()));
        }
        return ArchiveEntry.builder()
                .sessionId(session.getSessionId())
                .ownerRef(session.getOwnerRef())
                .indexedTerms(terms)
                .tags(new LinkedHashSet<>(session.getTags()))
                .startedAt(toMillis(session.getStartedAt()))
                .build();
    }

    // MongoDB keeps millisecond precision; a retry reading the stored copy must see the same values
    private static Instant toMillis(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }

    private Optional<ArchiveEntry> cached(String sessionId) {
        String key = CACHE_PREFIX + sessionId;
        try {
            Optional<String> json = kvClient.get(key);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), ArchiveEntry.class));
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable cached archive entry {}", key);
            evict(key);
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("Archive cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void cache(ArchiveEntry entry) {
        String key = CACHE_PREFIX + entry.getSessionId();
        try {
            kvClient.set(key, objectMapper.writeValueAsString(entry), Duration.ofSeconds(cacheTtlSec));
        } catch (JsonProcessingException | RuntimeException e) {
            logger.warn("Archive cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private void evict(String key) {
        try {
            kvClient.del(key);
        } catch (RuntimeException e) {
            logger.warn("Archive cache evict failed for {}: {}", key, e.getMessage());
        }
    }

    private class SummaryIterator implements Iterator<SessionSummary> {
        private final String ownerRef;
        private List<SessionSummary> page = new ArrayList<>();
        private int indexInPage;
        private int offset;
        private boolean exhausted;

        SummaryIterator(String ownerRef) {
            this.ownerRef = ownerRef;
        }

        @Override
        public boolean hasNext() {
            if (indexInPage < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            fetchPage();
            return indexInPage < page.size();
        }

        @Override
        public SessionSummary next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.get(indexInPage++);
        }

        private void fetchPage() {
            try {
                page = storeClient.findSummariesByOwner(ownerRef, offset, pageSize);
            } catch (DataAccessException e) {
                throw new StoreUnavailableException("Session store unavailable: " + e.getMessage(), e);
            }
            indexInPage = 0;
            offset += page.size();
            if (page.size() < pageSize) {
                exhausted = true;
            }
        }
    }
}
