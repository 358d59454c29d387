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
import com.example.nodelearn.suggest.ExplorationDepth;
import com.example.nodelearn.topic.TopicNormalizer;
import com.example.nodelearn.tree.KnowledgeTree;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionHistoryStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private SessionRecordRepo sessionRepo;

    @Mock
    private ArchiveEntryRepo archiveRepo;

    @Mock
    private StoreClient storeClient;

    @Mock
    private KvClient kvClient;

    private final TopicNormalizer normalizer = new TopicNormalizer();
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private SessionHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new SessionHistoryStore(sessionRepo, archiveRepo, storeClient, kvClient, normalizer, objectMapper);
        ReflectionTestUtils.setField(store, "cacheTtlSec", 600L);
        ReflectionTestUtils.setField(store, "pageSize", 2);
    }

    @Test
    void testPersist_WritesRecordAndEntry() {
        // Given
        ExplorationSession session = endedSession("s-1");

        // When
        ArchiveEntry entry = store.persist(session);

        // Then
        ArgumentCaptor<SessionRecord> recordCaptor = ArgumentCaptor.forClass(SessionRecord.class);
        verify(sessionRepo).save(recordCaptor.capture());
        verify(archiveRepo).save(entry);
        SessionRecord record = recordCaptor.getValue();
        assertEquals("s-1", record.getSessionId());
        assertEquals("Photosynthesis", record.getRootTopic());
        assertEquals(3, record.getNodeCount());
        assertEquals("STANDARD", record.getDepth());
        assertEquals(30_000L, record.getTotalDwellMs());
        assertEquals(3, record.getTree().getNodes().size());

        assertEquals("alice", entry.getOwnerRef());
        assertEquals(Set.of("photosynthesis", "calvin", "cycle", "light-dependent", "reactions"), entry.getIndexedTerms());
        assertEquals(Set.of("biology"), entry.getTags());
        verify(kvClient).set(eq("archive:s-1"), anyString(), eq(Duration.ofSeconds(600)));
    }

    @Test
    void testPersist_Twice_ReturnsEqualEntryWithoutRewriting() throws Exception {
        // Given
        ExplorationSession session = endedSession("s-1");
        ArchiveEntry first = store.persist(session);
        ArgumentCaptor<String> cached = ArgumentCaptor.forClass(String.class);
        verify(kvClient).set(eq("archive:s-1"), cached.capture(), any(Duration.class));
        when(kvClient.get("archive:s-1")).thenReturn(Optional.of(cached.getValue()));

        // When
        ArchiveEntry second = store.persist(session);

        // Then
        assertEquals(first, second);
        verify(sessionRepo, times(1)).save(any(SessionRecord.class));
        verify(archiveRepo, times(1)).save(any(ArchiveEntry.class));
    }

    @Test
    void testPersist_AlreadyStoredButNotCached_ReturnsStoredEntry() {
        // Given
        ArchiveEntry stored = ArchiveEntry.builder().sessionId("s-1").ownerRef("alice").build();
        when(archiveRepo.findById("s-1")).thenReturn(Optional.of(stored));

        // When
        ArchiveEntry entry = store.persist(endedSession("s-1"));

        // Then
        assertSame(stored, entry);
        verify(sessionRepo, never()).save(any(SessionRecord.class));
        verify(kvClient).set(eq("archive:s-1"), anyString(), any(Duration.class));
    }

    @Test
    void testPersist_RetryAfterCacheMiss_EqualsFirstResult() {
        // Given: a start time with sub-millisecond digits, which the store keeps only to the millisecond
        ExplorationSession session = endedSession("s-1", T0.plusNanos(123_456));
        ArchiveEntry first = store.persist(session);
        ArchiveEntry stored = ArchiveEntry.builder()
                .sessionId(first.getSessionId())
                .ownerRef(first.getOwnerRef())
                .indexedTerms(first.getIndexedTerms())
                .tags(first.getTags())
                .startedAt(first.getStartedAt().truncatedTo(ChronoUnit.MILLIS))
                .build();
        when(archiveRepo.findById("s-1")).thenReturn(Optional.of(stored));

        // When
        ArchiveEntry second = store.persist(session);

        // Then
        assertEquals(first, second);
        assertEquals(T0, first.getStartedAt());
        verify(archiveRepo, times(1)).save(any(ArchiveEntry.class));
    }

    @Test
    void testPersist_StoreDown_ThrowsRetryableError() {
        // Given
        when(sessionRepo.save(any(SessionRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When / Then
        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> store.persist(endedSession("s-1")));
        assertTrue(e.isRetryable());
        verify(archiveRepo, never()).save(any(ArchiveEntry.class));
        verify(kvClient, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void testPersist_CacheFailure_DoesNotFailPersist() {
        doThrow(new IllegalStateException("redis down")).when(kvClient).set(anyString(), anyString(), any(Duration.class));

        ArchiveEntry entry = store.persist(endedSession("s-1"));

        assertEquals("s-1", entry.getSessionId());
    }

    @Test
    void testPersist_UnreadableCacheEntry_IsEvicted() {
        when(kvClient.get("archive:s-1")).thenReturn(Optional.of("{not json"));

        store.persist(endedSession("s-1"));

        verify(kvClient).del("archive:s-1");
        verify(sessionRepo).save(any(SessionRecord.class));
    }

    @Test
    void testPersist_ActiveSession_IsRejected() {
        ExplorationSession active = session("s-1");

        assertThrows(InvalidSessionStateException.class, () -> store.persist(active));

        verifyNoInteractions(sessionRepo, archiveRepo, kvClient);
    }

    @Test
    void testGet_UnknownSession_Throws() {
        when(sessionRepo.findById("missing")).thenReturn(Optional.empty());

        assertThrows(SessionNotFoundException.class, () -> store.get("missing"));
    }

    @Test
    void testListByOwner_FetchesPagesLazilyAndRestarts() {
        // Given
        when(storeClient.findSummariesByOwner("alice", 0, 2)).thenReturn(List.of(summary("a"), summary("b")));
        when(storeClient.findSummariesByOwner("alice", 2, 2)).thenReturn(List.of(summary("c"), summary("d")));
        when(storeClient.findSummariesByOwner("alice", 4, 2)).thenReturn(List.of(summary("e")));

        // When
        Iterable<SessionSummary> history = store.listByOwner("alice");
        verifyNoInteractions(storeClient);
        Iterator<SessionSummary> partial = history.iterator();
        partial.next();
        verify(storeClient, times(1)).findSummariesByOwner(anyString(), anyInt(), anyInt());

        // Then
        assertEquals(List.of("a", "b", "c", "d", "e"), ids(history));
        assertEquals(List.of("a", "b", "c", "d", "e"), ids(history));
        verify(storeClient, times(3)).findSummariesByOwner("alice", 0, 2);
        verify(storeClient, times(2)).findSummariesByOwner("alice", 4, 2);
    }

    @Test
    void testListByOwner_FullLastPage_EndsOnEmptyPage() {
        when(storeClient.findSummariesByOwner("bob", 0, 2)).thenReturn(List.of(summary("a"), summary("b")));
        when(storeClient.findSummariesByOwner("bob", 2, 2)).thenReturn(List.of());

        assertEquals(List.of("a", "b"), ids(store.listByOwner("bob")));
    }

    @Test
    void testListByOwner_NoHistory_IsEmpty() {
        assertFalse(store.listByOwner("nobody").iterator().hasNext());
    }

    @Test
    void testListByOwner_StoreDown_Throws() {
        when(storeClient.findSummariesByOwner("alice", 0, 2))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        Iterator<SessionSummary> it = store.listByOwner("alice").iterator();

        assertThrows(StoreUnavailableException.class, it::hasNext);
    }

    private ExplorationSession session(String id) {
        return session(id, T0);
    }

    private ExplorationSession session(String id, Instant startedAt) {
        Clock clock = Clock.fixed(startedAt, ZoneOffset.UTC);
        KnowledgeTree tree = new KnowledgeTree(normalizer, clock);
        String root = tree.createRoot("Photosynthesis");
        tree.attachChild(root, "Calvin Cycle");
        tree.attachChild(root, "Light-Dependent Reactions");
        ExplorationSession session = new ExplorationSession(id, "alice", startedAt, ExplorationDepth.STANDARD, tree, Set.of("biology"));
        session.transition(root, startedAt);
        return session;
    }

    private ExplorationSession endedSession(String id) {
        return endedSession(id, T0);
    }

    private ExplorationSession endedSession(String id, Instant startedAt) {
        ExplorationSession session = session(id, startedAt);
        Instant end = startedAt.plusSeconds(30);
        session.recordDwell(session.getFocusedNodeId(), 30_000L);
        session.transition(null, end);
        session.end(end);
        return session;
    }

    private static SessionSummary summary(String id) {
        return SessionSummary.builder().sessionId(id).ownerRef("alice").build();
    }

    private static List<String> ids(Iterable<SessionSummary> summaries) {
        List<String> ids = new ArrayList<>();
        summaries.forEach(s -> ids.add(s.getSessionId()));
        return ids;
    }
}
