package com.example.nodelearn.mcp;

import com.example.nodelearn.error.NodeNotFoundException;
import com.example.nodelearn.error.SuggestionProviderException;
import com.example.nodelearn.model.OwnerStats;
import com.example.nodelearn.model.SessionSummary;
import com.example.nodelearn.service.ExplorationService;
import com.example.nodelearn.topic.TopicNormalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExplorationToolsTest {

    @Mock
    private ExplorationService explorationService;

    @InjectMocks
    private ExplorationTools explorationTools;

    @InjectMocks
    private ArchiveTools archiveTools;

    @Test
    void testTreeExpand_ReturnsAcceptedDisplayNames() {
        // Given
        TopicNormalizer normalizer = new TopicNormalizer();
        when(explorationService.expand("s-1", "n1"))
                .thenReturn(List.of(normalizer.normalize("Chlorophyll"), normalizer.normalize("Calvin  Cycle")));

        // When
        Map<String, Object> result = explorationTools.tree_expand("s-1", "n1");

        // Then
        assertEquals("n1", result.get("nodeId"));
        assertEquals(List.of("Chlorophyll", "Calvin Cycle"), result.get("accepted"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testTreeExpand_FailureBecomesErrorMap() {
        when(explorationService.expand("s-1", "n9")).thenThrow(new NodeNotFoundException("Node not found: n9"));

        Map<String, Object> result = explorationTools.tree_expand("s-1", "n9");

        assertEquals(true, result.get("isError"));
        Map<String, Object> error = (Map<String, Object>) result.get("error");
        assertEquals("STRUCTURAL", error.get("kind"));
        assertEquals("NODE_NOT_FOUND", error.get("code"));
        assertEquals(false, error.get("retryable"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListByOwner_ClampsLimit() {
        // Given
        List<SessionSummary> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(SessionSummary.builder().sessionId("s-" + i).build());
        }
        when(explorationService.listByOwner("alice")).thenReturn(history);

        // When
        Map<String, Object> defaulted = archiveTools.archive_listByOwner("alice", null);
        Map<String, Object> limited = archiveTools.archive_listByOwner("alice", 5);

        // Then
        assertEquals(20, ((List<SessionSummary>) defaulted.get("sessions")).size());
        assertEquals(5, ((List<SessionSummary>) limited.get("sessions")).size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCapabilitiesList_NamesEveryTool() {
        Map<String, Object> capabilities = new CapabilitiesTools().capabilities_list();

        List<String> tools = (List<String>) capabilities.get("tools");
        assertTrue(tools.containsAll(List.of("tree_expand", "tree_explain", "tree_snapshot",
                "archive_search", "archive_listByOwner", "archive_ownerStats")));
    }

    @Test
    void testTreeExplain_ReturnsExplanation() {
        when(explorationService.explain("s-1", "n2")).thenReturn("# Chlorophyll\nA green pigment.");

        Map<String, Object> result = explorationTools.tree_explain("s-1", "n2");

        assertEquals("n2", result.get("nodeId"));
        assertEquals("# Chlorophyll\nA green pigment.", result.get("explanation"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testTreeExplain_ProviderDownBecomesRetryableError() {
        when(explorationService.explain("s-1", "n2")).thenThrow(new SuggestionProviderException("timed out"));

        Map<String, Object> result = explorationTools.tree_explain("s-1", "n2");

        assertEquals(true, result.get("isError"));
        assertEquals(true, ((Map<String, Object>) result.get("error")).get("retryable"));
    }

    @Test
    void testOwnerStats_WrapsStats() {
        OwnerStats stats = OwnerStats.builder().ownerRef("alice").sessionCount(4).streakDays(2).build();
        when(explorationService.ownerStats("alice")).thenReturn(stats);

        Map<String, Object> result = archiveTools.archive_ownerStats("alice");

        assertSame(stats, result.get("stats"));
    }
}
