package com.example.nodelearn.controller;

import com.example.nodelearn.error.ExpansionInProgressException;
import com.example.nodelearn.error.InvalidTimestampException;
import com.example.nodelearn.error.RootRemovalException;
import com.example.nodelearn.error.SessionNotFoundException;
import com.example.nodelearn.error.SuggestionProviderException;
import com.example.nodelearn.model.OwnerStats;
import com.example.nodelearn.model.SessionSummary;
import com.example.nodelearn.model.SessionView;
import com.example.nodelearn.service.ExplorationService;
import com.example.nodelearn.service.ExplorationSession;
import com.example.nodelearn.topic.TopicNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExplorationControllerTest {

    @Mock
    private ExplorationService explorationService;

    @Mock
    private ExplorationSession session;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new ExplorationController(explorationService))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testStart_ReturnsCreatedView() {
        // Given
        when(session.getSessionId()).thenReturn("s-1");
        when(explorationService.start(eq("alice"), eq("Photosynthesis"), any(), isNull())).thenReturn(session);
        when(explorationService.view("s-1")).thenReturn(
                SessionView.builder().sessionId("s-1").ownerRef("alice").active(true).build());

        // When / Then
        client.post().uri("/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ownerRef", "alice", "seedTopic", "Photosynthesis"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.sessionId").isEqualTo("s-1")
                .jsonPath("$.active").isEqualTo(true);
    }

    @Test
    void testExpand_ReturnsAcceptedTopics() {
        TopicNormalizer normalizer = new TopicNormalizer();
        when(explorationService.expand("s-1", "n1")).thenReturn(List.of(normalizer.normalize("Chlorophyll")));

        client.post().uri("/sessions/s-1/nodes/n1/expand")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.nodeId").isEqualTo("n1")
                .jsonPath("$.accepted[0].display").isEqualTo("Chlorophyll")
                .jsonPath("$.accepted[0].normalized").isEqualTo("chlorophyll");
    }

    @Test
    void testExpand_ProviderDown_Returns503Retryable() {
        when(explorationService.expand("s-1", "n1")).thenThrow(new SuggestionProviderException("timed out"));

        client.post().uri("/sessions/s-1/nodes/n1/expand")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.isError").isEqualTo(true)
                .jsonPath("$.error.kind").isEqualTo("TRANSIENT")
                .jsonPath("$.error.code").isEqualTo("SUGGESTION_PROVIDER")
                .jsonPath("$.error.retryable").isEqualTo(true);
    }

    @Test
    void testExpand_AlreadyRunning_Returns409() {
        when(explorationService.expand("s-1", "n1")).thenThrow(new ExpansionInProgressException("busy"));

        client.post().uri("/sessions/s-1/nodes/n1/expand")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error.kind").isEqualTo("CONCURRENCY");
    }

    @Test
    void testFocus_OutOfOrder_Returns400() {
        doThrow(new InvalidTimestampException("late")).when(explorationService).focus("s-1", "n2");

        client.post().uri("/sessions/s-1/focus/n2")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("INVALID_TIMESTAMP");
    }

    @Test
    void testTree_UnknownSession_Returns404() {
        when(explorationService.view("nope")).thenThrow(new SessionNotFoundException("No active session: nope"));

        client.get().uri("/sessions/nope/tree")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void testRemoveRoot_Returns409() {
        when(explorationService.removeSubtree("s-1", "n1")).thenThrow(new RootRemovalException("root"));

        client.delete().uri("/sessions/s-1/nodes/n1")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("ROOT_REMOVAL");
    }

    @Test
    void testSearch_PassesQueryAndTags() {
        when(explorationService.search("neural networks", Set.of("ai"))).thenReturn(List.of("s-ai"));

        client.get().uri(uri -> uri.path("/archive/search")
                        .queryParam("q", "neural networks")
                        .queryParam("tags", "ai")
                        .build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sessionIds[0]").isEqualTo("s-ai");
    }

    @Test
    void testListByOwner_HonoursLimit() {
        when(explorationService.listByOwner("alice")).thenReturn(List.of(
                SessionSummary.builder().sessionId("a").build(),
                SessionSummary.builder().sessionId("b").build(),
                SessionSummary.builder().sessionId("c").build()));

        client.get().uri("/owners/alice/sessions?limit=2")
                .exchange()
                .expectStatus().isOk()
                .expectBodyList(SessionSummary.class)
                .hasSize(2);
    }

    @Test
    void testListByOwner_EmitsSummariesInStoreOrder() {
        // Given
        when(explorationService.listByOwner("alice")).thenReturn(List.of(
                SessionSummary.builder().sessionId("a").build(),
                SessionSummary.builder().sessionId("b").build(),
                SessionSummary.builder().sessionId("c").build()));

        // When
        Flux<SessionSummary> summaries = new ExplorationController(explorationService).listByOwner("alice", 2);

        // Then
        StepVerifier.create(summaries.map(SessionSummary::getSessionId))
                .expectNext("a", "b")
                .verifyComplete();
    }

    @Test
    void testExplain_ReturnsMarkdown() {
        when(explorationService.explain("s-1", "n2")).thenReturn("# Chlorophyll");

        client.get().uri("/sessions/s-1/nodes/n2/explanation")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.nodeId").isEqualTo("n2")
                .jsonPath("$.explanation").isEqualTo("# Chlorophyll");
    }

    @Test
    void testExplain_ProviderDown_Returns503() {
        when(explorationService.explain("s-1", "n2")).thenThrow(new SuggestionProviderException("timed out"));

        client.get().uri("/sessions/s-1/nodes/n2/explanation")
                .exchange()
                .expectStatus().isEqualTo(503);
    }

    @Test
    void testOwnerStats_ReturnsStats() {
        when(explorationService.ownerStats("alice")).thenReturn(OwnerStats.builder()
                .ownerRef("alice").sessionCount(3).streakDays(2).favoriteTopics(List.of("Photosynthesis")).build());

        StepVerifier.create(new ExplorationController(explorationService).ownerStats("alice"))
                .assertNext(stats -> {
                    assertEquals(3, stats.getSessionCount());
                    assertEquals(2, stats.getStreakDays());
                })
                .verifyComplete();

        client.get().uri("/owners/alice/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ownerRef").isEqualTo("alice")
                .jsonPath("$.favoriteTopics[0]").isEqualTo("Photosynthesis");
    }
}
