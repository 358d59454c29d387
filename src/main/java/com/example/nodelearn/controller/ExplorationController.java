package com.example.nodelearn.controller;

import com.example.nodelearn.model.ArchiveEntry;
import com.example.nodelearn.model.OwnerStats;
import com.example.nodelearn.model.SessionRecord;
import com.example.nodelearn.model.SessionSummary;
import com.example.nodelearn.model.SessionView;
import com.example.nodelearn.service.ExplorationService;
import com.example.nodelearn.suggest.ExplorationDepth;
import com.example.nodelearn.topic.Topic;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
public class ExplorationController {

    private final ExplorationService explorationService;

    public ExplorationController(ExplorationService explorationService) {
        this.explorationService = explorationService;
    }

    @PostMapping("/sessions")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionView start(@RequestBody StartSessionRequest request) {
        String sessionId = explorationService.start(
                request.getOwnerRef(), request.getSeedTopic(), request.getTags(), request.getDepth()).getSessionId();
        return explorationService.view(sessionId);
    }

    @PostMapping("/sessions/document")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionView startFromDocument(@RequestParam String ownerRef,
                                         @RequestParam(required = false) Set<String> tags,
                                         @RequestParam(required = false) ExplorationDepth depth,
                                         @RequestHeader(HttpHeaders.CONTENT_TYPE) String mimeType,
                                         @RequestBody byte[] document) {
        String sessionId = explorationService.startFromDocument(ownerRef, document, mimeType, tags, depth).getSessionId();
        return explorationService.view(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/nodes/{nodeId}/expand")
    public Mono<Map<String, Object>> expand(@PathVariable String sessionId, @PathVariable String nodeId) {
        // waits on the suggestion provider
        return Mono.fromCallable(() -> {
            List<Topic> accepted = explorationService.expand(sessionId, nodeId);
            return Map.<String, Object>of("nodeId", nodeId, "accepted", accepted);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/sessions/{sessionId}/nodes/{nodeId}/explanation")
    public Mono<Map<String, Object>> explain(@PathVariable String sessionId, @PathVariable String nodeId) {
        return Mono.fromCallable(() -> Map.<String, Object>of(
                        "nodeId", nodeId,
                        "explanation", explorationService.explain(sessionId, nodeId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions/{sessionId}/focus/{nodeId}")
    public Map<String, Object> focus(@PathVariable String sessionId, @PathVariable String nodeId) {
        explorationService.focus(sessionId, nodeId);
        return Map.of("ok", true, "focusedNodeId", nodeId);
    }

    @PostMapping("/sessions/{sessionId}/blur")
    public Map<String, Object> blur(@PathVariable String sessionId) {
        explorationService.blur(sessionId);
        return Map.of("ok", true);
    }

    @DeleteMapping("/sessions/{sessionId}/nodes/{nodeId}")
    public Map<String, Object> removeSubtree(@PathVariable String sessionId, @PathVariable String nodeId) {
        return Map.of("removed", explorationService.removeSubtree(sessionId, nodeId));
    }

    @PostMapping("/sessions/{sessionId}/reset")
    public Map<String, Object> reset(@PathVariable String sessionId, @RequestBody Map<String, String> body) {
        return Map.of("rootId", explorationService.reset(sessionId, body.get("topic")));
    }

    @GetMapping("/sessions/{sessionId}/tree")
    public SessionView tree(@PathVariable String sessionId) {
        return explorationService.view(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/end")
    public Mono<ArchiveEntry> end(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> explorationService.end(sessionId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/archive/{sessionId}/resume")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SessionView> resume(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> explorationService.view(explorationService.resume(sessionId).getSessionId()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/archive/{sessionId}")
    public Mono<SessionRecord> archived(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> explorationService.archived(sessionId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/archive/search")
    public Map<String, Object> search(@RequestParam(name = "q", defaultValue = "") String query,
                                      @RequestParam(required = false) Set<String> tags) {
        return Map.of("sessionIds", explorationService.search(query, tags));
    }

    @GetMapping("/owners/{ownerRef}/sessions")
    public Flux<SessionSummary> listByOwner(@PathVariable String ownerRef,
                                            @RequestParam(defaultValue = "50") int limit) {
        return Flux.fromIterable(explorationService.listByOwner(ownerRef))
                .take(limit)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/owners/{ownerRef}/stats")
    public Mono<OwnerStats> ownerStats(@PathVariable String ownerRef) {
        return Mono.fromCallable(() -> explorationService.ownerStats(ownerRef))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
