package com.example.nodelearn.controller;

import com.example.nodelearn.archive.ArchiveSearch;
import com.example.nodelearn.kv.KvClient;
import com.example.nodelearn.service.ExplorationService;
import com.example.nodelearn.store.StoreClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final StoreClient storeClient;
    private final ExplorationService explorationService;
    private final ArchiveSearch archiveSearch;

    public HealthController(KvClient kvClient, StoreClient storeClient,
                            ExplorationService explorationService, ArchiveSearch archiveSearch) {
        this.kvClient = kvClient;
        this.storeClient = storeClient;
        this.explorationService = explorationService;
        this.archiveSearch = archiveSearch;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "nodelearn-engine");
        health.put("version", "0.1.0");
        health.put("activeSessions", explorationService.activeSessions().size());
        health.put("archivedSessionsIndexed", archiveSearch.size());

        // Test Redis connection
        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        // Test MongoDB connection
        try {
            storeClient.findSummariesByOwner("health-check", 0, 1);
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
