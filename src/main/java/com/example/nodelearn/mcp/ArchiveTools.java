package com.example.nodelearn.mcp;

import com.example.nodelearn.error.NodeLearnException;
import com.example.nodelearn.model.SessionSummary;
import com.example.nodelearn.service.ExplorationService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class ArchiveTools {

    private final ExplorationService explorationService;

    public ArchiveTools(ExplorationService explorationService) {
        this.explorationService = explorationService;
    }

    @Tool(description = "Search archived sessions by topic words, optionally restricted to sessions carrying all given tags")
    public Map<String, Object> archive_search(String query, List<String> tags) {
        Set<String> required = tags == null ? Set.of() : Set.copyOf(tags);
        try {
            return Map.of("sessionIds", explorationService.search(query, required));
        } catch (NodeLearnException e) {
            return e.toErrorMap();
        }
    }

    @Tool(description = "List an owner's archived sessions, most recent first (limit enforced)")
    public Map<String, Object> archive_listByOwner(String ownerRef, Integer limit) {
        int lim = (limit == null || limit <= 0) ? 20 : Math.min(limit, 200);
        try {
            List<SessionSummary> sessions = new ArrayList<>();
            for (SessionSummary summary : explorationService.listByOwner(ownerRef)) {
                if (sessions.size() >= lim) {
                    break;
                }
                sessions.add(summary);
            }
            return Map.of("sessions", sessions);
        } catch (NodeLearnException e) {
            return e.toErrorMap();
        }
    }

    @Tool(description = "Learning statistics of an owner: totals, hours, daily streak and favorite topics")
    public Map<String, Object> archive_ownerStats(String ownerRef) {
        try {
            return Map.of("stats", explorationService.ownerStats(ownerRef));
        } catch (NodeLearnException e) {
            return e.toErrorMap();
        }
    }
}
