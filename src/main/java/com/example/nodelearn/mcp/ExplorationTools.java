package com.example.nodelearn.mcp;

import com.example.nodelearn.error.NodeLearnException;
import com.example.nodelearn.service.ExplorationService;
import com.example.nodelearn.topic.Topic;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class ExplorationTools {

    private final ExplorationService explorationService;

    public ExplorationTools(ExplorationService explorationService) {
        this.explorationService = explorationService;
    }

    @Tool(description = "Expand a node of an active session with AI-suggested related topics")
    public Map<String, Object> tree_expand(String sessionId, String nodeId) {
        try {
            List<Topic> accepted = explorationService.expand(sessionId, nodeId);
            Map<String, Object> result = new HashMap<>();
            result.put("nodeId", nodeId);
            result.put("accepted", accepted.stream().map(Topic::getDisplay).collect(Collectors.toList()));
            return result;
        } catch (NodeLearnException e) {
            return e.toErrorMap();
        }
    }

    @Tool(description = "Explain the topic of a node in an active session, as Markdown")
    public Map<String, Object> tree_explain(String sessionId, String nodeId) {
        try {
            return Map.of("nodeId", nodeId, "explanation", explorationService.explain(sessionId, nodeId));
        } catch (NodeLearnException e) {
            return e.toErrorMap();
        }
    }

    @Tool(description = "Get the tree structure and per-node dwell time of an active session")
    public Map<String, Object> tree_snapshot(String sessionId) {
        try {
            var view = explorationService.view(sessionId);
            return Map.of(
                    "sessionId", view.getSessionId(),
                    "tree", view.getTree(),
                    "perNodeDwell", view.getPerNodeDwell()
            );
        } catch (NodeLearnException e) {
            return e.toErrorMap();
        }
    }
}
