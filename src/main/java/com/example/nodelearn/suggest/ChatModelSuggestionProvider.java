package com.example.nodelearn.suggest;

import com.example.nodelearn.error.SuggestionProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Suggestion provider backed by a Spring AI {@link ChatModel}.
 * The model is asked for a JSON list of related concepts, which is parsed in rank order.
 */
@Service
@Slf4j
public class ChatModelSuggestionProvider implements SuggestionProvider {

    private static final String SYSTEM_MESSAGE = """
            You are a helpful assistant that maps out knowledge for a learner.
            Given a topic and the path of topics that led to it, name closely related concepts
            the learner should explore next. Prefer concrete sub-concepts over broad fields.
            Do not repeat the topic itself or any topic on the path. No historical context.

            Return ONLY a JSON object with this structure and no additional text:
            {
              "related_concepts": [
                {"name": "Related concept", "relation": "How it relates to the topic"}
              ]
            }
            """;

    private static final String EXPLAIN_SYSTEM_MESSAGE =
            "You are a helpful assistant that provides clear educational content.";

    private static final String EXPLAIN_OUTLINE = """
            Include:
            - A clear definition or introduction
            - Key concepts and principles
            - Important applications or examples
            - Historical context if relevant

            Format your response in markdown for readability.
            """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public ChatModelSuggestionProvider(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        log.info("ChatModelSuggestionProvider initialized with ChatModel: {}", chatModel.getClass().getSimpleName());
    }

    @Override
    public List<SuggestionCandidate> suggest(SuggestionRequest request) {
        String text = call(request.getTopic(), SYSTEM_MESSAGE, buildUserMessage(request));

        List<SuggestionCandidate> candidates = parseCandidates(text);
        log.debug("Model suggested {} candidates for '{}'", candidates.size(), request.getTopic());
        return candidates.size() > request.getMaxResults()
                ? candidates.subList(0, request.getMaxResults())
                : candidates;
    }

    @Override
    public String explain(ExplanationRequest request) {
        String text = call(request.getTopic(), EXPLAIN_SYSTEM_MESSAGE, buildExplainMessage(request));
        if (text == null || text.isBlank()) {
            throw new SuggestionProviderException("Model returned an empty explanation for '" + request.getTopic() + "'");
        }
        log.debug("Model explained '{}' in {} chars", request.getTopic(), text.length());
        return text.strip();
    }

    private String call(String topic, String systemMessage, String userMessage) {
        List<Message> messages = List.of(
                new SystemMessage(systemMessage),
                new UserMessage(userMessage));
        try {
            ChatResponse response = chatModel.call(new Prompt(messages));
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw new SuggestionProviderException("Model returned no result for '" + topic + "'");
            }
            return response.getResult().getOutput().getText();
        } catch (SuggestionProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Model request failed for topic '{}'", topic, e);
            throw new SuggestionProviderException("Suggestion provider unreachable: " + e.getMessage(), e);
        }
    }

    String buildUserMessage(SuggestionRequest request) {
        String path = request.getContextPath() == null || request.getContextPath().isEmpty()
                ? "(none, this is the starting topic)"
                : String.join(" > ", request.getContextPath());
        return String.format(
                "Topic: %s\nPath from the starting topic: %s\nReturn up to %d related concepts.",
                request.getTopic(), path, request.getMaxResults());
    }

    String buildExplainMessage(ExplanationRequest request) {
        StringBuilder message = new StringBuilder()
                .append("Provide a detailed explanation of the topic \"").append(request.getTopic()).append("\".\n");
        if (request.getContextPath() != null && !request.getContextPath().isEmpty()) {
            message.append("The learner reached it through: ")
                    .append(String.join(" > ", request.getContextPath())).append(".\n");
        }
        return message.append(EXPLAIN_OUTLINE).toString();
    }

    /**
     * Accepts either {@code {"related_concepts": [...]}} or a bare array, optionally wrapped in a
     * Markdown code fence.
     */
    List<SuggestionCandidate> parseCandidates(String text) {
        if (text == null || text.isBlank()) {
            throw new SuggestionProviderException("Model returned an empty response");
        }
        String json = stripCodeFence(text.strip());

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SuggestionProviderException("Model response is not valid JSON", e);
        }

        JsonNode concepts = root.isArray() ? root : root.path("related_concepts");
        if (!concepts.isArray()) {
            throw new SuggestionProviderException("Model response has no related_concepts array");
        }

        List<SuggestionCandidate> candidates = new ArrayList<>();
        for (JsonNode concept : concepts) {
            if (concept.isTextual()) {
                candidates.add(SuggestionCandidate.of(concept.asText()));
            } else if (concept.hasNonNull("name")) {
                String relation = concept.hasNonNull("relation") ? concept.get("relation").asText() : null;
                candidates.add(new SuggestionCandidate(concept.get("name").asText(), relation));
            } else {
                throw new SuggestionProviderException("Related concept without a name: " + concept);
            }
        }
        return candidates;
    }

    private static String stripCodeFence(String text) {
        String json = text;
        if (json.startsWith("```")) {
            int firstNewline = json.indexOf('\n');
            json = firstNewline < 0 ? "" : json.substring(firstNewline + 1);
        }
        if (json.endsWith("```")) {
            json = json.substring(0, json.length() - 3);
        }
        return json.strip();
    }
}
