package com.example.nodelearn.service;

import com.example.nodelearn.error.ExpansionInProgressException;
import com.example.nodelearn.error.InvalidSessionStateException;
import com.example.nodelearn.error.NodeLearnException;
import com.example.nodelearn.error.SuggestionProviderException;
import com.example.nodelearn.suggest.DuplicatePolicy;
import com.example.nodelearn.suggest.ExplanationRequest;
import com.example.nodelearn.suggest.SuggestionCandidate;
import com.example.nodelearn.suggest.SuggestionProvider;
import com.example.nodelearn.suggest.SuggestionRequest;
import com.example.nodelearn.topic.Topic;
import com.example.nodelearn.topic.TopicNormalizer;
import com.example.nodelearn.tree.AttachResult;
import com.example.nodelearn.tree.KnowledgeNode;
import com.example.nodelearn.tree.KnowledgeTree;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Expands a node by asking the {@link SuggestionProvider} for related topics and merging the
 * acceptable ones into the session's tree.
 *
 * <p>Expansion is all-or-nothing: the whole candidate batch is validated before the first child is
 * attached, and provider failures or timeouts leave the tree untouched. Only one expansion may run
 * per session at a time.</p>
 */
@Service
public class SuggestionMerger {

    private static final Logger logger = LoggerFactory.getLogger(SuggestionMerger.class);

    private final SuggestionProvider provider;
    private final TopicNormalizer normalizer;
    private final Clock clock;
    private final ExecutorService providerExecutor;

    @Value("${app.suggestions.max-results:5}")
    private int maxResults;

    @Value("${app.suggestions.timeout-ms:10000}")
    private long timeoutMs;

    @Value("${app.suggestions.duplicate-policy:SKIP}")
    private DuplicatePolicy duplicatePolicy;

    // empty = offered topics are never re-offered for the same node
    @Value("${app.suggestions.seen-retention:}")
    private String seenRetention;

    public SuggestionMerger(SuggestionProvider provider, TopicNormalizer normalizer, Clock clock) {
        this.provider = provider;
        this.normalizer = normalizer;
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.providerExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "suggestion-provider-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return topics newly attached under {@code nodeId}, in provider rank order
     * @throws ExpansionInProgressException if another expansion of this session is outstanding
     * @throws SuggestionProviderException  if the provider fails, times out or returns malformed output
     */
    public List<Topic> expand(ExplorationSession session, String nodeId) {
        if (!session.isActive()) {
            throw new InvalidSessionStateException("Session " + session.getSessionId() + " has ended");
        }
        if (!session.getExpansionLock().tryLock()) {
            throw new ExpansionInProgressException("An expansion is already running in session " + session.getSessionId());
        }
        try {
            return doExpand(session, nodeId);
        } finally {
            session.getExpansionLock().unlock();
        }
    }

    /**
     * Asks the provider for a longer explanation of one node's topic. The tree is not changed, so
     * this may run while an expansion of the same session is outstanding.
     *
     * @throws SuggestionProviderException if the provider fails, times out or returns no text
     */
    public String explain(ExplorationSession session, String nodeId) {
        ExplanationRequest request;
        session.getStateLock().lock();
        try {
            List<String> contextPath = contextPath(session.getTree(), nodeId);
            request = ExplanationRequest.builder()
                    .topic(session.getTree().getNode(nodeId).getTopic().getDisplay())
                    .contextPath(contextPath)
                    .build();
        } finally {
            session.getStateLock().unlock();
        }
        logger.debug("Explaining {} ('{}') in session {}", nodeId, request.getTopic(), session.getSessionId());
        return callProvider(request.getTopic(), () -> provider.explain(request));
    }

    private List<Topic> doExpand(ExplorationSession session, String nodeId) {
        KnowledgeTree tree = session.getTree();
        SuggestionRequest request;
        session.getStateLock().lock();
        try {
            KnowledgeNode node = tree.getNode(nodeId);
            List<String> contextPath = contextPath(tree, nodeId);
            request = SuggestionRequest.builder()
                    .topic(node.getTopic().getDisplay())
                    .contextPath(contextPath)
                    .maxResults(session.getDepth() != null ? session.getDepth().getMaxResults() : maxResults)
                    .build();
        } finally {
            session.getStateLock().unlock();
        }

        logger.debug("Expanding {} ('{}') in session {}", nodeId, request.getTopic(), session.getSessionId());
        List<SuggestionCandidate> candidates = callProvider(request.getTopic(), () -> provider.suggest(request));
        validateBatch(candidates);

        List<Topic> accepted;
        session.getStateLock().lock();
        try {
            accepted = merge(session, tree.getNode(nodeId), candidates);
        } finally {
            session.getStateLock().unlock();
        }

        logger.info("Expanded {} in session {}: {} candidates, {} accepted",
                nodeId, session.getSessionId(), candidates.size(), accepted.size());
        return accepted;
    }

    private List<Topic> merge(ExplorationSession session, KnowledgeNode node, List<SuggestionCandidate> candidates) {
        KnowledgeTree tree = session.getTree();
        Instant now = clock.instant();
        Instant cutoff = retentionCutoff(now);
        List<SuggestionCandidate> survivors = filter(tree, node, candidates, cutoff);
        List<Topic> accepted = attachAll(tree, node.getId(), survivors);

        // re-offering a topic does not extend its retention
        for (SuggestionCandidate candidate : candidates) {
            String key = normalizer.canonicalKey(candidate.getCandidateTopic());
            if (!key.isEmpty() && !node.hasSeen(key, cutoff)) {
                node.markSeen(key, now);
            }
        }
        session.touch(now);
        return accepted;
    }

    private <T> T callProvider(String topic, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, providerExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Suggestion provider timed out for '{}' after {}ms", topic, timeoutMs);
            throw new SuggestionProviderException("Suggestion provider timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SuggestionProviderException) {
                throw (SuggestionProviderException) cause;
            }
            throw new SuggestionProviderException("Suggestion provider failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SuggestionProviderException("Interrupted while waiting for the suggestion provider", e);
        }
    }

    // display names from the root down to the parent of nodeId
    private static List<String> contextPath(KnowledgeTree tree, String nodeId) {
        List<Topic> path = tree.pathTo(nodeId);
        List<String> contextPath = new ArrayList<>();
        for (Topic t : path.subList(0, path.size() - 1)) {
            contextPath.add(t.getDisplay());
        }
        return contextPath;
    }

    private static void validateBatch(List<SuggestionCandidate> candidates) {
        if (candidates == null) {
            throw new SuggestionProviderException("Suggestion provider returned no candidate list");
        }
        for (SuggestionCandidate candidate : candidates) {
            if (candidate == null || candidate.getCandidateTopic() == null) {
                throw new SuggestionProviderException("Suggestion provider returned a candidate without a topic");
            }
        }
    }

    private List<SuggestionCandidate> filter(KnowledgeTree tree, KnowledgeNode node,
                                             List<SuggestionCandidate> candidates, Instant cutoff) {
        List<SuggestionCandidate> survivors = new ArrayList<>();
        Set<String> batchKeys = new HashSet<>();
        for (SuggestionCandidate candidate : candidates) {
            String key = normalizer.canonicalKey(candidate.getCandidateTopic());
            if (key.isEmpty()) {
                logger.warn("Dropping blank candidate '{}' for {}", candidate.getCandidateTopic(), node.getId());
                continue;
            }
            if (!batchKeys.add(key) || node.hasSeen(key, cutoff)) {
                continue;
            }
            Topic topic = normalizer.normalize(candidate.getCandidateTopic());
            if (tree.isOnPathToRoot(node.getId(), topic)) {
                continue;
            }
            String existing = tree.findByTopic(topic).orElse(null);
            if (existing != null) {
                boolean alreadyLinked = node.getChildren().contains(existing) || node.getCrossLinks().contains(existing);
                if (duplicatePolicy == DuplicatePolicy.SKIP || alreadyLinked) {
                    continue;
                }
            }
            survivors.add(candidate);
        }
        return survivors;
    }

    private List<Topic> attachAll(KnowledgeTree tree, String nodeId, List<SuggestionCandidate> survivors) {
        List<AttachResult> applied = new ArrayList<>();
        List<Topic> accepted = new ArrayList<>();
        try {
            for (SuggestionCandidate candidate : survivors) {
                AttachResult result = tree.attachChild(nodeId, candidate.getCandidateTopic(), candidate.getRationale());
                applied.add(result);
                accepted.add(tree.getNode(result.getNodeId()).getTopic());
            }
        } catch (NodeLearnException e) {
            logger.error("Attaching suggestions under {} failed, rolling back {} changes", nodeId, applied.size(), e);
            rollback(tree, nodeId, applied);
            throw e;
        }
        return accepted;
    }

    private static void rollback(KnowledgeTree tree, String nodeId, List<AttachResult> applied) {
        for (int i = applied.size() - 1; i >= 0; i--) {
            AttachResult result = applied.get(i);
            if (result.isCreated()) {
                tree.removeSubtree(result.getNodeId());
            } else if (result.isCrossLinked()) {
                tree.unlinkCrossLink(nodeId, result.getNodeId());
            }
        }
    }

    private Instant retentionCutoff(Instant now) {
        if (seenRetention == null || seenRetention.isBlank()) {
            return null;
        }
        return now.minus(Duration.parse(seenRetention));
    }

    @PreDestroy
    public void shutdown() {
        providerExecutor.shutdownNow();
    }
}
